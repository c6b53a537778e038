package io.github.manjago.lifegrid.sim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host loop around a {@link GridSimulation}.
 *
 * Ticks back to back until the tick budget is used up or {@link #stop()} is
 * called (typically from a shutdown hook). The stop flag is checked between
 * ticks, never inside one.
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final GridSimulation simulation;
    private final int reportInterval;

    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private SimulationListener listener = SimulationListener.NOOP;
    private TickOptions options;

    public SimulationRunner(GridSimulation simulation) {
        this.simulation = simulation;
        this.reportInterval = simulation.getConfig().reportInterval();
        this.options = simulation.getDefaultOptions();
    }

    public void setListener(SimulationListener listener) {
        this.listener = listener != null ? listener : SimulationListener.NOOP;
    }

    /**
     * Options used for the following ticks. May be changed while running.
     */
    public void setOptions(TickOptions options) {
        this.options = options != null ? options : simulation.getDefaultOptions();
    }

    /**
     * Run the simulation.
     *
     * @param ticks number of ticks to run (0 = use config.maxTicks, which may itself be 0 = infinite)
     * @return ticks actually run
     */
    public long run(long ticks) {
        long target = ticks > 0 ? ticks : simulation.getConfig().maxTicks();
        boolean infinite = target == 0;

        if (running.getAndSet(true)) {
            log.warn("Simulation already running");
            return 0;
        }

        stopRequested.set(false);
        log.info("Starting simulation{}", infinite ? " (infinite)" : String.format(" for %,d ticks", target));

        long startTime = System.currentTimeMillis();
        long ticksDone = 0;

        try {
            while (!stopRequested.get()) {
                if (!infinite && ticksDone >= target) {
                    break;
                }

                TickSnapshot snapshot = simulation.tick(options);
                ticksDone++;
                listener.onTick(snapshot);

                if (snapshot.tick() % reportInterval == 0) {
                    reportProgress(snapshot);
                }
            }
        } finally {
            running.set(false);
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Simulation stopped after {} ticks ({} ms, {} ticks/sec)",
                    ticksDone, elapsed, ticksDone * 1000 / Math.max(1, elapsed));
        }
        return ticksDone;
    }

    /**
     * Request graceful stop.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    public GridSimulation getSimulation() {
        return simulation;
    }

    private void reportProgress(TickSnapshot snapshot) {
        log.info("Tick {}: {} alive, energy {}, max fitness {}, scarcity {}",
                snapshot.tick(), snapshot.population(),
                String.format("%.1f", snapshot.totalEnergy()),
                String.format("%.2f", snapshot.maxFitness()),
                String.format("%.3f", snapshot.scarcity()));
        listener.onProgress(simulation.getStats());
    }
}
