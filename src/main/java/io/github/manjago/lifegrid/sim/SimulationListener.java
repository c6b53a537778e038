package io.github.manjago.lifegrid.sim;

/**
 * Listener for host-loop events.
 *
 * Implement this interface to react to a running simulation,
 * for example to print progress or collect snapshots in a test.
 */
public interface SimulationListener {

    /**
     * Called after every tick.
     *
     * @param snapshot state after the tick
     */
    default void onTick(TickSnapshot snapshot) {}

    /**
     * Called periodically with progress statistics.
     *
     * @param stats current statistics
     */
    default void onProgress(SimulationStats stats) {}

    /**
     * No-op listener that does nothing.
     */
    SimulationListener NOOP = new SimulationListener() {};
}
