package io.github.manjago.lifegrid.cli;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.sim.GridSimulation;
import io.github.manjago.lifegrid.sim.SimulationListener;
import io.github.manjago.lifegrid.sim.SimulationRunner;
import io.github.manjago.lifegrid.sim.SimulationStats;
import io.github.manjago.lifegrid.sim.TickSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run simulation command.
 *
 * Examples:
 *   lifegrid run                          # Run with defaults
 *   lifegrid run -t 5000                  # Run 5K ticks
 *   lifegrid run -f my.conf               # Use custom config
 *   lifegrid run --rows 60 --cols 80 --seed 42
 */
@Command(
    name = "run",
    description = "Run a new simulation",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-t", "--ticks"}, description = "Max ticks (0 = infinite)")
    private Long maxTicks;

    @Option(names = {"--rows"}, description = "Grid rows")
    private Integer rows;

    @Option(names = {"--cols"}, description = "Grid columns")
    private Integer cols;

    @Option(names = {"--seed"}, description = "Random seed (0 = time based)")
    private Long seed;

    @Option(names = {"--report-interval"}, description = "Progress report interval (ticks)")
    private Integer reportInterval;

    @Option(names = {"--top"}, description = "Leaderboard size in the final report (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int top;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (minimal output)")
    private boolean quiet;

    @Override
    public Integer call() {
        SimulationConfig config = buildConfig();

        if (!quiet) {
            printBanner();
            printConfig(config);
        }

        GridSimulation simulation = new GridSimulation(config);
        SimulationRunner runner = new SimulationRunner(simulation);

        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (runner.isRunning()) {
                System.out.println("\n⏸️  Stopping gracefully...");
                runner.stop();
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }));

        if (!quiet) {
            runner.setListener(new ConsoleProgressListener());
            System.out.println("🌱 Seeding population...");
        }
        simulation.seedPopulation(config.effectiveInitialPopulation());

        if (!quiet) {
            System.out.println("▶️  Running simulation...\n");
        }

        long startTime = System.currentTimeMillis();
        runner.run(maxTicks != null ? maxTicks : 0);
        long elapsed = System.currentTimeMillis() - startTime;

        if (!quiet) {
            printFinalReport(simulation, elapsed);
        }

        return 0;
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║          LIFEGRID Simulator           ║");
        System.out.println("║      Grid Organism Evolution          ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }

    private void printConfig(SimulationConfig config) {
        System.out.println("Configuration:");
        System.out.printf("  Grid:            %d x %d%n", config.rows(), config.cols());
        System.out.printf("  Max tile energy: %.2f%n", config.maxTileEnergy());
        System.out.printf("  Population:      %,d initial%n", config.effectiveInitialPopulation());
        System.out.printf("  Max ticks:       %s%n",
                config.maxTicks() == 0 ? "∞ (infinite)" : String.format("%,d", config.maxTicks()));
        System.out.println();
    }

    private SimulationConfig buildConfig() {
        SimulationConfig.Builder builder = configFile != null
                ? SimulationConfig.fromFile(configFile).toBuilder()
                : SimulationConfig.builder();

        // Override from CLI options
        if (rows != null) builder.rows(rows);
        if (cols != null) builder.cols(cols);
        if (seed != null) builder.randomSeed(seed);
        if (maxTicks != null) builder.maxTicks(maxTicks);
        if (reportInterval != null) builder.reportInterval(reportInterval);

        return builder.build();
    }

    private void printFinalReport(GridSimulation simulation, long elapsedMs) {
        SimulationStats stats = simulation.getStats();
        double speed = stats.tick() * 1000.0 / Math.max(1, elapsedMs);

        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("         SIMULATION COMPLETE           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();

        System.out.printf("⏱️  Time: %s  |  Speed: %,.0f ticks/sec%n", formatDuration(elapsedMs), speed);
        System.out.printf("   Seed: %d%n", simulation.getSeed());
        System.out.println();

        System.out.println("👥 Population:");
        System.out.printf("   Alive: %,d  |  Peak: %,d  |  Minimum: %,d%n",
                stats.population(), stats.peakPopulation(), stats.minPopulation());
        System.out.printf("   Births: %,d (%,d seeded, %,d from decay pools)%n",
                stats.births(), stats.seeded(), stats.poolSpawns());
        System.out.printf("   Deaths: %,d old age, %,d starvation, %,d combat%n",
                stats.deathsBySenescence(), stats.deathsByStarvation(), stats.deathsByCombat());
        System.out.println();

        System.out.println("⚡ Energy:");
        System.out.printf("   Field: %.1f  |  Decay distributed: %.1f  |  Active pools: %,d%n",
                stats.fieldEnergy(), stats.decayDistributed(), stats.decayPools());
        System.out.println();

        printLeaderboard(simulation.getLastSnapshot());
        System.out.println("═══════════════════════════════════════");
    }

    private void printLeaderboard(TickSnapshot snapshot) {
        List<TickSnapshot.Entry> leaders = snapshot != null ? snapshot.leaderboard(top) : List.of();
        if (leaders.isEmpty()) {
            return;
        }
        System.out.println("🏆 Leaderboard:");
        int rank = 1;
        for (TickSnapshot.Entry e : leaders) {
            System.out.printf("   #%d  id %-6d fitness %6.2f (smoothed %6.2f)  offspring %,d  wins %,d  age %,d%n",
                    rank++, e.id(), e.fitness(), e.smoothedFitness(), e.offspring(), e.fightsWon(), e.age());
        }
        System.out.println();
    }

    private String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    /**
     * Console progress listener with live updates.
     */
    private static class ConsoleProgressListener implements SimulationListener {
        private static final String[] SPINNER = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};
        private int spinnerIdx = 0;

        @Override
        public void onProgress(SimulationStats stats) {
            String spinner = SPINNER[spinnerIdx++ % SPINNER.length];
            System.out.printf("\r%s Tick %,d  |  👥 %d alive  |  🐣 %d births  |  💀 %d deaths  |  🌪 %d events   ",
                    spinner,
                    stats.tick(),
                    stats.population(),
                    stats.births(),
                    stats.totalDeaths(),
                    stats.activeEvents());
            System.out.flush();
        }
    }
}
