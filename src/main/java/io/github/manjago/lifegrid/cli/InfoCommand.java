package io.github.manjago.lifegrid.cli;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.sim.PopulationScarcityController;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about LifeGrid.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        SimulationConfig defaults = SimulationConfig.defaults();

        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              LIFEGRID                 ║");
        System.out.println("║      Grid Organism Simulation         ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(defaults);

        System.out.printf("Minimum population on the default grid: %,d%n",
                PopulationScarcityController.minPopulation(defaults.rows(), defaults.cols(),
                        defaults.minPopulationFloor()));
        System.out.printf("Initial population on the default grid: %,d%n", defaults.effectiveInitialPopulation());
        System.out.println();

        return 0;
    }
}
