package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;

/**
 * Receives births, deaths and reproduction telemetry, and feeds population-level
 * signals back into reproduction.
 *
 * All methods have no-op defaults, so a collector implements only what it needs.
 */
public interface StatsCollector {

    /**
     * An organism was put on the grid, by birth, seeding or host placement.
     */
    default void onEnter(Organism organism) {}

    /**
     * An organism left the grid, by death or host removal.
     */
    default void onLeave(Organism organism) {}

    default void onBirth(BirthDetails birth) {}

    default void onDeath(Organism organism, DeathDetails details, long tick) {}

    default void recordMateChoice(MateChoice choice) {}

    default void recordReproductionBlocked(ReproductionBlock block) {}

    /**
     * Called by the simulation at the end of every tick.
     */
    default void onTickEnd(long tick, int population, double scarcity) {}

    /**
     * Latest population scarcity signal in [0, 1].
     */
    default double scarcity() { return 0.0; }

    /**
     * How strongly the population needs more genetic diversity, in [0, 1].
     */
    default double diversityPressure() { return 0.0; }

    /**
     * How evenly conflict strategies are spread across the population, in [0, 1].
     */
    default double behavioralEvenness() { return 1.0; }

    /**
     * Collector that records nothing.
     */
    StatsCollector NOOP = new StatsCollector() {};
}
