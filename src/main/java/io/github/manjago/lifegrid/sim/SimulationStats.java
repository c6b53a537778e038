package io.github.manjago.lifegrid.sim;

/**
 * Snapshot of simulation statistics.
 */
public record SimulationStats(
    long tick,
    int population,
    int peakPopulation,
    int minPopulation,
    double scarcity,
    long births,
    long seeded,
    long poolSpawns,
    long deathsBySenescence,
    long deathsByStarvation,
    long deathsByCombat,
    long deathsExternal,
    long interactions,
    long failedInteractions,
    int activeEvents,
    int decayPools,
    double decayDistributed,
    double decayDropped,
    double fieldEnergy,
    long positionRepairs
) {

    public long totalDeaths() {
        return deathsBySenescence + deathsByStarvation + deathsByCombat + deathsExternal;
    }

    /**
     * Births per 1000 ticks.
     */
    public double birthRatePer1000() {
        return tick > 0 ? births * 1000.0 / tick : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Simulation Statistics ===
            Ticks:            %,d
            Population:
              Alive:          %,d
              Peak:           %,d
              Minimum:        %,d (scarcity %.3f)
            Births:           %,d (%.1f per 1K ticks)
              Seeded:         %,d
              From pools:     %,d
            Deaths:
              Senescence:     %,d
              Starvation:     %,d
              Combat:         %,d
              External:       %,d
              Total:          %,d
            Interactions:     %,d (%,d failed)
            Active events:    %d

            Energy:
              Field:          %.2f
              Decay pools:    %,d
              Distributed:    %.2f
              Dropped:        %.4f

            Position repairs: %,d
            """,
            tick,
            population,
            peakPopulation,
            minPopulation, scarcity,
            births, birthRatePer1000(),
            seeded,
            poolSpawns,
            deathsBySenescence,
            deathsByStarvation,
            deathsByCombat,
            deathsExternal,
            totalDeaths(),
            interactions, failedInteractions,
            activeEvents,
            fieldEnergy,
            decayPools,
            decayDistributed,
            decayDropped,
            positionRepairs
        );
    }
}
