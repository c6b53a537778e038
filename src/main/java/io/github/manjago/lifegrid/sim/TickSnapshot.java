package io.github.manjago.lifegrid.sim;

import java.util.Comparator;
import java.util.List;

/**
 * State of the population after a tick.
 *
 * Entries are in row-major order. Two runs with the same seed and the same
 * initial grid produce equal snapshot sequences.
 *
 * @param tick tick number, starting at 1
 * @param population living organisms
 * @param totalEnergy energy held by organisms
 * @param totalAge sum of organism ages
 * @param maxFitness best {@link Fitness} score, 0 for an empty grid
 * @param scarcity scarcity signal at the end of the tick
 * @param entries one entry per organism
 */
public record TickSnapshot(
    long tick,
    int population,
    double totalEnergy,
    long totalAge,
    double maxFitness,
    double scarcity,
    List<Entry> entries
) {

    private static final Comparator<Entry> RANKING = Comparator
            .comparingDouble(Entry::smoothedFitness).reversed()
            .thenComparing(Comparator.comparingDouble(Entry::fitness).reversed())
            .thenComparingLong(Entry::id);

    public TickSnapshot {
        entries = List.copyOf(entries);
    }

    /**
     * Best organisms by smoothed fitness, raw fitness breaking ties.
     *
     * @param topN how many to return; fewer when the population is smaller
     */
    public List<Entry> leaderboard(int topN) {
        if (topN <= 0) return List.of();
        return entries.stream()
                .filter(e -> Double.isFinite(e.fitness()))
                .sorted(RANKING)
                .limit(topN)
                .toList();
    }

    /**
     * @param fitness {@link Fitness} score this tick
     * @param smoothedFitness fitness averaged over the organism's snapshots
     */
    public record Entry(
        long id,
        int row,
        int col,
        double energy,
        int age,
        double fitness,
        double smoothedFitness,
        int offspring,
        int fightsWon
    ) {
    }
}
