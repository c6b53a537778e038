package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Numbers;
import io.github.manjago.lifegrid.core.Organism;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default stats collector: running counters plus the two population signals
 * reproduction depends on.
 *
 * Diversity pressure rises when recent matings are between genomes less
 * diverse than the configured threshold: it is the relative shortfall of an
 * exponential moving average of mate diversity below that threshold.
 *
 * Behavioural evenness is the normalised Shannon entropy of the population's
 * dominant conflict strategy (avoid, fight, cooperate).
 */
public class RunningStats implements StatsCollector {

    private static final double EMA_ALPHA = 0.05;
    private static final double LN3 = Math.log(3);

    private final double diversityTarget;

    private long births;
    private final Map<BirthDetails.Origin, Long> birthsByOrigin = new EnumMap<>(BirthDetails.Origin.class);
    private final Map<DeathCause, Long> deathsByCause = new EnumMap<>(DeathCause.class);
    private final Map<BlockReason, Long> blocked = new EnumMap<>(BlockReason.class);
    private long mateChoices;
    private long successfulMatings;
    private long curiosityChoices;

    private double diversityEma = Double.NaN;
    private double lastScarcity;
    private int lastPopulation;
    private int peakPopulation;

    // Organisms on the grid per dominant strategy
    private final long[] strategyCounts = new long[3];

    public RunningStats(double diversityTarget) {
        this.diversityTarget = Numbers.clamp(Numbers.finiteOr(diversityTarget, 0.45), 0.01, 1);
    }

    @Override
    public void onEnter(Organism organism) {
        strategyCounts[organism.getInteractionGenes().dominantIndex()]++;
    }

    @Override
    public void onLeave(Organism organism) {
        int idx = organism.getInteractionGenes().dominantIndex();
        if (strategyCounts[idx] > 0) strategyCounts[idx]--;
    }

    @Override
    public void onBirth(BirthDetails birth) {
        births++;
        birthsByOrigin.merge(birth.origin(), 1L, Long::sum);
    }

    @Override
    public void onDeath(Organism organism, DeathDetails details, long tick) {
        deathsByCause.merge(details.cause(), 1L, Long::sum);
    }

    @Override
    public void recordMateChoice(MateChoice choice) {
        mateChoices++;
        if (choice.success()) successfulMatings++;
        if (choice.mode() == MateChoice.SelectionMode.CURIOSITY) curiosityChoices++;
        double diversity = choice.probability().diversity();
        diversityEma = Double.isNaN(diversityEma)
                ? diversity
                : diversityEma + EMA_ALPHA * (diversity - diversityEma);
    }

    @Override
    public void recordReproductionBlocked(ReproductionBlock block) {
        blocked.merge(block.reason(), 1L, Long::sum);
    }

    @Override
    public void onTickEnd(long tick, int population, double scarcity) {
        lastScarcity = scarcity;
        lastPopulation = population;
        peakPopulation = Math.max(peakPopulation, population);
    }

    @Override
    public double scarcity() {
        return lastScarcity;
    }

    @Override
    public double diversityPressure() {
        if (Double.isNaN(diversityEma)) return 0;
        return Numbers.clamp01((diversityTarget - diversityEma) / diversityTarget);
    }

    @Override
    public double behavioralEvenness() {
        long total = strategyCounts[0] + strategyCounts[1] + strategyCounts[2];
        if (total == 0) return 1.0;
        double entropy = 0;
        for (long count : strategyCounts) {
            if (count == 0) continue;
            double p = (double) count / total;
            entropy -= p * Math.log(p);
        }
        return Numbers.clamp01(entropy / LN3);
    }

    // ========== Getters ==========

    public long getBirths() { return births; }
    public long getBirths(BirthDetails.Origin origin) { return birthsByOrigin.getOrDefault(origin, 0L); }
    public long getDeaths(DeathCause cause) { return deathsByCause.getOrDefault(cause, 0L); }
    public long getBlocked(BlockReason reason) { return blocked.getOrDefault(reason, 0L); }
    public long getMateChoices() { return mateChoices; }
    public long getSuccessfulMatings() { return successfulMatings; }
    public long getCuriosityChoices() { return curiosityChoices; }
    public int getLastPopulation() { return lastPopulation; }
    public int getPeakPopulation() { return peakPopulation; }

    public long getTotalDeaths() {
        long total = 0;
        for (long n : deathsByCause.values()) total += n;
        return total;
    }

    public long getTotalBlocked() {
        long total = 0;
        for (long n : blocked.values()) total += n;
        return total;
    }

    /**
     * Mean diversity of recent matings, NaN before the first one.
     */
    public double getDiversityEma() {
        return diversityEma;
    }
}
