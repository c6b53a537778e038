package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;

/**
 * Tunables that a host may change between ticks.
 *
 * {@link #from(SimulationConfig)} gives the configured values; the
 * {@code with*} methods derive adjusted copies.
 */
public record TickOptions(
    double societySimilarity,
    double enemySimilarity,
    double eventStrengthMultiplier,
    double eventFrequencyMultiplier,
    int maxConcurrentEvents,
    double densityEffectMultiplier,
    double mutationMultiplier,
    double diversityThreshold,
    double lowDiversityMultiplier,
    double regenRate,
    double diffusionRate
) {

    public static TickOptions from(SimulationConfig config) {
        return new TickOptions(
            config.societySimilarity(),
            config.enemySimilarity(),
            config.eventStrengthMultiplier(),
            config.eventFrequencyMultiplier(),
            config.maxConcurrentEvents(),
            config.densityEffectMultiplier(),
            config.mutationMultiplier(),
            config.diversityThreshold(),
            config.lowDiversityMultiplier(),
            config.regenRate(),
            config.diffusionRate()
        );
    }

    public TickOptions withEvents(double strengthMultiplier, double frequencyMultiplier, int maxConcurrent) {
        return new TickOptions(societySimilarity, enemySimilarity, strengthMultiplier, frequencyMultiplier,
                maxConcurrent, densityEffectMultiplier, mutationMultiplier, diversityThreshold,
                lowDiversityMultiplier, regenRate, diffusionRate);
    }

    public TickOptions withDiversity(double threshold, double lowDiversityMultiplier) {
        return new TickOptions(societySimilarity, enemySimilarity, eventStrengthMultiplier,
                eventFrequencyMultiplier, maxConcurrentEvents, densityEffectMultiplier, mutationMultiplier,
                threshold, lowDiversityMultiplier, regenRate, diffusionRate);
    }

    public TickOptions withSimilarity(double society, double enemy) {
        return new TickOptions(society, enemy, eventStrengthMultiplier, eventFrequencyMultiplier,
                maxConcurrentEvents, densityEffectMultiplier, mutationMultiplier, diversityThreshold,
                lowDiversityMultiplier, regenRate, diffusionRate);
    }
}
