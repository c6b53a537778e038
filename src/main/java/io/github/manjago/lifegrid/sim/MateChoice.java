package io.github.manjago.lifegrid.sim;

/**
 * Telemetry for one evaluated mating.
 *
 * @param focalId organism that initiated
 * @param partnerId chosen partner
 * @param mode how the partner was picked
 * @param poolSize number of candidates considered
 * @param probability breakdown of the reproduction chance
 * @param success whether an offspring was born
 * @param tick tick of the attempt
 */
public record MateChoice(
    long focalId,
    long partnerId,
    SelectionMode mode,
    int poolSize,
    ProbabilityBreakdown probability,
    boolean success,
    long tick
) {

    public enum SelectionMode {
        /** Weighted by preference score */
        PREFERENCE,

        /** Drawn from the most diverse candidates */
        CURIOSITY,

        /** Best preference score, used when weighting was not possible */
        FALLBACK
    }
}
