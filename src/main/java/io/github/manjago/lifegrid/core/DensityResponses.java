package io.github.manjago.lifegrid.core;

/**
 * How an organism's behaviour shifts as its neighbourhood fills up.
 *
 * Every curve is a {@link Range}; callers interpolate with the effective
 * local density in [0, 1].
 *
 * @param reproduction multiplier on reproduction probability ({@code max} when empty, {@code min} when crowded)
 * @param fight        probability weight of choosing to fight
 * @param cooperate    probability weight of choosing to cooperate
 * @param energyLoss   multiplier on metabolic energy loss
 * @param enemyBias    extra chance of treating a neutral neighbour as an enemy
 */
public record DensityResponses(
    Range reproduction,
    Range fight,
    Range cooperate,
    Range energyLoss,
    Range enemyBias
) {

    public static final DensityResponses DEFAULT = new DensityResponses(
        new Range(0.6, 1.1),
        new Range(0.3, 0.6),
        new Range(0.3, 0.5),
        new Range(1.0, 1.3),
        new Range(0.02, 0.2)
    );

    /**
     * A closed interval with linear interpolation between its ends.
     */
    public record Range(double min, double max) {

        /** Value at {@code t}, interpolating from {@code min} (t = 0) to {@code max} (t = 1). */
        public double rising(double t) {
            return Numbers.lerp(min, max, Numbers.clamp01(t));
        }

        /** Value at {@code t}, interpolating from {@code max} (t = 0) to {@code min} (t = 1). */
        public double falling(double t) {
            return Numbers.lerp(max, min, Numbers.clamp01(t));
        }
    }
}
