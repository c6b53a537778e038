package io.github.manjago.lifegrid.sim;

/**
 * The factors that make up a pair's reproduction probability.
 *
 * @param similarity genetic similarity of the pair
 * @param diversity {@code 1 - similarity}
 * @param threshold pair diversity threshold
 * @param baseProbability organism-provided probability before shaping
 * @param penaltyMultiplier low-diversity penalty, in [floor, 1]
 * @param bonusMultiplier diversity and complementarity bonus, at least 1
 * @param scarcityMultiplier population scarcity bonus, at least 1
 * @param probability final probability in [0, 1]
 */
public record ProbabilityBreakdown(
    double similarity,
    double diversity,
    double threshold,
    double baseProbability,
    double penaltyMultiplier,
    double bonusMultiplier,
    double scarcityMultiplier,
    double probability
) {

    public boolean belowThreshold() {
        return diversity < threshold;
    }
}
