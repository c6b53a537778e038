package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a reproduction attempt. Never thrown, always returned.
 *
 * @param offspring the new organism, null unless born
 * @param partner the chosen partner, if any
 * @param block why the attempt was blocked, null if it was not
 * @param probability the evaluated probability, null if a gate failed before evaluation
 */
public record ReproductionOutcome(
    @Nullable Organism offspring,
    @Nullable Organism partner,
    @Nullable ReproductionBlock block,
    @Nullable ProbabilityBreakdown probability
) {

    public static ReproductionOutcome born(Organism offspring, Organism partner, ProbabilityBreakdown probability) {
        return new ReproductionOutcome(offspring, partner, null, probability);
    }

    public static ReproductionOutcome blocked(ReproductionBlock block, @Nullable Organism partner,
                                              @Nullable ProbabilityBreakdown probability) {
        return new ReproductionOutcome(null, partner, block, probability);
    }

    /** The chance roll failed: nothing is wrong, the pair just did not conceive. */
    public static ReproductionOutcome notConceived(Organism partner, ProbabilityBreakdown probability) {
        return new ReproductionOutcome(null, partner, null, probability);
    }

    public boolean isBorn() {
        return offspring != null;
    }

    public boolean isBlocked() {
        return block != null;
    }
}
