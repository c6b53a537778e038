package io.github.manjago.lifegrid.core;

/**
 * Relative weights of the three responses to a hostile neighbour.
 * Weights are non-negative and need not sum to one.
 */
public record InteractionGenes(double avoid, double fight, double cooperate) {

    public static final InteractionGenes DEFAULT = new InteractionGenes(1.0, 1.0, 1.0);

    public InteractionGenes {
        avoid = Math.max(0, Numbers.finiteOr(avoid, 0));
        fight = Math.max(0, Numbers.finiteOr(fight, 0));
        cooperate = Math.max(0, Numbers.finiteOr(cooperate, 0));
    }

    public double total() {
        return avoid + fight + cooperate;
    }

    /**
     * Share of the dominant response in [1/3, 1]; 1/3 when all weights are equal.
     */
    public double dominance() {
        double total = total();
        if (total <= 0) return 1.0 / 3.0;
        return Math.max(avoid, Math.max(fight, cooperate)) / total;
    }

    /**
     * Index of the dominant response: 0 avoid, 1 fight, 2 cooperate.
     */
    public int dominantIndex() {
        if (avoid >= fight && avoid >= cooperate) return 0;
        return fight >= cooperate ? 1 : 2;
    }

    /**
     * How differently two organisms react to conflict, in [0, 1].
     * Half the L1 distance between the normalised weight vectors.
     */
    public double complementarity(InteractionGenes other) {
        double ta = total();
        double tb = other.total();
        if (ta <= 0 || tb <= 0) return 0;
        double distance = Math.abs(avoid / ta - other.avoid / tb)
                + Math.abs(fight / ta - other.fight / tb)
                + Math.abs(cooperate / ta - other.cooperate / tb);
        return Numbers.clamp01(distance / 2);
    }
}
