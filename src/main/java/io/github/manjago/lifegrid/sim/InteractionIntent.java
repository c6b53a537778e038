package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.GridPosition;

/**
 * A pre-built request for the interaction resolver.
 *
 * @param kind fight or cooperate
 * @param initiator organism that acts
 * @param target organism acted upon
 * @param initiatorPosition where the initiator stands
 * @param targetPosition where the target stands
 * @param effectiveDensity local density around the initiator
 * @param fightCost energy each side pays to fight
 * @param cooperationShare share of the initiator's energy handed over when cooperating
 */
public record InteractionIntent(
    Kind kind,
    Organism initiator,
    Organism target,
    GridPosition initiatorPosition,
    GridPosition targetPosition,
    double effectiveDensity,
    double fightCost,
    double cooperationShare
) {

    public enum Kind {
        FIGHT,
        COOPERATE
    }
}
