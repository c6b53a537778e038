package io.github.manjago.lifegrid.sim;

/**
 * Why an organism died.
 */
public enum DeathCause {
    /** Reached the end of its lifespan */
    SENESCENCE,

    /** Energy fell below the starvation threshold */
    STARVATION,

    /** Lost a fight */
    COMBAT,

    /** Removed by the host (tools, tests, external collaborators) */
    EXTERNAL
}
