package io.github.manjago.lifegrid.sim;

/**
 * Why a reproduction attempt did not go ahead.
 */
public enum BlockReason {
    NO_MATE("No mate in sight"),
    OUT_OF_REACH("Parents out of reach"),
    COOLDOWN("Reproduction cooldown active"),
    ZONE("Reproduction zone rejected"),
    ENERGY("Parents below reproduction energy"),
    NO_SPAWN_SITE("No viable spawn tile"),
    INVESTMENT("Parental investment unavailable");

    private final String description;

    BlockReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
