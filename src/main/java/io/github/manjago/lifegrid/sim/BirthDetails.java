package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.core.Organism;
import org.jetbrains.annotations.Nullable;

/**
 * A new organism and where it came from.
 */
public record BirthDetails(
    Organism child,
    @Nullable Organism parentA,
    @Nullable Organism parentB,
    Origin origin,
    long tick
) {

    public enum Origin {
        /** Two parents mated */
        REPRODUCTION,

        /** Placed by initial or compensatory seeding */
        SEEDED,

        /** Grown out of a decay pool while the population was short */
        DECAY_POOL,

        /** Placed directly by the host */
        PLACED
    }
}
