package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.grid.GridPosition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Geometric rule restricting where mating and spawning may happen.
 */
public interface ReproductionZonePolicy {

    /**
     * Check the parents' positions and, when known, the spawn tile.
     */
    @NotNull
    ZoneVerdict validateArea(@NotNull ZoneRequest request);

    /**
     * Keep only candidate spawn tiles inside the allowed area.
     * Implementations return the input unchanged when nothing would remain.
     */
    @NotNull
    List<GridPosition> filterSpawnCandidates(@NotNull List<GridPosition> candidates);

    /**
     * Positions to check.
     *
     * @param spawn the chosen spawn tile, null before one is chosen
     */
    record ZoneRequest(GridPosition parentA, GridPosition parentB, @Nullable GridPosition spawn) {
    }

    /**
     * @param reason human-readable reason, null when allowed
     */
    record ZoneVerdict(boolean allowed, @Nullable String reason) {

        public static final ZoneVerdict ALLOWED = new ZoneVerdict(true, null);

        public static ZoneVerdict denied(String reason) {
            return new ZoneVerdict(false, reason);
        }
    }

    /**
     * Policy without restrictions.
     */
    ReproductionZonePolicy ALLOW_ALL = new ReproductionZonePolicy() {
        @Override
        public @NotNull ZoneVerdict validateArea(@NotNull ZoneRequest request) {
            return ZoneVerdict.ALLOWED;
        }

        @Override
        public @NotNull List<GridPosition> filterSpawnCandidates(@NotNull List<GridPosition> candidates) {
            return candidates;
        }
    };
}
