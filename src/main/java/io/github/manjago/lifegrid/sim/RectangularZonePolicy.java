package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.grid.GridPosition;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Allows reproduction only inside a set of rectangles.
 *
 * Both parents (and the spawn tile, once chosen) must lie inside the same
 * rectangle.
 */
public class RectangularZonePolicy implements ReproductionZonePolicy {

    /**
     * An axis-aligned rectangle of tiles.
     */
    public record Zone(int top, int left, int height, int width) {

        public boolean contains(GridPosition p) {
            return p.row() >= top && p.row() < top + height && p.col() >= left && p.col() < left + width;
        }
    }

    private final List<Zone> zones;

    public RectangularZonePolicy(List<Zone> zones) {
        this.zones = List.copyOf(zones);
    }

    @Override
    public @NotNull ZoneVerdict validateArea(@NotNull ZoneRequest request) {
        for (Zone zone : zones) {
            if (zone.contains(request.parentA()) && zone.contains(request.parentB())
                    && (request.spawn() == null || zone.contains(request.spawn()))) {
                return ZoneVerdict.ALLOWED;
            }
        }
        return ZoneVerdict.denied(request.spawn() == null
                ? "parents outside reproduction zones"
                : "spawn tile outside reproduction zones");
    }

    @Override
    public @NotNull List<GridPosition> filterSpawnCandidates(@NotNull List<GridPosition> candidates) {
        List<GridPosition> inside = new ArrayList<>(candidates.size());
        for (GridPosition p : candidates) {
            for (Zone zone : zones) {
                if (zone.contains(p)) {
                    inside.add(p);
                    break;
                }
            }
        }
        return inside.isEmpty() ? candidates : inside;
    }

    public List<Zone> getZones() {
        return zones;
    }
}
