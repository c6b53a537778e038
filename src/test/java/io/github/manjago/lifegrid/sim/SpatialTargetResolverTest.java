package io.github.manjago.lifegrid.sim;

import io.github.manjago.lifegrid.config.SimulationConfig;
import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.grid.DensityField;
import io.github.manjago.lifegrid.grid.GridPosition;
import io.github.manjago.lifegrid.grid.TileGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpatialTargetResolverTest {

    private static final TickOptions OPTIONS = TickOptions.from(SimulationConfig.builder().grid(9, 9).build());

    private TileGrid grid;
    private DensityField density;
    private SimilarityCache cache;
    private SpatialTargetResolver resolver;
    private long nextId;

    @BeforeEach
    void setUp() {
        grid = new TileGrid(9, 9);
        density = new DensityField(grid, 1);
        cache = new SimilarityCache();
        resolver = new SpatialTargetResolver(grid, density, cache);
        nextId = 0;
    }

    private Organism put(TraitGenome genome, int row, int col) {
        Organism o = new Organism(nextId++, genome, row, col, 3, -1, 0);
        assertTrue(grid.place(o, row, col));
        density.applyDelta(row, col, +1);
        return o;
    }

    private static List<GridPosition> positions(List<Target> targets) {
        return targets.stream().map(Target::position).toList();
    }

    @Test
    @DisplayName("Neighbours are classified by similarity, nearest first")
    void classification() {
        Organism focal = put(new TraitGenome(0.5).thresholds(0.8, 0.2).sight(2), 4, 4);
        put(new TraitGenome(0.45), 4, 5);    // 0.95: society
        put(new TraitGenome(0.9), 6, 6);     // 0.6: mate, distance 2
        put(new TraitGenome(0.0), 3, 3);     // 0.5: mate, distance 1
        put(new TraitGenome(-0.35), 2, 4);   // 0.15: enemy
        put(new TraitGenome(0.5), 8, 8);     // out of sight

        density.sync(true);
        TargetGroups groups = resolver.findTargets(focal, 4, 4, OPTIONS, new GameRng(1));

        assertEquals(List.of(new GridPosition(4, 5)), positions(groups.society()));
        assertEquals(List.of(new GridPosition(2, 4)), positions(groups.enemies()));
        assertEquals(List.of(new GridPosition(3, 3), new GridPosition(6, 6)), positions(groups.mates()));
        assertEquals(1, groups.mates().get(0).distance());
        assertEquals(2, groups.mates().get(1).distance());
        assertEquals(4, groups.total());
    }

    @Test
    @DisplayName("Configured thresholds apply when the genome has none")
    void fallbackThresholds() {
        Organism focal = put(new TraitGenome(0.5), 4, 4);
        put(new TraitGenome(0.7), 4, 5);     // 0.8 >= society 0.7
        put(new TraitGenome(1.0), 4, 3);     // 0.5 between 0.4 and 0.7
        put(new TraitGenome(1.2), 5, 4);     // 0.3 <= enemy 0.4

        density.sync(true);
        TargetGroups groups = resolver.findTargets(focal, 4, 4, OPTIONS, new GameRng(1));

        assertEquals(1, groups.society().size());
        assertEquals(1, groups.mates().size());
        assertEquals(1, groups.enemies().size());
    }

    @Test
    void aloneMeansEmpty() {
        Organism focal = put(new TraitGenome(0.5), 0, 0);
        density.sync(true);

        assertSame(TargetGroups.EMPTY, resolver.findTargets(focal, 0, 0, OPTIONS, new GameRng(1)));
    }

    @Test
    void windowIsClippedAtEdges() {
        Organism focal = put(new TraitGenome(0.5).sight(3), 0, 0);
        put(new TraitGenome(0.45), 0, 3);
        put(new TraitGenome(0.45), 3, 3);
        density.sync(true);

        TargetGroups groups = resolver.findTargets(focal, 0, 0, OPTIONS, new GameRng(1));
        assertEquals(2, groups.total());
    }

    @Test
    void similaritiesAreCached() {
        Organism focal = put(new TraitGenome(0.5), 4, 4);
        Organism other = put(new TraitGenome(0.1), 4, 5);
        density.sync(true);

        resolver.findTargets(focal, 4, 4, OPTIONS, new GameRng(1));
        resolver.findTargets(other, 4, 5, OPTIONS, new GameRng(1));

        assertEquals(1, cache.size());
        assertEquals(1, cache.getHits());
    }

    @Test
    @DisplayName("Hostility rises with density")
    void hostilityBias() {
        Organism calm = new Organism(0, new TraitGenome(0.5), 0, 0, 1, -1, 0);
        Organism edgy = new Organism(1, new TraitGenome(0.5).hostility(0.6), 0, 0, 1, -1, 0);

        assertEquals(0.0, SpatialTargetResolver.hostilityBias(calm, 1.0));
        assertEquals(0.0, SpatialTargetResolver.hostilityBias(edgy, 0.0));
        // risk 0.5: 0.6 * (0.4 + 0.4)
        assertEquals(0.48, SpatialTargetResolver.hostilityBias(edgy, 1.0), 1e-12);
        assertTrue(SpatialTargetResolver.hostilityBias(edgy, 0.5) < SpatialTargetResolver.hostilityBias(edgy, 1.0));
    }

    @Test
    @DisplayName("Hostile organisms in a crowd turn some neutral neighbours into enemies")
    void hostilityDrawsEnemies() {
        Organism focal = put(new TraitGenome(0.5).hostility(1.0).sight(1), 4, 4);
        for (int[] d : TileGrid.NEIGHBORS) {
            put(new TraitGenome(0.0), 4 + d[0], 4 + d[1]);   // 0.5: neutral
        }
        density.sync(true);

        TargetGroups groups = resolver.findTargets(focal, 4, 4, OPTIONS, new GameRng(7));
        assertEquals(8, groups.total());
        assertFalse(groups.enemies().isEmpty());
    }
}
