package io.github.manjago.lifegrid.grid;

import io.github.manjago.lifegrid.core.GameRng;
import io.github.manjago.lifegrid.core.Organism;
import io.github.manjago.lifegrid.core.RgbGenome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DensityFieldTest {

    private static Organism organism(long id) {
        return new Organism(id, new RgbGenome(100, 100, 100), 0, 0, 1.0, -1, 0);
    }

    /**
     * Fills a grid at random, keeping the field in step through applyDelta.
     */
    private static int fill(TileGrid grid, DensityField field, GameRng rng, double occupancy) {
        int placed = 0;
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                if (rng.nextBoolean(occupancy) && grid.place(organism(placed), r, c)) {
                    field.applyDelta(r, c, +1);
                    placed++;
                }
            }
        }
        return placed;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5})
    @DisplayName("Density is within [0, 1] for any pattern and radius")
    void densityInRange(int radius) {
        GameRng rng = new GameRng(radius * 31L);
        for (double occupancy : new double[] {0.0, 0.1, 0.5, 0.9, 1.0}) {
            TileGrid grid = new TileGrid(9, 13);
            DensityField field = new DensityField(grid, radius);
            fill(grid, field, rng, occupancy);
            field.sync(true);

            for (int r = 0; r < grid.rows(); r++) {
                for (int c = 0; c < grid.cols(); c++) {
                    double d = field.densityAt(r, c);
                    assertTrue(d >= 0 && d <= 1, "density " + d + " at (" + r + "," + c + ")");
                }
            }
        }
    }

    @Test
    @DisplayName("Full grid reads 1 everywhere, empty grid 0")
    void fullAndEmpty() {
        TileGrid grid = new TileGrid(5, 5);
        DensityField field = new DensityField(grid, 2);
        field.sync(true);
        assertEquals(0.0, field.densityAt(2, 2));

        fill(grid, field, new GameRng(1), 1.0);
        field.sync(false);
        assertEquals(1.0, field.densityAt(0, 0), 1e-12);
        assertEquals(1.0, field.densityAt(2, 2), 1e-12);
    }

    @Test
    @DisplayName("Incremental updates match a full rebuild")
    void incrementalMatchesRebuild() {
        TileGrid grid = new TileGrid(12, 8);
        DensityField field = new DensityField(grid, 2);
        fill(grid, field, new GameRng(77), 0.4);
        field.sync(true);
        double[] incremental = field.snapshot();

        field.rebuild();

        assertArrayEquals(incremental, field.snapshot(), 1e-12);
    }

    @Test
    @DisplayName("Snapshot only changes on sync")
    void snapshotIsStableWithinTick() {
        TileGrid grid = new TileGrid(5, 5);
        DensityField field = new DensityField(grid, 1);
        field.sync(true);

        grid.place(organism(1), 2, 3);
        field.applyDelta(2, 3, +1);

        assertEquals(0.0, field.densityAt(2, 2));
        assertEquals(1.0 / 8, field.liveDensityAt(2, 2), 1e-12);

        field.sync(false);
        assertEquals(1.0 / 8, field.densityAt(2, 2), 1e-12);
    }

    @Test
    @DisplayName("Before the first publish reads fall back to a scan")
    void scanFallback() {
        TileGrid grid = new TileGrid(3, 3);
        DensityField field = new DensityField(grid, 1);
        grid.place(organism(1), 0, 0);

        assertFalse(field.isPublished());
        // Corner neighbour of the centre, one of eight
        assertEquals(1.0 / 8, field.densityAt(1, 1), 1e-12);
    }

    @Test
    @DisplayName("Outside the grid reads 0")
    void outOfBounds() {
        DensityField field = new DensityField(new TileGrid(3, 3), 1);
        assertEquals(0.0, field.densityAt(-1, 0));
        assertEquals(0.0, field.densityAt(0, 3));
    }

    @Test
    @DisplayName("Radius below 1 is rejected")
    void invalidRadius() {
        assertThrows(IllegalArgumentException.class, () -> new DensityField(new TileGrid(3, 3), 0));
    }
}
