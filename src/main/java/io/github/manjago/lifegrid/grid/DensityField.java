package io.github.manjago.lifegrid.grid;

import io.github.manjago.lifegrid.core.Numbers;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Fraction of occupied tiles around every tile, tracked incrementally.
 *
 * Two buffers are kept:
 * - the live buffer, updated immediately by {@link #applyDelta} on every
 *   occupancy change (O(radius²) per change)
 * - the published snapshot, refreshed by {@link #sync} at tick boundaries
 *
 * Decisions read the snapshot so every organism in a tick sees the same
 * neighbourhood regardless of processing order. The tile itself is never
 * counted as its own neighbour.
 */
public class DensityField {

    private final TileGrid grid;
    private final int rows;
    private final int cols;
    private final int radius;

    // Max neighbour count per tile, edge-clamped
    private final int[] capacity;
    private final int[] counts;
    private final double[] live;
    private final double[] snapshot;
    private final BitSet dirty;
    private boolean published;

    public DensityField(TileGrid grid, int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("Density radius must be at least 1: " + radius);
        }
        this.grid = grid;
        this.rows = grid.rows();
        this.cols = grid.cols();
        this.radius = radius;
        int size = rows * cols;
        this.capacity = new int[size];
        this.counts = new int[size];
        this.live = new double[size];
        this.snapshot = new double[size];
        this.dirty = new BitSet(size);

        for (int r = 0; r < rows; r++) {
            int rowSpan = Math.min(rows - 1, r + radius) - Math.max(0, r - radius) + 1;
            for (int c = 0; c < cols; c++) {
                int colSpan = Math.min(cols - 1, c + radius) - Math.max(0, c - radius) + 1;
                capacity[r * cols + c] = rowSpan * colSpan - 1;
            }
        }
    }

    public int radius() {
        return radius;
    }

    // ========== Incremental updates ==========

    /**
     * Record that the tile at (row, col) gained (+1) or lost (-1) an occupant.
     * Updates the live buffer of every tile within the radius.
     */
    public void applyDelta(int row, int col, int delta) {
        if (!grid.inBounds(row, col) || delta == 0) return;
        int r0 = Math.max(0, row - radius);
        int r1 = Math.min(rows - 1, row + radius);
        int c0 = Math.max(0, col - radius);
        int c1 = Math.min(cols - 1, col + radius);
        for (int r = r0; r <= r1; r++) {
            int base = r * cols;
            for (int c = c0; c <= c1; c++) {
                if (r == row && c == col) continue;
                int idx = base + c;
                int count = Math.max(0, counts[idx] + delta);
                counts[idx] = count;
                live[idx] = ratio(count, capacity[idx]);
                dirty.set(idx);
            }
        }
    }

    /**
     * Publish live values into the snapshot.
     *
     * @param force copy every tile instead of only the dirty ones
     */
    public void sync(boolean force) {
        if (force || !published) {
            System.arraycopy(live, 0, snapshot, 0, live.length);
        } else {
            for (int i = dirty.nextSetBit(0); i >= 0; i = dirty.nextSetBit(i + 1)) {
                snapshot[i] = live[i];
            }
        }
        dirty.clear();
        published = true;
    }

    /**
     * Recount every tile from the grid's occupancy using 2-D prefix sums,
     * then publish.
     */
    public void rebuild() {
        int[] prefix = new int[(rows + 1) * (cols + 1)];
        int stride = cols + 1;
        for (int r = 0; r < rows; r++) {
            int rowSum = 0;
            for (int c = 0; c < cols; c++) {
                if (grid.occupantAt(r * cols + c) != null) rowSum++;
                prefix[(r + 1) * stride + c + 1] = prefix[r * stride + c + 1] + rowSum;
            }
        }
        for (int r = 0; r < rows; r++) {
            int r0 = Math.max(0, r - radius);
            int r1 = Math.min(rows - 1, r + radius) + 1;
            for (int c = 0; c < cols; c++) {
                int c0 = Math.max(0, c - radius);
                int c1 = Math.min(cols - 1, c + radius) + 1;
                int total = prefix[r1 * stride + c1] - prefix[r0 * stride + c1]
                        - prefix[r1 * stride + c0] + prefix[r0 * stride + c0];
                int idx = r * cols + c;
                if (grid.occupantAt(idx) != null) total--;
                counts[idx] = total;
                live[idx] = ratio(total, capacity[idx]);
            }
        }
        sync(true);
    }

    // ========== Reads ==========

    /**
     * Published density at a tile in [0, 1]; 0 outside the grid.
     * Falls back to a direct neighbour scan before the first publish.
     */
    public double densityAt(int row, int col) {
        if (!grid.inBounds(row, col)) return 0;
        if (!published) return scan(row, col, radius);
        return snapshot[row * cols + col];
    }

    /**
     * Density as updated by occupancy changes made during the current tick.
     */
    public double liveDensityAt(int row, int col) {
        if (!grid.inBounds(row, col)) return 0;
        return live[row * cols + col];
    }

    /**
     * On-demand neighbour scan with an arbitrary radius.
     */
    public double scan(int row, int col, int scanRadius) {
        if (!grid.inBounds(row, col) || scanRadius < 1) return 0;
        int occupied = 0;
        int total = 0;
        for (int r = Math.max(0, row - scanRadius); r <= Math.min(rows - 1, row + scanRadius); r++) {
            for (int c = Math.max(0, col - scanRadius); c <= Math.min(cols - 1, col + scanRadius); c++) {
                if (r == row && c == col) continue;
                total++;
                if (grid.occupantAt(r * cols + c) != null) occupied++;
            }
        }
        return ratio(occupied, total);
    }

    public boolean isPublished() {
        return published;
    }

    /**
     * Copy of the published snapshot (for diagnostics and tests).
     */
    public double[] snapshot() {
        return Arrays.copyOf(snapshot, snapshot.length);
    }

    private static double ratio(int count, int max) {
        return max <= 0 ? 0 : Numbers.clamp01((double) count / max);
    }
}
