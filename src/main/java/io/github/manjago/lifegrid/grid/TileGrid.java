package io.github.manjago.lifegrid.grid;

import io.github.manjago.lifegrid.core.Organism;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * The arena: a fixed rows x cols array of tiles, each holding an obstacle flag
 * and at most one occupant.
 *
 * Tiles are addressed by a flat row-major index {@code row * cols + col}.
 * This class is the owner of record for organism positions; every placement
 * and removal also updates the organism's cached row/col.
 */
public class TileGrid {

    /** Orthogonal neighbour offsets (N, S, W, E). */
    public static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    /** All eight neighbour offsets. */
    public static final int[][] NEIGHBORS = {
        {-1, -1}, {-1, 0}, {-1, 1},
        {0, -1},           {0, 1},
        {1, -1},  {1, 0},  {1, 1}
    };

    private final int rows;
    private final int cols;
    private final Organism[] occupants;
    private final BitSet obstacles;
    private int occupied;

    public TileGrid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.occupants = new Organism[rows * cols];
        this.obstacles = new BitSet(rows * cols);
    }

    // ========== Geometry ==========

    public int rows() { return rows; }
    public int cols() { return cols; }
    public int size() { return rows * cols; }

    public int index(int row, int col) {
        return row * cols + col;
    }

    public int rowOf(int index) {
        return index / cols;
    }

    public int colOf(int index) {
        return index % cols;
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    // ========== Obstacles ==========

    public boolean isObstacle(int row, int col) {
        return inBounds(row, col) && obstacles.get(index(row, col));
    }

    public boolean isObstacle(int index) {
        return obstacles.get(index);
    }

    /**
     * Mark or clear an obstacle. Occupied tiles cannot become obstacles.
     *
     * @return true if the flag changed
     */
    public boolean setObstacle(int row, int col, boolean blocked) {
        if (!inBounds(row, col)) return false;
        int idx = index(row, col);
        if (blocked && occupants[idx] != null) return false;
        if (obstacles.get(idx) == blocked) return false;
        obstacles.set(idx, blocked);
        return true;
    }

    // ========== Occupancy ==========

    @Nullable
    public Organism occupantAt(int row, int col) {
        return inBounds(row, col) ? occupants[index(row, col)] : null;
    }

    @Nullable
    public Organism occupantAt(int index) {
        return occupants[index];
    }

    /**
     * True when the tile exists, is not an obstacle and has no occupant.
     */
    public boolean isFree(int row, int col) {
        if (!inBounds(row, col)) return false;
        int idx = index(row, col);
        return occupants[idx] == null && !obstacles.get(idx);
    }

    /**
     * Put an organism on a free tile.
     *
     * @return false if the tile is out of bounds, blocked or occupied
     */
    public boolean place(Organism organism, int row, int col) {
        if (!isFree(row, col)) return false;
        occupants[index(row, col)] = organism;
        organism.updatePosition(row, col);
        occupied++;
        return true;
    }

    /**
     * Remove whatever occupies the tile.
     *
     * @return the removed organism, or null if the tile was empty
     */
    @Nullable
    public Organism clear(int row, int col) {
        if (!inBounds(row, col)) return null;
        int idx = index(row, col);
        Organism previous = occupants[idx];
        if (previous != null) {
            occupants[idx] = null;
            occupied--;
        }
        return previous;
    }

    /**
     * Move the occupant of one tile to a free tile.
     *
     * @return false if the source is empty or the destination is not free
     */
    public boolean move(int fromRow, int fromCol, int toRow, int toCol) {
        Organism organism = occupantAt(fromRow, fromCol);
        if (organism == null || !isFree(toRow, toCol)) return false;
        occupants[index(fromRow, fromCol)] = null;
        occupants[index(toRow, toCol)] = organism;
        organism.updatePosition(toRow, toCol);
        return true;
    }

    public int occupiedCount() {
        return occupied;
    }

    /**
     * Full scan for an organism's real position.
     *
     * @return the position, or null if the organism is not on the grid
     */
    @Nullable
    public GridPosition find(Organism organism) {
        for (int i = 0; i < occupants.length; i++) {
            if (occupants[i] == organism) {
                return new GridPosition(rowOf(i), colOf(i));
            }
        }
        return null;
    }

    /**
     * All occupants in row-major order.
     */
    public List<Organism> occupantsRowMajor() {
        List<Organism> result = new ArrayList<>(occupied);
        for (Organism o : occupants) {
            if (o != null) result.add(o);
        }
        return result;
    }
}
