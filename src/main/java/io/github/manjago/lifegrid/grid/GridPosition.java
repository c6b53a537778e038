package io.github.manjago.lifegrid.grid;

/**
 * A tile coordinate.
 */
public record GridPosition(int row, int col) {

    /**
     * Chebyshev (king-move) distance.
     */
    public int distanceTo(GridPosition other) {
        return Math.max(Math.abs(row - other.row), Math.abs(col - other.col));
    }

    public int distanceTo(int otherRow, int otherCol) {
        return Math.max(Math.abs(row - otherRow), Math.abs(col - otherCol));
    }
}
