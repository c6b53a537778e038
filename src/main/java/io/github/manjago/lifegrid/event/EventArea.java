package io.github.manjago.lifegrid.event;

/**
 * Rectangular area affected by an event. {@code x} is the column, {@code y} the row.
 */
public record EventArea(int x, int y, int width, int height) {

    public boolean contains(int row, int col) {
        return col >= x && col < x + width && row >= y && row < y + height;
    }
}
