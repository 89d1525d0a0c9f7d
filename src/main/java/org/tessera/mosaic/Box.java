package org.tessera.mosaic;

/**
 * Half-open pixel rectangle {@code [x0, x1) x [y0, y1)}.
 */
public record Box(int x0, int y0, int x1, int y1) {

    public Box {
        if (x0 < 0 || y0 < 0 || x1 < x0 || y1 < y0) {
            throw new IllegalArgumentException(String.format("Invalid box (%d,%d,%d,%d)", x0, y0, x1, y1));
        }
    }

    /**
     * The box of block (column, row) on a grid of {@code side}-sized cells.
     */
    public static Box ofCell(int column, int row, int side) {
        return new Box(column * side, row * side, (column + 1) * side, (row + 1) * side);
    }

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }
}
