package org.tessera.mosaic;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

import org.tessera.imaging.PixelGrid;

/**
 * Mutable output buffer of a mosaic, {@code xTileCount * tileSize} by
 * {@code yTileCount * tileSize} pixels.
 * <p>
 * The only mutation is {@link #paste(Box, PixelGrid)}, which writes one tile into one
 * tile-aligned block. Each block may be written at most once. Unwritten blocks stay black.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Owned by the {@link Compositor} thread.
 */
public final class MosaicCanvas {

    private final int tileSize;
    private final int xTileCount;
    private final int yTileCount;
    private final int width;
    private final BufferedImage image;
    private final int[] pixels;
    private final boolean[] pasted;
    private int pastedCount;

    public MosaicCanvas(int xTileCount, int yTileCount, int tileSize) {
        if (xTileCount < 1 || yTileCount < 1 || tileSize < 1) {
            throw new IllegalArgumentException(String.format(
                "Canvas needs at least one tile of size >= 1, got %dx%d tiles of %d", xTileCount, yTileCount, tileSize));
        }
        this.tileSize = tileSize;
        this.xTileCount = xTileCount;
        this.yTileCount = yTileCount;
        this.width = xTileCount * tileSize;
        this.image = new BufferedImage(width, yTileCount * tileSize, BufferedImage.TYPE_INT_RGB);
        this.pixels = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        this.pasted = new boolean[xTileCount * yTileCount];
    }

    /**
     * A canvas covering every whole tile of {@code target}: {@code floor(width / tileSize)}
     * by {@code floor(height / tileSize)} tiles.
     */
    public static MosaicCanvas forTarget(PixelGrid target, int tileSize) {
        return new MosaicCanvas(target.getWidth() / tileSize, target.getHeight() / tileSize, tileSize);
    }

    /**
     * Copies a tile into the block at {@code coords}.
     *
     * @param coords Tile-aligned block inside the canvas.
     * @param tile   A {@code tileSize x tileSize} grid.
     * @throws IllegalArgumentException if the box is misaligned, out of bounds, or the tile has the wrong size.
     * @throws IllegalStateException    if the block was already written.
     */
    public void paste(Box coords, PixelGrid tile) {
        if (coords.width() != tileSize || coords.height() != tileSize
                || coords.x0() % tileSize != 0 || coords.y0() % tileSize != 0) {
            throw new IllegalArgumentException("Box " + coords + " is not a tile-aligned block of size " + tileSize);
        }
        int column = coords.x0() / tileSize;
        int row = coords.y0() / tileSize;
        if (column >= xTileCount || row >= yTileCount) {
            throw new IllegalArgumentException("Box " + coords + " lies outside the "
                + getWidth() + "x" + getHeight() + " canvas");
        }
        if (tile.getWidth() != tileSize || tile.getHeight() != tileSize) {
            throw new IllegalArgumentException("Tile " + tile + " does not match tile size " + tileSize);
        }
        int blockIndex = row * xTileCount + column;
        if (pasted[blockIndex]) {
            throw new IllegalStateException("Block " + coords + " was already pasted");
        }

        int[] tilePixels = tile.toArray();
        for (int y = 0; y < tileSize; y++) {
            System.arraycopy(tilePixels, y * tileSize, pixels, (coords.y0() + y) * width + coords.x0(), tileSize);
        }
        pasted[blockIndex] = true;
        pastedCount++;
    }

    public boolean isPasted(int column, int row) {
        return pasted[row * xTileCount + column];
    }

    public int getPastedCount() {
        return pastedCount;
    }

    public int getTotalBlocks() {
        return pasted.length;
    }

    /**
     * @return {@code true} once every block has been written.
     */
    public boolean isComplete() {
        return pastedCount == pasted.length;
    }

    public int getTileSize() {
        return tileSize;
    }

    public int getXTileCount() {
        return xTileCount;
    }

    public int getYTileCount() {
        return yTileCount;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return yTileCount * tileSize;
    }

    /**
     * The live backing image. Callers must not modify it.
     */
    public BufferedImage getImage() {
        return image;
    }

    /**
     * @return An immutable snapshot of the current pixels.
     */
    public PixelGrid snapshot() {
        return new PixelGrid(width, getHeight(), pixels);
    }
}
