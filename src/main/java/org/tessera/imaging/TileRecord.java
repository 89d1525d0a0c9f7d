package org.tessera.imaging;

import java.util.Objects;

/**
 * One usable tile of the corpus.
 *
 * @param fullGrid  The square tile at output resolution ({@code tileSize x tileSize}).
 * @param matchGrid The downsampled tile used only for matching ({@code matchSide x matchSide}).
 * @param source    Where the tile came from, for log messages. Never used for matching.
 */
public record TileRecord(PixelGrid fullGrid, PixelGrid matchGrid, String source) {

    public TileRecord {
        Objects.requireNonNull(fullGrid, "fullGrid");
        Objects.requireNonNull(matchGrid, "matchGrid");
        if (fullGrid.getWidth() != fullGrid.getHeight()) {
            throw new IllegalArgumentException("Tile " + source + " is not square: " + fullGrid);
        }
        if (matchGrid.getWidth() != matchGrid.getHeight()) {
            throw new IllegalArgumentException("Match grid of tile " + source + " is not square: " + matchGrid);
        }
    }

    public TileRecord(PixelGrid fullGrid, PixelGrid matchGrid) {
        this(fullGrid, matchGrid, "<memory>");
    }
}
