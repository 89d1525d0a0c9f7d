package org.tessera.mosaic;

import java.util.List;

import org.tessera.imaging.PixelGrid;
import org.tessera.imaging.TileRecord;

/**
 * Finds the tile whose matching grid is closest to a block of the target image.
 * <p>
 * Distance is the sum of squared per-channel RGB differences over all pixels. The scan
 * abandons a tile as soon as its running sum exceeds the best distance found so far,
 * which prunes most of the work once a good candidate has been seen.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction; one instance is shared by all
 * matcher threads.
 */
public final class TileFitter {

    private final int[][] matchPixels;
    private final int pixelsPerTile;

    /**
     * @param tiles The corpus, in index order. Must not be empty and all match grids
     *              must have the same size.
     * @throws EmptyTileCorpusException if {@code tiles} is empty.
     * @throws IllegalArgumentException if the match grids differ in size.
     */
    public TileFitter(List<TileRecord> tiles) {
        if (tiles.isEmpty()) {
            throw new EmptyTileCorpusException("Cannot match blocks against an empty tile corpus");
        }
        this.pixelsPerTile = tiles.get(0).matchGrid().getPixelCount();
        this.matchPixels = new int[tiles.size()][];
        for (int i = 0; i < tiles.size(); i++) {
            PixelGrid grid = tiles.get(i).matchGrid();
            if (grid.getPixelCount() != pixelsPerTile) {
                throw new IllegalArgumentException(String.format(
                    "Tile %d (%s) has a %s match grid, expected %d pixels",
                    i, tiles.get(i).source(), grid, pixelsPerTile));
            }
            matchPixels[i] = grid.toArray();
        }
    }

    public int getTileCount() {
        return matchPixels.length;
    }

    /**
     * Returns the index of the closest tile. Ties go to the lowest index.
     *
     * @param query Packed RGB of the block, same length as a tile's match grid.
     * @return An index in {@code [0, getTileCount())}.
     */
    public int findBestFit(int[] query) {
        if (query.length != pixelsPerTile) {
            throw new IllegalArgumentException(
                "Block has " + query.length + " pixels, tiles have " + pixelsPerTile);
        }
        int bestIndex = -1;
        long bestSoFar = Long.MAX_VALUE;

        for (int tileIndex = 0; tileIndex < matchPixels.length; tileIndex++) {
            long diff = tileDiff(query, matchPixels[tileIndex], bestSoFar);
            // strict '<' keeps the first of equal candidates
            if (diff < bestSoFar) {
                bestSoFar = diff;
                bestIndex = tileIndex;
            }
        }
        return bestIndex;
    }

    /**
     * Squared RGB distance between two pixel sequences. Returns early, with a partial sum
     * greater than {@code bailOutValue}, once the tile can no longer beat the current best.
     */
    static long tileDiff(int[] query, int[] tile, long bailOutValue) {
        long diff = 0;
        for (int i = 0; i < query.length; i++) {
            int q = query[i];
            int t = tile[i];
            int dr = PixelGrid.red(q) - PixelGrid.red(t);
            int dg = PixelGrid.green(q) - PixelGrid.green(t);
            int db = PixelGrid.blue(q) - PixelGrid.blue(t);
            diff += (long) dr * dr + (long) dg * dg + (long) db * db;
            if (diff > bailOutValue) {
                return diff;
            }
        }
        return diff;
    }
}
