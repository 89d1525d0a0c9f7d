package org.tessera.mosaic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.imaging.PixelGrid;
import org.tessera.imaging.TileRecord;

@Tag("unit")
class TileFitterTest {

    private static final int BLACK = 0x000000;
    private static final int WHITE = 0xFFFFFF;
    private static final int GRAY = 0x808080;

    static TileRecord solidTile(int rgb, int tileSize, int matchSide) {
        return new TileRecord(PixelGrid.filled(tileSize, tileSize, rgb), PixelGrid.filled(matchSide, matchSide, rgb));
    }

    @Test
    @DisplayName("White block picks the white tile out of black, white, gray")
    void whiteBlockSelectsWhiteTile() {
        TileFitter fitter = new TileFitter(List.of(
            solidTile(BLACK, 4, 1), solidTile(WHITE, 4, 1), solidTile(GRAY, 4, 1)));

        for (int i = 0; i < 10; i++) {
            assertThat(fitter.findBestFit(new int[]{WHITE})).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Equal distances resolve to the lowest index")
    void tiesGoToLowestIndex() {
        TileFitter fitter = new TileFitter(List.of(
            solidTile(0x102030, 2, 2), solidTile(0x000000, 2, 2), solidTile(0x000000, 2, 2)));

        int[] query = {0x000000, 0x000000, 0x000000, 0x000000};

        assertThat(fitter.findBestFit(query)).isEqualTo(1);
    }

    @Test
    void tiesBetweenDifferentTilesAtSameDistance() {
        // 0x10 above and 0x10 below the query are equally far
        TileFitter fitter = new TileFitter(List.of(solidTile(0x909090, 1, 1), solidTile(0x707070, 1, 1)));

        assertThat(fitter.findBestFit(new int[]{0x808080})).isEqualTo(0);
    }

    @Test
    void distanceIsSumOfSquaredChannelDifferences() {
        int[] query = {PixelGrid.rgb(10, 20, 30), PixelGrid.rgb(0, 0, 0)};
        int[] tile = {PixelGrid.rgb(13, 16, 30), PixelGrid.rgb(255, 0, 1)};

        long diff = TileFitter.tileDiff(query, tile, Long.MAX_VALUE);

        assertThat(diff).isEqualTo(9 + 16 + 0 + 255L * 255 + 0 + 1);
    }

    @Test
    void tileDiffStopsOnceBailOutIsExceeded() {
        int[] query = {0x000000, 0x000000, 0x000000};
        int[] tile = {0x0A0000, 0x0A0000, 0x0A0000};

        long partial = TileFitter.tileDiff(query, tile, 150);

        // 100 after the first pixel, 200 after the second: stops there
        assertThat(partial).isEqualTo(200);
    }

    @Test
    @DisplayName("Pruned search agrees with brute force on random corpora")
    void prunedSearchMatchesBruteForce() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int matchSide = 1 + random.nextInt(4);
            int tileCount = 1 + random.nextInt(30);
            List<TileRecord> tiles = new ArrayList<>();
            List<int[]> raw = new ArrayList<>();
            for (int t = 0; t < tileCount; t++) {
                int[] pixels = randomPixels(random, matchSide * matchSide, round % 3 == 0);
                raw.add(pixels);
                tiles.add(new TileRecord(PixelGrid.filled(4, 4, 0), new PixelGrid(matchSide, matchSide, pixels)));
            }
            TileFitter fitter = new TileFitter(tiles);
            int[] query = randomPixels(random, matchSide * matchSide, round % 3 == 0);

            assertThat(fitter.findBestFit(query)).isEqualTo(bruteForce(query, raw));
        }
    }

    @Test
    void resultIsAlwaysAValidIndex() {
        Random random = new Random(7);
        List<TileRecord> tiles = new ArrayList<>();
        for (int t = 0; t < 12; t++) {
            tiles.add(new TileRecord(PixelGrid.filled(3, 3, 0), new PixelGrid(3, 3, randomPixels(random, 9, false))));
        }
        TileFitter fitter = new TileFitter(tiles);

        for (int i = 0; i < 100; i++) {
            assertThat(fitter.findBestFit(randomPixels(random, 9, false))).isBetween(0, tiles.size() - 1);
        }
    }

    @Test
    void emptyCorpusIsRejected() {
        assertThatThrownBy(() -> new TileFitter(List.of()))
            .isInstanceOf(EmptyTileCorpusException.class);
    }

    @Test
    void mismatchedMatchGridsAreRejected() {
        assertThatThrownBy(() -> new TileFitter(List.of(solidTile(BLACK, 4, 2), solidTile(WHITE, 4, 1))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Tile 1");
    }

    @Test
    void queryOfWrongLengthIsRejected() {
        TileFitter fitter = new TileFitter(List.of(solidTile(BLACK, 4, 2)));

        assertThatThrownBy(() -> fitter.findBestFit(new int[]{BLACK}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static int bruteForce(int[] query, List<int[]> tiles) {
        int best = -1;
        long bestDiff = Long.MAX_VALUE;
        for (int i = 0; i < tiles.size(); i++) {
            long diff = 0;
            int[] tile = tiles.get(i);
            for (int p = 0; p < query.length; p++) {
                long dr = PixelGrid.red(query[p]) - PixelGrid.red(tile[p]);
                long dg = PixelGrid.green(query[p]) - PixelGrid.green(tile[p]);
                long db = PixelGrid.blue(query[p]) - PixelGrid.blue(tile[p]);
                diff += dr * dr + dg * dg + db * db;
            }
            if (diff < bestDiff) {
                bestDiff = diff;
                best = i;
            }
        }
        return best;
    }

    /**
     * Low-entropy palettes produce many exact ties, which is where pruning bugs show up.
     */
    private static int[] randomPixels(Random random, int count, boolean coarse) {
        int[] pixels = new int[count];
        for (int i = 0; i < count; i++) {
            pixels[i] = coarse
                ? PixelGrid.rgb(random.nextInt(3) * 127, random.nextInt(3) * 127, random.nextInt(3) * 127)
                : random.nextInt(0x1000000);
        }
        return pixels;
    }
}
