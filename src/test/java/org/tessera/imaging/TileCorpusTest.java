package org.tessera.imaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tessera.mosaic.MosaicSettings;

@Tag("integration")
class TileCorpusTest {

    @TempDir
    Path tileDir;

    private MosaicSettings settings;

    @BeforeEach
    void setUp() {
        settings = new MosaicSettings(4, 2, 1, 1, Path.of("unused.png"), Duration.ofSeconds(1));
    }

    static void writePng(Path file, BufferedImage image) throws IOException {
        Files.createDirectories(file.getParent());
        assertThat(ImageIO.write(image, "png", file.toFile())).isTrue();
    }

    /**
     * 24x8 image in three vertical thirds: red, {@code centre}, blue.
     */
    private static BufferedImage thirds(int centre) {
        BufferedImage image = new BufferedImage(24, 8, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 24; x++) {
                image.setRGB(x, y, x < 8 ? 0xFF0000 : x < 16 ? centre : 0x0000FF);
            }
        }
        return image;
    }

    @Test
    void loadsImagesRecursivelyInSortedOrder() throws IOException {
        writePng(tileDir.resolve("sub").resolve("b.png"), ImageScalerTest.solid(10, 10, 0x0000FF));
        writePng(tileDir.resolve("a.png"), ImageScalerTest.solid(10, 10, 0xFF0000));
        writePng(tileDir.resolve("c.png"), ImageScalerTest.solid(10, 10, 0x00FF00));

        TileCorpus corpus = new TileCorpus(tileDir, settings);
        List<TileRecord> tiles = corpus.load();

        assertThat(tiles).hasSize(3);
        assertThat(tiles).extracting(tile -> Path.of(tile.source()).getFileName().toString())
            .containsExactly("a.png", "c.png", "b.png");
        assertThat(tiles.get(0).fullGrid()).isEqualTo(PixelGrid.filled(4, 4, 0xFF0000));
        assertThat(tiles.get(0).matchGrid()).isEqualTo(PixelGrid.filled(2, 2, 0xFF0000));
        assertThat(corpus.getSkippedCount()).isZero();
    }

    @Test
    void nonImageFilesAreSkipped() throws IOException {
        writePng(tileDir.resolve("good.png"), ImageScalerTest.solid(8, 8, 0x808080));
        Files.writeString(tileDir.resolve("notes.txt"), "not an image", StandardCharsets.UTF_8);
        Files.write(tileDir.resolve("broken.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G', 0, 1, 2});

        TileCorpus corpus = new TileCorpus(tileDir, settings);
        List<TileRecord> tiles = corpus.load();

        assertThat(tiles).hasSize(1);
        assertThat(corpus.getSkippedCount()).isEqualTo(2);
    }

    @Test
    void tilesAreCroppedToTheCentreSquare() throws IOException {
        Path file = tileDir.resolve("wide.png");
        writePng(file, thirds(0x00FF00));

        TileRecord tile = new TileCorpus(tileDir, settings).processTile(file);

        assertThat(tile).isNotNull();
        assertThat(tile.fullGrid()).isEqualTo(PixelGrid.filled(4, 4, 0x00FF00));
        assertThat(tile.matchGrid()).isEqualTo(PixelGrid.filled(2, 2, 0x00FF00));
    }

    @Test
    void emptyDirectoryYieldsNoTiles() throws IOException {
        assertThat(new TileCorpus(tileDir, settings).load()).isEmpty();
    }

    @Test
    void missingDirectoryFails() {
        assertThatThrownBy(() -> new TileCorpus(tileDir.resolve("absent"), settings).load())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("absent");
    }
}
