package org.tessera.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.mosaic.MosaicSettings;

/**
 * Prepares the image a mosaic is built from.
 * <p>
 * The source is enlarged by {@code enlargement}, centre-cropped to a whole number of tiles,
 * and downsampled so that every tile-sized block becomes a {@code matchSide x matchSide}
 * block of the small grid.
 */
public class TargetSource {

    private static final Logger log = LoggerFactory.getLogger(TargetSource.class);

    private final Path file;
    private final MosaicSettings settings;

    public TargetSource(Path file, MosaicSettings settings) {
        this.file = file;
        this.settings = settings;
    }

    /**
     * Decodes and prepares the target.
     *
     * @throws IOException              if the file is missing or not a readable image.
     * @throws IllegalArgumentException if the enlarged image is smaller than one tile.
     */
    public TargetImage load() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Target image not found: " + file.toAbsolutePath());
        }
        log.info("Processing main image {}...", file);
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Not a supported image: " + file.toAbsolutePath());
        }
        TargetImage target = prepare(image);
        log.info("Main image processed: {}x{} -> {} ({} match grid)",
            image.getWidth(), image.getHeight(), target.fullGrid(), target.smallGrid());
        return target;
    }

    /**
     * Enlarges, crops, and downsamples an already decoded image.
     */
    public TargetImage prepare(BufferedImage image) {
        int tileSize = settings.tileSize();
        int matchSide = settings.matchSide();
        long enlargedWidth = (long) image.getWidth() * settings.enlargement();
        long enlargedHeight = (long) image.getHeight() * settings.enlargement();
        int xTileCount = (int) (enlargedWidth / tileSize);
        int yTileCount = (int) (enlargedHeight / tileSize);
        if (xTileCount < 1 || yTileCount < 1) {
            throw new IllegalArgumentException(String.format(
                "Target %dx%d enlarged %dx is smaller than one %dpx tile",
                image.getWidth(), image.getHeight(), settings.enlargement(), tileSize));
        }

        BufferedImage enlarged = ImageScaler.resize(image, (int) enlargedWidth, (int) enlargedHeight);
        int croppedWidth = xTileCount * tileSize;
        int croppedHeight = yTileCount * tileSize;
        BufferedImage large = ImageScaler.crop(enlarged,
            (int) (enlargedWidth - croppedWidth) / 2, (int) (enlargedHeight - croppedHeight) / 2,
            croppedWidth, croppedHeight);
        BufferedImage small = ImageScaler.resize(large, xTileCount * matchSide, yTileCount * matchSide);

        return new TargetImage(PixelGrid.fromImage(large), PixelGrid.fromImage(small));
    }
}
