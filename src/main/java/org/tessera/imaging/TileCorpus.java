package org.tessera.imaging;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.mosaic.MosaicSettings;

/**
 * Loads every usable image below a directory as a mosaic tile.
 * <p>
 * Each candidate is decoded, turned upright according to its EXIF orientation, cropped to a
 * centred square, and scaled twice: to {@code tileSize} for the output and to
 * {@code matchSide} for matching. Files that cannot be decoded are skipped and logged at
 * DEBUG; they never fail the load.
 * <p>
 * Files are visited in sorted path order, so tile indices are stable between runs.
 */
public class TileCorpus {

    private static final Logger log = LoggerFactory.getLogger(TileCorpus.class);

    private final Path directory;
    private final MosaicSettings settings;
    private int skipped;

    public TileCorpus(Path directory, MosaicSettings settings) {
        this.directory = directory;
        this.settings = settings;
    }

    /**
     * Reads the corpus.
     *
     * @return The usable tiles, possibly empty.
     * @throws IOException if the directory itself cannot be listed.
     */
    public List<TileRecord> load() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Tile directory not found: " + directory.toAbsolutePath());
        }
        log.info("Reading tiles from {}...", directory);

        List<Path> candidates;
        try (Stream<Path> files = Files.walk(directory)) {
            candidates = files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        List<TileRecord> tiles = new ArrayList<>(candidates.size());
        skipped = 0;
        for (Path candidate : candidates) {
            TileRecord tile = processTile(candidate);
            if (tile != null) {
                tiles.add(tile);
            } else {
                skipped++;
            }
        }

        log.info("Processed {} tiles ({} skipped).", tiles.size(), skipped);
        return tiles;
    }

    /**
     * @return How many candidates the last {@link #load()} skipped.
     */
    public int getSkippedCount() {
        return skipped;
    }

    /**
     * Turns one file into a tile.
     *
     * @return The tile, or {@code null} if the file is not a readable image.
     */
    TileRecord processTile(Path file) {
        try {
            BufferedImage image = decodeUpright(file);
            if (image == null) {
                log.debug("Skipping {}: not a supported image", file.getFileName());
                return null;
            }
            BufferedImage square = ImageScaler.cropToSquare(image);
            int tileSize = settings.tileSize();
            int matchSide = settings.matchSide();
            PixelGrid full = PixelGrid.fromImage(ImageScaler.resize(square, tileSize, tileSize));
            PixelGrid match = PixelGrid.fromImage(ImageScaler.resize(square, matchSide, matchSide));
            return new TileRecord(full, match, file.toString());
        } catch (IOException | RuntimeException e) {
            log.debug("Skipping {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private static BufferedImage decodeUpright(Path file) throws IOException {
        try (ImageInputStream stream = ImageIO.createImageInputStream(file.toFile())) {
            if (stream == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true, false);
                BufferedImage image = reader.read(0);
                if (image.getWidth() < 1 || image.getHeight() < 1) {
                    return null;
                }
                int orientation = readOrientation(reader, file);
                return ExifOrientation.apply(image, orientation);
            } finally {
                reader.dispose();
            }
        }
    }

    private static int readOrientation(ImageReader reader, Path file) {
        try {
            return ExifOrientation.fromMetadata(reader.getImageMetadata(0));
        } catch (IOException | RuntimeException e) {
            log.debug("Ignoring unreadable metadata of {}: {}", file.getFileName(), e.getMessage());
            return ExifOrientation.NORMAL;
        }
    }
}
