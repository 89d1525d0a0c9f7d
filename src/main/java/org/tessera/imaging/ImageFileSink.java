package org.tessera.imaging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.mosaic.CanvasSink;
import org.tessera.mosaic.MosaicCanvas;

/**
 * Writes the canvas to an image file. The file extension picks the format;
 * unknown extensions are written as JPEG.
 */
public class ImageFileSink implements CanvasSink {

    private static final Logger log = LoggerFactory.getLogger(ImageFileSink.class);

    private final Path path;

    public ImageFileSink(Path path) {
        this.path = path;
    }

    @Override
    public Path persist(MosaicCanvas canvas) throws IOException {
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String format = formatFor(target);
        if (!ImageIO.write(canvas.getImage(), format, target.toFile())) {
            throw new IOException("No image writer available for format '" + format + "'");
        }
        log.debug("Wrote {}x{} {} to {}", canvas.getWidth(), canvas.getHeight(), format, target);
        return target;
    }

    /**
     * Maps a file name to an ImageIO format name.
     */
    static String formatFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String ext = dot >= 0 ? name.substring(dot + 1) : "";
        return switch (ext) {
            case "png" -> "png";
            case "bmp" -> "bmp";
            case "gif" -> "gif";
            default -> "jpeg";
        };
    }
}
