package org.tessera.mosaic;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable parameters of one mosaic run.
 * <p>
 * Every component receives its settings at construction, so runs with different
 * parameters can execute side by side in the same JVM.
 *
 * @param tileSize        Pixels per tile side in the output.
 * @param matchResolution Requested pixels per side of the matching grid. Clamped to {@code tileSize}.
 * @param enlargement     Output scale factor relative to the source image.
 * @param workerCount     Matcher threads, or 0 for {@code max(availableCores - 1, 1)}.
 * @param outputPath      Destination of the finished mosaic.
 * @param shutdownTimeout How long an interrupted run may take to save its partial canvas.
 */
public record MosaicSettings(int tileSize, int matchResolution, int enlargement, int workerCount,
                             Path outputPath, Duration shutdownTimeout) {

    public static final int DEFAULT_TILE_SIZE = 80;
    public static final int DEFAULT_MATCH_RESOLUTION = 5;
    public static final int DEFAULT_ENLARGEMENT = 8;
    public static final String DEFAULT_OUTPUT_PATH = "mosaic.jpeg";

    public MosaicSettings {
        if (tileSize < 1) {
            throw new IllegalArgumentException("tileSize must be at least 1, was " + tileSize);
        }
        if (matchResolution < 1) {
            throw new IllegalArgumentException("matchResolution must be at least 1, was " + matchResolution);
        }
        if (enlargement < 1) {
            throw new IllegalArgumentException("enlargement must be at least 1, was " + enlargement);
        }
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must not be negative, was " + workerCount);
        }
        if (outputPath == null || outputPath.toString().isBlank()) {
            throw new IllegalArgumentException("outputPath must not be blank");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
    }

    /**
     * Settings with all defaults and the given output path.
     */
    public static MosaicSettings defaults(Path outputPath) {
        return new MosaicSettings(DEFAULT_TILE_SIZE, DEFAULT_MATCH_RESOLUTION, DEFAULT_ENLARGEMENT,
            0, outputPath, Duration.ofSeconds(60));
    }

    /**
     * Reads settings from a {@code tessera.mosaic}-style config block.
     * Missing keys fall back to the built-in defaults.
     *
     * @param options The config block holding {@code tileSize}, {@code matchResolution}, etc.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is missing its type or out of range.
     */
    public static MosaicSettings fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "tileSize", DEFAULT_TILE_SIZE,
            "matchResolution", DEFAULT_MATCH_RESOLUTION,
            "enlargement", DEFAULT_ENLARGEMENT,
            "workerCount", 0,
            "outputPath", DEFAULT_OUTPUT_PATH,
            "shutdownTimeout", "60 seconds"
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            return new MosaicSettings(
                finalConfig.getInt("tileSize"),
                finalConfig.getInt("matchResolution"),
                finalConfig.getInt("enlargement"),
                finalConfig.getInt("workerCount"),
                Path.of(finalConfig.getString("outputPath")),
                finalConfig.getDuration("shutdownTimeout"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid mosaic configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Side length in pixels of every matching grid: {@code min(matchResolution, tileSize)}.
     */
    public int matchSide() {
        return Math.min(matchResolution, tileSize);
    }

    /**
     * Full-resolution pixels per matching pixel along one axis. Informational only;
     * block geometry is computed from {@link #matchSide()} so it stays exact.
     */
    public double blockFactor() {
        return (double) tileSize / matchSide();
    }

    /**
     * Number of matcher threads this run will use.
     */
    public int effectiveWorkerCount() {
        if (workerCount > 0) {
            return workerCount;
        }
        return Math.max(Runtime.getRuntime().availableProcessors() - 1, 1);
    }

    public MosaicSettings withWorkerCount(int count) {
        return new MosaicSettings(tileSize, matchResolution, enlargement, count, outputPath, shutdownTimeout);
    }

    public MosaicSettings withOutputPath(Path path) {
        return new MosaicSettings(tileSize, matchResolution, enlargement, workerCount, path, shutdownTimeout);
    }
}
