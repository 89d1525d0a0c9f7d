package org.tessera.imaging;

import java.util.Objects;

/**
 * The prepared target image.
 *
 * @param fullGrid  The enlarged, cropped target; both sides are multiples of {@code tileSize}.
 * @param smallGrid The downsampled target; both sides are multiples of {@code matchSide}.
 */
public record TargetImage(PixelGrid fullGrid, PixelGrid smallGrid) {

    public TargetImage {
        Objects.requireNonNull(fullGrid, "fullGrid");
        Objects.requireNonNull(smallGrid, "smallGrid");
    }
}
