package org.tessera.imaging;

import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Cropping and resizing helpers. All results are {@link BufferedImage#TYPE_INT_RGB}.
 */
public final class ImageScaler {

    private ImageScaler() {
    }

    /**
     * Crops the largest centred square out of {@code image}.
     */
    public static BufferedImage cropToSquare(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int side = Math.min(w, h);
        return crop(image, (w - side) / 2, (h - side) / 2, side, side);
    }

    /**
     * Copies a rectangle of {@code image} into a new RGB image.
     */
    public static BufferedImage crop(BufferedImage image, int x, int y, int width, int height) {
        BufferedImage cropped = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = cropped.createGraphics();
        try {
            g.drawImage(image, 0, 0, width, height, x, y, x + width, y + height, null);
        } finally {
            g.dispose();
        }
        return cropped;
    }

    /**
     * Resizes {@code image} to exactly {@code width x height}.
     * <p>
     * Shrinking averages every source pixel that falls into a destination pixel, so a 1x1 result
     * is the mean colour of the whole image. Enlarging uses bicubic interpolation.
     */
    public static BufferedImage resize(BufferedImage image, int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Cannot resize to " + width + "x" + height);
        }
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            if (width <= image.getWidth() && height <= image.getHeight()) {
                Image averaged = image.getScaledInstance(width, height, Image.SCALE_AREA_AVERAGING);
                g.drawImage(averaged, 0, 0, null);
            } else {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g.drawImage(image, 0, 0, width, height, null);
            }
        } finally {
            g.dispose();
        }
        return resized;
    }
}
