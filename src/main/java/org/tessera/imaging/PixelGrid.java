package org.tessera.imaging;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Immutable width x height grid of RGB pixels.
 * <p>
 * Pixels are stored row-major as packed {@code 0xRRGGBB} ints, the same layout
 * {@link BufferedImage#TYPE_INT_RGB} uses for its backing buffer. Alpha is never stored.
 */
public final class PixelGrid {

    private final int width;
    private final int height;
    private final int[] rgb;

    /**
     * Creates a grid from packed RGB values. The array is copied.
     *
     * @param width  Grid width in pixels (&gt;= 0).
     * @param height Grid height in pixels (&gt;= 0).
     * @param rgb    Row-major packed RGB values, length {@code width * height}.
     * @throws IllegalArgumentException if the dimensions do not match the array length.
     */
    public PixelGrid(int width, int height, int[] rgb) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must not be negative: " + width + "x" + height);
        }
        if (rgb.length != width * height) {
            throw new IllegalArgumentException(
                "Pixel count " + rgb.length + " does not match dimensions " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgb = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            this.rgb[i] = rgb[i] & 0xFFFFFF;
        }
    }

    /**
     * Creates a grid filled with a single colour.
     */
    public static PixelGrid filled(int width, int height, int rgb) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, rgb);
        return new PixelGrid(width, height, pixels);
    }

    /**
     * Snapshots the pixels of an image. Alpha is discarded.
     */
    public static PixelGrid fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] pixels = image.getRGB(0, 0, w, h, null, 0, w);
        return new PixelGrid(w, h, pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return rgb.length;
    }

    /**
     * @return Packed {@code 0xRRGGBB} value at (x, y).
     */
    public int rgbAt(int x, int y) {
        return rgb[y * width + x];
    }

    /**
     * Copies the rectangle starting at (x0, y0) into a new row-major array.
     *
     * @throws IndexOutOfBoundsException if the rectangle leaves the grid.
     */
    public int[] copyRegion(int x0, int y0, int regionWidth, int regionHeight) {
        if (x0 < 0 || y0 < 0 || regionWidth < 0 || regionHeight < 0
                || x0 + regionWidth > width || y0 + regionHeight > height) {
            throw new IndexOutOfBoundsException(String.format(
                "Region (%d,%d %dx%d) outside grid %dx%d", x0, y0, regionWidth, regionHeight, width, height));
        }
        int[] region = new int[regionWidth * regionHeight];
        for (int row = 0; row < regionHeight; row++) {
            System.arraycopy(rgb, (y0 + row) * width + x0, region, row * regionWidth, regionWidth);
        }
        return region;
    }

    /**
     * @return A copy of all pixels in row-major order.
     */
    public int[] toArray() {
        return rgb.clone();
    }

    /**
     * Renders this grid into a new {@link BufferedImage#TYPE_INT_RGB} image.
     */
    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] buffer = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(rgb, 0, buffer, 0, rgb.length);
        return image;
    }

    public static int red(int rgb) {
        return (rgb >> 16) & 0xFF;
    }

    public static int green(int rgb) {
        return (rgb >> 8) & 0xFF;
    }

    public static int blue(int rgb) {
        return rgb & 0xFF;
    }

    public static int rgb(int red, int green, int blue) {
        return ((red & 0xFF) << 16) | ((green & 0xFF) << 8) | (blue & 0xFF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + width + "x" + height + "]";
    }
}
