package org.tessera.imaging;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;

import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;

import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Reads the EXIF orientation of a JPEG and rotates pixels upright.
 * <p>
 * Orientation values follow the EXIF/TIFF standard:
 * 1 = normal, 2 = mirrored, 3 = rotated 180, 4 = flipped vertically,
 * 5 = transposed, 6 = rotated 90 CW, 7 = transversed, 8 = rotated 90 CCW.
 */
public final class ExifOrientation {

    public static final int NORMAL = 1;

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";
    private static final int APP1_MARKER = 0xE1;
    private static final int ORIENTATION_TAG = 0x0112;
    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.ISO_8859_1);

    private ExifOrientation() {
    }

    /**
     * Reads the orientation tag from decoded image metadata.
     *
     * @param metadata Metadata of the image, or {@code null}.
     * @return The orientation (1-8), or {@link #NORMAL} if the image is not a JPEG or has no tag.
     */
    public static int fromMetadata(IIOMetadata metadata) {
        if (metadata == null || !isJpeg(metadata)) {
            return NORMAL;
        }
        return findOrientation(metadata.getAsTree(JPEG_METADATA_FORMAT));
    }

    private static boolean isJpeg(IIOMetadata metadata) {
        String[] names = metadata.getMetadataFormatNames();
        if (names == null) {
            return false;
        }
        for (String name : names) {
            if (JPEG_METADATA_FORMAT.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static int findOrientation(Node node) {
        if ("unknown".equals(node.getNodeName()) && node instanceof IIOMetadataNode meta) {
            Node markerTag = node.getAttributes().getNamedItem("MarkerTag");
            if (markerTag != null && Integer.parseInt(markerTag.getNodeValue()) == APP1_MARKER
                    && meta.getUserObject() instanceof byte[] payload) {
                int orientation = parseApp1(payload);
                if (orientation != NORMAL) {
                    return orientation;
                }
            }
        }
        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            int orientation = findOrientation(children.item(i));
            if (orientation != NORMAL) {
                return orientation;
            }
        }
        return NORMAL;
    }

    /**
     * Extracts the orientation from an APP1 payload ({@code "Exif\0\0"} followed by a TIFF block).
     *
     * @return The orientation (1-8), or {@link #NORMAL} if the payload is not EXIF, is truncated,
     *         or holds an out-of-range value.
     */
    static int parseApp1(byte[] payload) {
        if (payload.length < EXIF_HEADER.length + 8) {
            return NORMAL;
        }
        for (int i = 0; i < EXIF_HEADER.length; i++) {
            if (payload[i] != EXIF_HEADER[i]) {
                return NORMAL;
            }
        }
        int tiff = EXIF_HEADER.length;
        boolean littleEndian;
        if (payload[tiff] == 'I' && payload[tiff + 1] == 'I') {
            littleEndian = true;
        } else if (payload[tiff] == 'M' && payload[tiff + 1] == 'M') {
            littleEndian = false;
        } else {
            return NORMAL;
        }

        long ifdOffset = readUnsigned(payload, tiff + 4, 4, littleEndian);
        int ifd = tiff + (int) ifdOffset;
        if (ifdOffset < 8 || ifd + 2 > payload.length) {
            return NORMAL;
        }
        int entries = (int) readUnsigned(payload, ifd, 2, littleEndian);
        for (int i = 0; i < entries; i++) {
            int entry = ifd + 2 + i * 12;
            if (entry + 12 > payload.length) {
                return NORMAL;
            }
            int tag = (int) readUnsigned(payload, entry, 2, littleEndian);
            if (tag == ORIENTATION_TAG) {
                // SHORT value, left-aligned in the 4-byte value field
                int value = (int) readUnsigned(payload, entry + 8, 2, littleEndian);
                return value >= 1 && value <= 8 ? value : NORMAL;
            }
        }
        return NORMAL;
    }

    private static long readUnsigned(byte[] data, int offset, int length, boolean littleEndian) {
        long value = 0;
        for (int i = 0; i < length; i++) {
            int b = data[littleEndian ? offset + length - 1 - i : offset + i] & 0xFF;
            value = (value << 8) | b;
        }
        return value;
    }

    /**
     * Returns {@code image} transformed so that it displays upright for the given orientation.
     * Orientation {@link #NORMAL} (or any unknown value) returns the image unchanged.
     */
    public static BufferedImage apply(BufferedImage image, int orientation) {
        if (orientation <= NORMAL || orientation > 8) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        boolean swapsAxes = orientation >= 5;
        int outW = swapsAxes ? h : w;
        int outH = swapsAxes ? w : h;
        BufferedImage out = new BufferedImage(outW, outH, BufferedImage.TYPE_INT_RGB);

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.getRGB(x, y);
                switch (orientation) {
                    case 2 -> out.setRGB(w - 1 - x, y, rgb);
                    case 3 -> out.setRGB(w - 1 - x, h - 1 - y, rgb);
                    case 4 -> out.setRGB(x, h - 1 - y, rgb);
                    case 5 -> out.setRGB(y, x, rgb);
                    case 6 -> out.setRGB(h - 1 - y, x, rgb);
                    case 7 -> out.setRGB(h - 1 - y, w - 1 - x, rgb);
                    case 8 -> out.setRGB(y, w - 1 - x, rgb);
                    default -> throw new IllegalStateException("Unexpected orientation " + orientation);
                }
            }
        }
        return out;
    }
}
