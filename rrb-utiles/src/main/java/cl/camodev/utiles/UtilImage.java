package cl.camodev.utiles;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import cl.camodev.rrbot.ot.DTORawImage;

/**
 * Pixel level helpers shared by the perception code. All colour math follows the 8-bit
 * conventions used by OpenCV so thresholds can be tuned with the usual tooling.
 */
public final class UtilImage {

    private static final byte[] PNG_SIGNATURE = { (byte) 0x89, 'P', 'N', 'G' };

    private UtilImage() {
    }

    /**
     * Decodes a screen capture. PNG (from {@code screencap -p}) and the raw {@code screencap}
     * layout with its 12-byte header are both accepted.
     *
     * @param bytes encoded frame
     * @return decoded RGB image
     * @throws IOException if the bytes are neither a readable image nor a complete raw frame
     */
    public static BufferedImage decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Empty image data");
        }
        if (!isPng(bytes)) {
            DTORawImage raw = parseScreencap(bytes);
            if (raw != null && raw.isComplete()) {
                return convertRawImageToBufferedImage(raw);
            }
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image data (" + bytes.length + " bytes)");
        }
        return image;
    }

    private static boolean isPng(byte[] bytes) {
        if (bytes.length < PNG_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PNG_SIGNATURE.length; i++) {
            if (bytes[i] != PNG_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses the raw screencap header: width(4) height(4) format(4), little endian, followed by pixels.
     *
     * @return the raw image, or null if the buffer is too small or the header is implausible
     */
    public static DTORawImage parseScreencap(byte[] rawData) {
        if (rawData == null || rawData.length < DTORawImage.HEADER_SIZE) {
            return null;
        }
        int width = readIntLE(rawData, 0);
        int height = readIntLE(rawData, 4);
        int format = readIntLE(rawData, 8);
        if (width <= 0 || height <= 0 || width > 10000 || height > 10000) {
            return null;
        }

        byte[] pixelData = new byte[rawData.length - DTORawImage.HEADER_SIZE];
        System.arraycopy(rawData, DTORawImage.HEADER_SIZE, pixelData, 0, pixelData.length);

        int bpp = (format == DTORawImage.FORMAT_RGBA_8888) ? 32 : 16;
        return new DTORawImage(pixelData, width, height, bpp);
    }

    private static int readIntLE(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8)
                | ((data[offset + 2] & 0xFF) << 16) | ((data[offset + 3] & 0xFF) << 24);
    }

    public static BufferedImage convertRawImageToBufferedImage(DTORawImage rawImage) {
        int width = rawImage.getWidth();
        int height = rawImage.getHeight();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[width * height];
        byte[] data = rawImage.getData();

        if (rawImage.getBpp() == 16) {
            // RGB565
            for (int index = 0; index < pixels.length; index++) {
                int offset = index * 2;
                int pixel = ((data[offset + 1] & 0xFF) << 8) | (data[offset] & 0xFF);
                int r = ((pixel >> 11) & 0x1F) << 3;
                int g = ((pixel >> 5) & 0x3F) << 2;
                int b = (pixel & 0x1F) << 3;
                pixels[index] = (r << 16) | (g << 8) | b;
            }
        } else {
            // RGBA_8888, alpha ignored
            for (int index = 0; index < pixels.length; index++) {
                int offset = index * 4;
                int r = data[offset] & 0xFF;
                int g = data[offset + 1] & 0xFF;
                int b = data[offset + 2] & 0xFF;
                pixels[index] = (r << 16) | (g << 8) | b;
            }
        }

        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    /**
     * Copies a region of the image, clipped to the image bounds.
     *
     * @return the copied region, or null if nothing of it lies inside the image
     */
    public static BufferedImage crop(BufferedImage image, int x, int y, int width, int height) {
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(image.getWidth(), x + width);
        int y1 = Math.min(image.getHeight(), y + height);
        if (x1 <= x0 || y1 <= y0) {
            return null;
        }
        int w = x1 - x0;
        int h = y1 - y0;
        BufferedImage region = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        region.setRGB(0, 0, w, h, image.getRGB(x0, y0, w, h, null, 0, w), 0, w);
        return region;
    }

    /**
     * Luma of one RGB pixel with the BT.601 weights, rounded like {@code cvtColor(BGR2GRAY)}.
     */
    public static int gray(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
    }

    /**
     * @return row-major grayscale values of the whole image
     */
    public static int[] grayscale(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        int[] gray = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            gray[i] = gray(rgb[i]);
        }
        return gray;
    }

    public static double meanBrightness(BufferedImage image) {
        int[] gray = grayscale(image);
        if (gray.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (int value : gray) {
            sum += value;
        }
        return (double) sum / gray.length;
    }

    /**
     * Converts one RGB pixel to HSV with hue in [0,180) and saturation/value in [0,255].
     *
     * @return {h, s, v}
     */
    public static int[] rgbToHsv(int r, int g, int b) {
        int max = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        int diff = max - min;

        int s = max == 0 ? 0 : (int) Math.round(255.0 * diff / max);
        double h;
        if (diff == 0) {
            h = 0;
        } else if (max == r) {
            h = 60.0 * (g - b) / diff;
        } else if (max == g) {
            h = 120.0 + 60.0 * (b - r) / diff;
        } else {
            h = 240.0 + 60.0 * (r - g) / diff;
        }
        if (h < 0) {
            h += 360.0;
        }
        int hue = (int) Math.round(h / 2.0);
        if (hue >= 180) {
            hue -= 180;
        }
        return new int[] { hue, s, max };
    }

    /**
     * Buckets one channel value: {@code value / step * step}.
     */
    public static int quantize(int value, int step) {
        return value / step * step;
    }

    public static BufferedImage resize(BufferedImage image, int width, int height) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }
}
