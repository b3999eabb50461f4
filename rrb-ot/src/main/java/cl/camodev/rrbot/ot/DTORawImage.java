package cl.camodev.rrbot.ot;

/**
 * Pixel buffer as produced by the device side {@code screencap} command without the PNG encoder.
 * {@code bpp} is 32 for RGBA_8888 frames and 16 for RGB_565 frames.
 */
public class DTORawImage {
    public static final int HEADER_SIZE = 12;
    public static final int FORMAT_RGBA_8888 = 1;

    private final byte[] data;
    private final int width;
    private final int height;
    private final int bpp;

    public DTORawImage(byte[] data, int width, int height, int bpp) {
        this.data = data;
        this.width = width;
        this.height = height;
        this.bpp = bpp;
    }

    public byte[] getData() { return data; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBpp() { return bpp; }

    public int getBytesPerPixel() {
        return bpp / 8;
    }

    public boolean isComplete() {
        return data != null && (long) width * height * getBytesPerPixel() <= data.length;
    }
}
