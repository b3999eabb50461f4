package cl.camodev.utiles;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.ot.DTORawImage;

class UtilImageTest {

    private static byte[] rawFrame(int width, int height, int format, byte[] pixels) {
        byte[] data = new byte[DTORawImage.HEADER_SIZE + pixels.length];
        writeIntLE(data, 0, width);
        writeIntLE(data, 4, height);
        writeIntLE(data, 8, format);
        System.arraycopy(pixels, 0, data, DTORawImage.HEADER_SIZE, pixels.length);
        return data;
    }

    private static void writeIntLE(byte[] data, int offset, int value) {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >> 8);
        data[offset + 2] = (byte) (value >> 16);
        data[offset + 3] = (byte) (value >> 24);
    }

    @Test
    @DisplayName("Raw RGBA_8888 screencap frames decode to RGB pixels")
    void decodesRawRgbaFrame() throws IOException {
        byte[] pixels = {
                (byte) 255, 0, 0, (byte) 255,
                0, (byte) 255, 0, (byte) 255 };
        BufferedImage image = UtilImage.decode(rawFrame(2, 1, DTORawImage.FORMAT_RGBA_8888, pixels));

        assertEquals(2, image.getWidth());
        assertEquals(1, image.getHeight());
        assertEquals(0xFF0000, image.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0x00FF00, image.getRGB(1, 0) & 0xFFFFFF);
    }

    @Test
    @DisplayName("Raw RGB_565 frames expand each channel to 8 bits")
    void decodesRawRgb565Frame() throws IOException {
        // pure blue in RGB565 is 0x001F, little endian
        byte[] pixels = { 0x1F, 0x00 };
        BufferedImage image = UtilImage.decode(rawFrame(1, 1, 4, pixels));

        assertEquals(0x0000F8, image.getRGB(0, 0) & 0xFFFFFF);
    }

    @Test
    @DisplayName("PNG bytes decode through ImageIO")
    void decodesPng() throws IOException {
        BufferedImage source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        source.setRGB(1, 1, 0x123456);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(source, "png", out);

        BufferedImage decoded = UtilImage.decode(out.toByteArray());

        assertEquals(3, decoded.getWidth());
        assertEquals(0x123456, decoded.getRGB(1, 1) & 0xFFFFFF);
    }

    @Test
    @DisplayName("Garbage and truncated input fail with IOException")
    void rejectsCorruptData() {
        assertThrows(IOException.class, () -> UtilImage.decode("definitely not an image".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IOException.class, () -> UtilImage.decode(new byte[0]));
        assertThrows(IOException.class, () -> UtilImage.decode(rawFrame(100, 100, 1, new byte[16])));
    }

    @Test
    @DisplayName("Too small buffers have no screencap header")
    void shortBufferHasNoHeader() {
        assertNull(UtilImage.parseScreencap(new byte[5]));
        assertNotNull(UtilImage.parseScreencap(rawFrame(1, 1, 1, new byte[4])));
    }

    @Test
    @DisplayName("HSV conversion uses the 0-180 hue scale")
    void hsvUsesHalfDegreeHue() {
        assertArrayEquals(new int[] { 120, 255, 255 }, UtilImage.rgbToHsv(0, 0, 255));
        assertArrayEquals(new int[] { 0, 255, 255 }, UtilImage.rgbToHsv(255, 0, 0));
        assertArrayEquals(new int[] { 60, 255, 255 }, UtilImage.rgbToHsv(0, 255, 0));
        assertArrayEquals(new int[] { 0, 0, 128 }, UtilImage.rgbToHsv(128, 128, 128));
    }

    @Test
    @DisplayName("Crop is clipped to the image bounds")
    void cropClipsToBounds() {
        BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);

        BufferedImage region = UtilImage.crop(image, 5, 5, 20, 20);

        assertEquals(5, region.getWidth());
        assertEquals(5, region.getHeight());
        assertNull(UtilImage.crop(image, 50, 50, 5, 5));
    }

    @Test
    @DisplayName("Brightness and quantization")
    void brightnessAndQuantization() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xFFFFFF);
        image.setRGB(1, 0, 0x000000);

        assertEquals(127.5, UtilImage.meanBrightness(image), 0.001);
        assertEquals(40, UtilImage.quantize(59, 20));
        assertEquals(240, UtilImage.quantize(255, 20));
    }
}
