package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.utiles.UtilImage;

/**
 * Loads the bundled OpenCV native library on first use and converts images into {@link Mat}s.
 * When the native library cannot be loaded the edge and template paths are skipped.
 */
public final class OpenCvSupport {
	private static final Logger logger = LoggerFactory.getLogger(OpenCvSupport.class);

	private static Boolean available;

	private OpenCvSupport() {
	}

	public static synchronized boolean isAvailable() {
		if (available == null) {
			try {
				nu.pattern.OpenCV.loadLocally();
				available = Boolean.TRUE;
				logger.info("OpenCV native library loaded");
			} catch (RuntimeException | LinkageError e) {
				available = Boolean.FALSE;
				logger.warn("OpenCV native library could not be loaded, edge and template matching disabled: {}",
						e.getMessage());
			}
		}
		return available;
	}

	public static Mat toGrayMat(BufferedImage image) {
		int[] gray = UtilImage.grayscale(image);
		byte[] bytes = new byte[gray.length];
		for (int i = 0; i < gray.length; i++) {
			bytes[i] = (byte) gray[i];
		}
		Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC1);
		mat.put(0, 0, bytes);
		return mat;
	}

	public static Mat toBgrMat(BufferedImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
		byte[] bytes = new byte[rgb.length * 3];
		for (int i = 0; i < rgb.length; i++) {
			bytes[i * 3] = (byte) (rgb[i] & 0xFF);
			bytes[i * 3 + 1] = (byte) ((rgb[i] >> 8) & 0xFF);
			bytes[i * 3 + 2] = (byte) ((rgb[i] >> 16) & 0xFF);
		}
		Mat mat = new Mat(height, width, CvType.CV_8UC3);
		mat.put(0, 0, bytes);
		return mat;
	}
}
