package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import cl.camodev.utiles.UtilImage;

/**
 * Grayscale, Canny edges (50/100), flattened row-major with edge pixels as 1 and the rest as 0.
 * Requires {@link OpenCvSupport#isAvailable()}.
 */
public class EdgeFeatureExtractor {
	public static final double CANNY_LOW = 50;
	public static final double CANNY_HIGH = 100;

	public float[] extract(BufferedImage cell, int width, int height) {
		BufferedImage input = (cell.getWidth() == width && cell.getHeight() == height)
				? cell
				: UtilImage.resize(cell, width, height);
		Mat gray = OpenCvSupport.toGrayMat(input);
		Mat edges = new Mat();
		try {
			Imgproc.Canny(gray, edges, CANNY_LOW, CANNY_HIGH);
			byte[] data = new byte[width * height];
			edges.get(0, 0, data);
			float[] features = new float[data.length];
			for (int i = 0; i < data.length; i++) {
				features[i] = (data[i] & 0xFF) > 0 ? 1f : 0f;
			}
			return features;
		} finally {
			gray.release();
			edges.release();
		}
	}
}
