package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;

import cl.camodev.rrbot.ot.DTOArea;
import cl.camodev.rrbot.ot.DTOManaConfig;
import cl.camodev.rrbot.ot.DTOManaReading;
import cl.camodev.utiles.UtilImage;

/**
 * Reads the mana bar as the fraction of its region whose pixels fall in the configured HSV range.
 */
public class ManaAnalyzer {
	/** Fraction of matched pixels treated as a fully confident reading. */
	public static final double REFERENCE_FRACTION = 0.5;

	public DTOManaReading analyze(BufferedImage screen, DTOManaConfig config) {
		DTOArea region = config.getRegion();
		BufferedImage bar = UtilImage.crop(screen, region.getX(), region.getY(), region.getWidth(), region.getHeight());
		if (bar == null) {
			return DTOManaReading.none(config.getMaxMana());
		}

		int width = bar.getWidth();
		int height = bar.getHeight();
		int[] pixels = bar.getRGB(0, 0, width, height, null, 0, width);
		int matched = 0;
		for (int pixel : pixels) {
			int[] hsv = UtilImage.rgbToHsv((pixel >> 16) & 0xFF, (pixel >> 8) & 0xFF, pixel & 0xFF);
			if (config.inRange(hsv[0], hsv[1], hsv[2])) {
				matched++;
			}
		}

		double fraction = (double) matched / pixels.length;
		int current = Math.min(config.getMaxMana(), (int) Math.floor(fraction * config.getMaxMana() + 1e-9));
		double confidence = Math.min(fraction / REFERENCE_FRACTION, 1.0);
		return new DTOManaReading(current, config.getMaxMana(), fraction * 100.0, confidence);
	}
}
