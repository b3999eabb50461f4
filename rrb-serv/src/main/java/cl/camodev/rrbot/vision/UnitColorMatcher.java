package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import cl.camodev.rrbot.ot.DTOUnitSignature;
import cl.camodev.utiles.UtilImage;

/**
 * Identifies units by their dominant colours.
 * <p>
 * The central part of a cell is quantized to buckets of 20 per channel and its five most frequent
 * colours are compared, in frequency order, with every reference colour. The first colour whose
 * nearest reference lies within {@link #MAX_DISTANCE} (squared RGB distance) decides the unit.
 */
public class UnitColorMatcher {
	public static final int MAX_DISTANCE = 2000;
	public static final int QUANT_STEP = 20;
	public static final int TOP_COLORS = 5;
	public static final int MIN_DISTINCT_COLORS = 10;

	private static final int CROP_X = 17;
	private static final int CROP_Y = 15;
	private static final int CROP_MAX = 90;
	private static final int CROP_MARGIN_H = 30;
	private static final int CROP_MARGIN_W = 34;

	private final List<DTOUnitSignature> references;

	public UnitColorMatcher(List<DTOUnitSignature> references) {
		this.references = Collections.unmodifiableList(new ArrayList<>(references));
	}

	public List<DTOUnitSignature> getReferences() {
		return references;
	}

	public boolean hasReferences() {
		return !references.isEmpty();
	}

	public static final class ColorMatch {
		private final String label;
		private final int distance;

		ColorMatch(String label, int distance) {
			this.label = label;
			this.distance = distance;
		}

		public String getLabel() {
			return label;
		}

		public int getDistance() {
			return distance;
		}

		public double getConfidence() {
			return Math.max(0.1, 1.0 - (double) distance / MAX_DISTANCE);
		}
	}

	/**
	 * @return the matched unit, or empty if there are no references, the cell has no usable colour
	 *         signature, or no colour is close enough to a reference
	 */
	public Optional<ColorMatch> match(BufferedImage cell) {
		if (references.isEmpty()) {
			return Optional.empty();
		}
		for (int color : topColors(centralRegion(cell))) {
			int r = (color >> 16) & 0xFF;
			int g = (color >> 8) & 0xFF;
			int b = color & 0xFF;

			DTOUnitSignature best = null;
			int bestDistance = Integer.MAX_VALUE;
			for (DTOUnitSignature reference : references) {
				int distance = reference.squaredDistance(r, g, b);
				if (distance < bestDistance) {
					bestDistance = distance;
					best = reference;
				}
			}
			if (best != null && bestDistance <= MAX_DISTANCE) {
				return Optional.of(new ColorMatch(best.getLabel(), bestDistance));
			}
		}
		return Optional.empty();
	}

	static BufferedImage centralRegion(BufferedImage cell) {
		int size = Math.min(CROP_MAX, Math.min(cell.getHeight() - CROP_MARGIN_H, cell.getWidth() - CROP_MARGIN_W));
		if (size <= 0) {
			return null;
		}
		return UtilImage.crop(cell, CROP_X, CROP_Y, size, size);
	}

	/**
	 * Most frequent quantized colours, most frequent first; ties are broken by the packed RGB value.
	 *
	 * @return up to five packed RGB colours, or an empty list if the image has fewer than ten distinct
	 *         quantized colours
	 */
	static List<Integer> topColors(BufferedImage image) {
		if (image == null) {
			return List.of();
		}
		Map<Integer, Integer> histogram = histogram(image);
		if (histogram.size() < MIN_DISTINCT_COLORS) {
			return List.of();
		}
		return ranked(histogram, TOP_COLORS);
	}

	/**
	 * Most frequent quantized colour of a reference image, regardless of how many colours it has.
	 */
	static int dominantColor(BufferedImage image) {
		return ranked(histogram(image), 1).get(0);
	}

	private static Map<Integer, Integer> histogram(BufferedImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
		Map<Integer, Integer> histogram = new HashMap<>();
		for (int pixel : pixels) {
			int r = UtilImage.quantize((pixel >> 16) & 0xFF, QUANT_STEP);
			int g = UtilImage.quantize((pixel >> 8) & 0xFF, QUANT_STEP);
			int b = UtilImage.quantize(pixel & 0xFF, QUANT_STEP);
			histogram.merge((r << 16) | (g << 8) | b, 1, Integer::sum);
		}
		return histogram;
	}

	private static List<Integer> ranked(Map<Integer, Integer> histogram, int limit) {
		List<Map.Entry<Integer, Integer>> entries = new ArrayList<>(histogram.entrySet());
		entries.sort(Map.Entry.<Integer, Integer>comparingByValue(Comparator.reverseOrder())
				.thenComparing(Map.Entry.comparingByKey()));
		List<Integer> colors = new ArrayList<>();
		for (int i = 0; i < Math.min(limit, entries.size()); i++) {
			colors.add(entries.get(i).getKey());
		}
		return colors;
	}
}
