package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;

import javax.imageio.ImageIO;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.utiles.UtilImage;

/**
 * Fallback identification by normalized cross-correlation ({@code TM_CCOEFF_NORMED}) against unit
 * templates scaled to the cell size.
 */
public class TemplateMatcher {
	private static final Logger logger = LoggerFactory.getLogger(TemplateMatcher.class);

	public static final double DEFAULT_THRESHOLD = 0.8;
	public static final String THRESHOLDS_FILE = "thresholds.properties";

	public static final class Template {
		private final String name;
		private final BufferedImage image;
		private final double threshold;

		public Template(String name, BufferedImage image, double threshold) {
			this.name = name;
			this.image = image;
			this.threshold = threshold;
		}

		public String getName() { return name; }
		public BufferedImage getImage() { return image; }
		public double getThreshold() { return threshold; }
	}

	public static final class TemplateMatch {
		private final String name;
		private final double score;

		TemplateMatch(String name, double score) {
			this.name = name;
			this.score = score;
		}

		public String getName() { return name; }
		public double getScore() { return score; }
	}

	private final List<Template> templates;

	public TemplateMatcher(List<Template> templates) {
		this.templates = Collections.unmodifiableList(new ArrayList<>(templates));
	}

	public int size() {
		return templates.size();
	}

	/**
	 * @return the best template scoring above its own threshold, or empty
	 */
	public Optional<TemplateMatch> match(BufferedImage cell) {
		if (templates.isEmpty() || !OpenCvSupport.isAvailable()) {
			return Optional.empty();
		}
		Mat cellMat = OpenCvSupport.toBgrMat(cell);
		Mat result = new Mat();
		try {
			TemplateMatch best = null;
			for (Template template : templates) {
				BufferedImage scaled = UtilImage.resize(template.getImage(), cell.getWidth(), cell.getHeight());
				Mat templateMat = OpenCvSupport.toBgrMat(scaled);
				try {
					Imgproc.matchTemplate(cellMat, templateMat, result, Imgproc.TM_CCOEFF_NORMED);
					double score = Core.minMaxLoc(result).maxVal;
					if (score > template.getThreshold() && (best == null || score > best.getScore())) {
						best = new TemplateMatch(template.getName(), Math.min(1.0, score));
					}
				} finally {
					templateMat.release();
				}
			}
			return Optional.ofNullable(best);
		} finally {
			cellMat.release();
			result.release();
		}
	}

	/**
	 * Loads every PNG in the directory; thresholds come from an optional {@value #THRESHOLDS_FILE}
	 * ({@code name=0.85}), defaulting to {@value #DEFAULT_THRESHOLD}.
	 */
	public static TemplateMatcher loadDirectory(String location) {
		if (location == null || location.isBlank()) {
			return new TemplateMatcher(List.of());
		}
		Path directory = Path.of(location);
		if (!Files.isDirectory(directory)) {
			logger.warn("Template directory {} does not exist", directory);
			return new TemplateMatcher(List.of());
		}
		List<Template> templates = new ArrayList<>();
		try {
			Properties thresholds = new Properties();
			Path thresholdFile = directory.resolve(THRESHOLDS_FILE);
			if (Files.isRegularFile(thresholdFile)) {
				try (Reader reader = Files.newBufferedReader(thresholdFile, StandardCharsets.UTF_8)) {
					thresholds.load(reader);
				}
			}
			TreeSet<Path> files = new TreeSet<>();
			try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.png")) {
				stream.forEach(files::add);
			}
			for (Path file : files) {
				BufferedImage image = ImageIO.read(file.toFile());
				if (image == null) {
					logger.warn("Skipping unreadable template {}", file);
					continue;
				}
				String fileName = file.getFileName().toString();
				String name = fileName.substring(0, fileName.length() - ".png".length());
				double threshold = Double.parseDouble(thresholds.getProperty(name, String.valueOf(DEFAULT_THRESHOLD)));
				templates.add(new Template(name, image, threshold));
			}
		} catch (IOException | NumberFormatException e) {
			logger.error("Could not load templates from {}", directory, e);
		}
		logger.info("Loaded {} templates from {}", templates.size(), directory);
		return new TemplateMatcher(templates);
	}
}
