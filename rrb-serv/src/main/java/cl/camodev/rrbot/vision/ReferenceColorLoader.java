package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.ot.DTOUnitSignature;
import cl.camodev.utiles.number.NumberConverters;

/**
 * Builds the unit reference table.
 * <p>
 * A directory is read as one PNG per unit (label = file name without extension, colour = its most
 * frequent quantized colour). A file is read as properties with entries {@code label=r,g,b}.
 * Entries are ordered by label.
 */
public class ReferenceColorLoader {
	private static final Logger logger = LoggerFactory.getLogger(ReferenceColorLoader.class);

	public List<DTOUnitSignature> load(String location) {
		if (location == null || location.isBlank()) {
			logger.info("No unit reference location configured, colour matching disabled");
			return List.of();
		}
		Path path = Path.of(location);
		try {
			if (Files.isDirectory(path)) {
				return fromDirectory(path);
			}
			if (Files.isRegularFile(path)) {
				return fromProperties(path);
			}
			logger.warn("Unit reference location {} does not exist", path);
		} catch (IOException e) {
			logger.error("Could not load unit references from {}", path, e);
		}
		return List.of();
	}

	public List<DTOUnitSignature> fromDirectory(Path directory) throws IOException {
		TreeSet<Path> files = new TreeSet<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.png")) {
			stream.forEach(files::add);
		}

		List<DTOUnitSignature> references = new ArrayList<>();
		for (Path file : files) {
			BufferedImage image = ImageIO.read(file.toFile());
			if (image == null) {
				logger.warn("Skipping unreadable unit reference {}", file);
				continue;
			}
			int color = UnitColorMatcher.dominantColor(image);
			String name = file.getFileName().toString();
			String label = name.substring(0, name.length() - ".png".length());
			references.add(new DTOUnitSignature(label, (color >> 16) & 0xFF, (color >> 8) & 0xFF, color & 0xFF));
		}
		logger.info("Loaded {} unit references from {}", references.size(), directory);
		return references;
	}

	public List<DTOUnitSignature> fromProperties(Path file) throws IOException {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		List<DTOUnitSignature> references = new ArrayList<>();
		for (String label : new TreeSet<>(properties.stringPropertyNames())) {
			try {
				int[] rgb = NumberConverters.parseTriple(properties.getProperty(label));
				references.add(new DTOUnitSignature(label, rgb[0], rgb[1], rgb[2]));
			} catch (IllegalArgumentException e) {
				logger.warn("Skipping unit reference '{}': {}", label, e.getMessage());
			}
		}
		logger.info("Loaded {} unit references from {}", references.size(), file);
		return references;
	}
}
