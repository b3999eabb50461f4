package cl.camodev.rrbot.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateMatcherTest {

	@TempDir
	Path temp;

	private static BufferedImage pattern(Color background, Color mark) {
		BufferedImage image = VisionFixtures.plainCell(80, 80, background);
		Graphics2D g = image.createGraphics();
		try {
			g.setColor(mark);
			g.fillOval(15, 10, 40, 55);
			g.fillRect(50, 50, 20, 10);
		} finally {
			g.dispose();
		}
		return image;
	}

	@Test
	@DisplayName("Without templates nothing matches")
	void noTemplates() {
		assertTrue(new TemplateMatcher(List.of()).match(pattern(Color.GRAY, Color.YELLOW)).isEmpty());
		assertEquals(0, TemplateMatcher.loadDirectory("").size());
		assertEquals(0, TemplateMatcher.loadDirectory(temp.resolve("missing").toString()).size());
	}

	@Test
	@DisplayName("The best template above its threshold wins")
	void matchesTemplate() {
		assumeTrue(OpenCvSupport.isAvailable(), "OpenCV native library not available");
		BufferedImage cell = pattern(new Color(60, 60, 60), new Color(230, 200, 40));
		TemplateMatcher matcher = new TemplateMatcher(List.of(
				new TemplateMatcher.Template("giant", cell, 0.8),
				new TemplateMatcher.Template("stripes", VisionFixtures.unitCell(80, 80, Color.BLUE), 0.8)));

		Optional<TemplateMatcher.TemplateMatch> match = matcher.match(cell);

		assertTrue(match.isPresent());
		assertEquals("giant", match.get().getName());
		assertTrue(match.get().getScore() > 0.95);
	}

	@Test
	@DisplayName("Templates and thresholds load from a directory")
	void loadsDirectory() throws IOException {
		Path directory = Files.createDirectory(temp.resolve("templates"));
		ImageIO.write(pattern(Color.GRAY, Color.RED), "png", directory.resolve("giant.png").toFile());
		ImageIO.write(pattern(Color.GRAY, Color.GREEN), "png", directory.resolve("wizard.png").toFile());
		Files.writeString(directory.resolve(TemplateMatcher.THRESHOLDS_FILE), "wizard=0.9\n");

		TemplateMatcher matcher = TemplateMatcher.loadDirectory(directory.toString());

		assertEquals(2, matcher.size());
	}
}
