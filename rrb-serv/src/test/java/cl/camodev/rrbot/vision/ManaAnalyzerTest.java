package cl.camodev.rrbot.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.ot.DTOArea;
import cl.camodev.rrbot.ot.DTOGameState;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOManaConfig;
import cl.camodev.rrbot.ot.DTOManaReading;

class ManaAnalyzerTest {
	private static final DTOManaConfig MANA = new DTOManaConfig(DTOArea.of(50, 50, 200, 30),
			new int[] { 100, 150, 200 }, new int[] { 120, 255, 255 }, 10);
	private static final Color MANA_BLUE = new Color(0, 80, 255);

	private static BufferedImage screenWithBar(int filledColumns) {
		BufferedImage screen = new BufferedImage(400, 200, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = screen.createGraphics();
		try {
			g.setColor(MANA_BLUE);
			g.fillRect(50, 50, filledColumns, 30);
		} finally {
			g.dispose();
		}
		return screen;
	}

	@Test
	@DisplayName("A bar filled to 40% reads 4 of 10")
	void fortyPercent() {
		DTOManaReading reading = new ManaAnalyzer().analyze(screenWithBar(80), MANA);

		assertEquals(4, reading.getCurrent());
		assertEquals(10, reading.getMax());
		assertEquals(40.0, reading.getPercentage(), 1e-9);
		assertEquals(0.8, reading.getConfidence(), 1e-9);
	}

	@Test
	@DisplayName("Confidence is capped once half the region matches")
	void confidenceCapped() {
		DTOManaReading full = new ManaAnalyzer().analyze(screenWithBar(200), MANA);
		DTOManaReading empty = new ManaAnalyzer().analyze(screenWithBar(0), MANA);

		assertEquals(10, full.getCurrent());
		assertEquals(1.0, full.getConfidence(), 1e-9);
		assertEquals(0, empty.getCurrent());
		assertEquals(0.0, empty.getConfidence(), 1e-9);
	}

	@Test
	@DisplayName("A region outside the frame gives a zero reading")
	void regionOutsideFrame() {
		DTOManaReading reading = new ManaAnalyzer().analyze(new BufferedImage(40, 40, BufferedImage.TYPE_INT_RGB),
				MANA);

		assertEquals(0, reading.getCurrent());
		assertEquals(0.0, reading.getConfidence(), 1e-9);
	}

	@Test
	@DisplayName("An undecodable frame gives a zero reading through the pipeline")
	void undecodableFrame() {
		PerceptionPipeline pipeline = VisionFixtures.pipeline(VisionFixtures.REFERENCES);

		DTOManaReading reading = pipeline.analyzeMana(new byte[] { 7, 7, 7 }, MANA);

		assertEquals(0, reading.getCurrent());
		assertEquals(10, reading.getMax());
		assertEquals(0.0, reading.getConfidence(), 1e-9);
	}

	@Test
	@DisplayName("Grid and mana are read from the same encoded frame")
	void fullFrame() {
		PerceptionPipeline pipeline = VisionFixtures.pipeline(VisionFixtures.REFERENCES);
		byte[] frame = VisionFixtures.png(screenWithBar(80));

		DTOGameState state = pipeline.analyze(frame, new DTOGridConfig(2, 2, 80, 80, 100, 100, 10), MANA);

		assertEquals(4, state.getMana().getCurrent());
		assertEquals(4, state.getGrid().getCells().size());
	}
}
