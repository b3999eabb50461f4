package cl.camodev.rrbot.vision;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import javax.imageio.ImageIO;

import cl.camodev.rrbot.ot.DTOArea;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOUnitSignature;

/**
 * Synthetic frames for perception tests.
 */
final class VisionFixtures {
	static final Color RED_UNIT = new Color(200, 40, 40);
	static final Color GREEN_UNIT = new Color(40, 160, 60);

	static final List<DTOUnitSignature> REFERENCES = List.of(
			new DTOUnitSignature("archer", 200, 40, 40),
			new DTOUnitSignature("knight", 40, 160, 60));

	private VisionFixtures() {
	}

	/**
	 * A cell filled with the unit colour plus twelve small swatches of distinct colours inside the
	 * sampled centre, so the colour signature has enough distinct colours.
	 */
	static BufferedImage unitCell(int width, int height, Color unit) {
		BufferedImage cell = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = cell.createGraphics();
		try {
			g.setColor(unit);
			g.fillRect(0, 0, width, height);
			for (int k = 0; k < 12; k++) {
				g.setColor(new Color(0, 0, k * 20 + 5));
				g.fillRect(20 + (k % 6) * 3, 20 + (k / 6) * 3, 2, 2);
			}
		} finally {
			g.dispose();
		}
		return cell;
	}

	static BufferedImage plainCell(int width, int height, Color color) {
		BufferedImage cell = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = cell.createGraphics();
		try {
			g.setColor(color);
			g.fillRect(0, 0, width, height);
		} finally {
			g.dispose();
		}
		return cell;
	}

	/**
	 * A black screen large enough for the grid.
	 */
	static BufferedImage blankScreen(DTOGridConfig grid) {
		DTOArea last = grid.cellArea(grid.getRows() - 1, grid.getCols() - 1);
		return new BufferedImage(last.getX() + last.getWidth() + 50, last.getY() + last.getHeight() + 50,
				BufferedImage.TYPE_INT_RGB);
	}

	static void drawCell(BufferedImage screen, DTOGridConfig grid, int row, int col, BufferedImage cell) {
		DTOArea area = grid.cellArea(row, col);
		Graphics2D g = screen.createGraphics();
		try {
			g.drawImage(cell, area.getX(), area.getY(), null);
		} finally {
			g.dispose();
		}
	}

	static byte[] png(BufferedImage image) {
		try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			ImageIO.write(image, "png", out);
			return out.toByteArray();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	static PerceptionPipeline pipeline(List<DTOUnitSignature> references) {
		return new PerceptionPipeline(new UnitColorMatcher(references), new TemplateMatcher(List.of()),
				new UnavailableRankClassifier(), new EdgeFeatureExtractor());
	}
}
