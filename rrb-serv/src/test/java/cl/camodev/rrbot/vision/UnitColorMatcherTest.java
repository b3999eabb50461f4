package cl.camodev.rrbot.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
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

import cl.camodev.rrbot.ot.DTOUnitSignature;

class UnitColorMatcherTest {

	@TempDir
	Path temp;

	@Test
	@DisplayName("Confidence falls linearly with the squared distance to the reference")
	void confidenceFromDistance() {
		BufferedImage cell = VisionFixtures.unitCell(80, 80, VisionFixtures.RED_UNIT);

		Optional<UnitColorMatcher.ColorMatch> near = new UnitColorMatcher(
				List.of(new DTOUnitSignature("archer", 220, 40, 40))).match(cell);
		Optional<UnitColorMatcher.ColorMatch> far = new UnitColorMatcher(
				List.of(new DTOUnitSignature("archer", 200, 40, 80))).match(cell);

		assertEquals(400, near.get().getDistance());
		assertEquals(0.8, near.get().getConfidence(), 1e-9);
		assertEquals(1600, far.get().getDistance());
		assertEquals(0.2, far.get().getConfidence(), 1e-9);
	}

	@Test
	@DisplayName("Colours farther than the distance limit do not match")
	void distanceLimit() {
		BufferedImage cell = VisionFixtures.unitCell(80, 80, VisionFixtures.RED_UNIT);

		assertTrue(new UnitColorMatcher(List.of(new DTOUnitSignature("archer", 250, 40, 40))).match(cell).isEmpty());
		assertTrue(new UnitColorMatcher(List.of()).match(cell).isEmpty());
	}

	@Test
	@DisplayName("Cells with fewer than ten distinct colours have no signature")
	void needsDistinctColours() {
		BufferedImage flat = VisionFixtures.plainCell(80, 80, VisionFixtures.RED_UNIT);

		assertTrue(UnitColorMatcher.topColors(flat).isEmpty());
		assertTrue(new UnitColorMatcher(VisionFixtures.REFERENCES).match(flat).isEmpty());
	}

	@Test
	@DisplayName("Top colours are ordered by frequency and capped at five")
	void topColours() {
		List<Integer> colors = UnitColorMatcher.topColors(
				UnitColorMatcher.centralRegion(VisionFixtures.unitCell(80, 80, VisionFixtures.RED_UNIT)));

		assertEquals(UnitColorMatcher.TOP_COLORS, colors.size());
		assertEquals((200 << 16) | (40 << 8) | 40, colors.get(0).intValue());
	}

	@Test
	@DisplayName("Reference colours load from unit images and from a properties table")
	void loadsReferences() throws IOException {
		Path images = Files.createDirectory(temp.resolve("units"));
		ImageIO.write(VisionFixtures.plainCell(20, 20, new Color(45, 165, 62)), "png",
				images.resolve("knight.png").toFile());
		ImageIO.write(VisionFixtures.plainCell(20, 20, VisionFixtures.RED_UNIT), "png",
				images.resolve("archer.png").toFile());

		List<DTOUnitSignature> fromImages = new ReferenceColorLoader().load(images.toString());

		assertEquals(2, fromImages.size());
		assertEquals("archer", fromImages.get(0).getLabel());
		assertEquals("knight", fromImages.get(1).getLabel());
		assertEquals(40, fromImages.get(1).getRed());
		assertEquals(160, fromImages.get(1).getGreen());

		Path table = temp.resolve("units.properties");
		Files.writeString(table, "mage=120,40,200\n");
		List<DTOUnitSignature> fromTable = new ReferenceColorLoader().load(table.toString());

		assertEquals(1, fromTable.size());
		assertEquals("mage", fromTable.get(0).getLabel());
		assertEquals(200, fromTable.get(0).getBlue());
	}

	@Test
	@DisplayName("A missing reference location disables colour matching")
	void missingReferences() {
		assertTrue(new ReferenceColorLoader().load(temp.resolve("nothing").toString()).isEmpty());
		assertTrue(new ReferenceColorLoader().load("").isEmpty());
	}
}
