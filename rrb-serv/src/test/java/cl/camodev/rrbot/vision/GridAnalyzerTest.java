package cl.camodev.rrbot.vision;

import static cl.camodev.rrbot.vision.VisionFixtures.GREEN_UNIT;
import static cl.camodev.rrbot.vision.VisionFixtures.RED_UNIT;
import static cl.camodev.rrbot.vision.VisionFixtures.REFERENCES;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import cl.camodev.rrbot.ot.DTOGridAnalysis;
import cl.camodev.rrbot.ot.DTOGridCell;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOMergePair;
import cl.camodev.rrbot.ot.DTORankPrediction;

class GridAnalyzerTest {
	private static final DTOGridConfig GRID = new DTOGridConfig(4, 4, 80, 80, 100, 200, 10);

	private PerceptionPipeline pipeline;
	private BufferedImage screen;

	@BeforeEach
	void setUp() {
		pipeline = VisionFixtures.pipeline(REFERENCES);
		screen = VisionFixtures.blankScreen(GRID);
		VisionFixtures.drawCell(screen, GRID, 0, 0, VisionFixtures.unitCell(80, 80, RED_UNIT));
		VisionFixtures.drawCell(screen, GRID, 0, 1, VisionFixtures.unitCell(80, 80, RED_UNIT));
		VisionFixtures.drawCell(screen, GRID, 1, 1, VisionFixtures.unitCell(80, 80, GREEN_UNIT));
		VisionFixtures.drawCell(screen, GRID, 2, 2, VisionFixtures.unitCell(80, 80, new Color(220, 220, 0)));
		VisionFixtures.drawCell(screen, GRID, 3, 3, VisionFixtures.plainCell(80, 80, Color.WHITE));
	}

	@ParameterizedTest(name = "{0}x{1} grid")
	@CsvSource({ "1,1", "3,5", "4,4", "6,2" })
	@DisplayName("Grid analysis returns exactly rows x cols cells with bounded confidence")
	void cellCountMatchesGrid(int rows, int cols) {
		DTOGridConfig grid = new DTOGridConfig(rows, cols, 80, 80, 100, 200, 10);

		DTOGridAnalysis analysis = pipeline.analyzeGrid(screen, grid);

		assertEquals(rows * cols, analysis.getCells().size());
		for (DTOGridCell cell : analysis.getCells()) {
			assertTrue(cell.getConfidence() >= 0.0 && cell.getConfidence() <= 1.0, cell.toString());
		}
	}

	@Test
	@DisplayName("Cells outside the frame are reported empty with zero confidence")
	void cellsOutsideTheFrame() {
		DTOGridConfig grid = new DTOGridConfig(2, 2, 80, 80, 5000, 5000, 0);

		DTOGridAnalysis analysis = pipeline.analyzeGrid(screen, grid);

		assertEquals(4, analysis.getCells().size());
		assertTrue(analysis.getCells().stream().noneMatch(DTOGridCell::isOccupied));
		assertTrue(analysis.getCells().stream().allMatch(cell -> cell.getConfidence() == 0.0));
	}

	@Test
	@DisplayName("Units are identified by colour and unidentified occupants are marked unknown")
	void classifiesCells() {
		DTOGridAnalysis analysis = pipeline.analyzeGrid(screen, GRID);

		DTOGridCell archer = analysis.getCell(0, 0);
		assertTrue(archer.isOccupied());
		assertEquals("archer", archer.getUnitLabel());
		assertEquals(1.0, archer.getConfidence(), 1e-9);
		assertEquals(0, archer.getRank());

		assertEquals("knight", analysis.getCell(1, 1).getUnitLabel());

		DTOGridCell unknown = analysis.getCell(2, 2);
		assertTrue(unknown.isOccupied());
		assertEquals(DTOGridCell.UNKNOWN_LABEL, unknown.getUnitLabel());
		assertEquals(GridAnalyzer.UNKNOWN_CONFIDENCE, unknown.getConfidence(), 1e-9);

		DTOGridCell tooBright = analysis.getCell(3, 3);
		assertFalse(tooBright.isOccupied());
		assertEquals(GridAnalyzer.EMPTY_CONFIDENCE, tooBright.getConfidence(), 1e-9);

		DTOGridCell empty = analysis.getCell(3, 0);
		assertFalse(empty.isOccupied());
		assertEquals(GridAnalyzer.EMPTY_CONFIDENCE, empty.getConfidence(), 1e-9);
		assertEquals(12, analysis.getEmptyCells().size());
	}

	@Test
	@DisplayName("Two adjacent cells with the same unit are a mergeable pair")
	void reportsMergeablePair() {
		DTOGridAnalysis analysis = pipeline.analyzeGrid(screen, GRID);

		assertEquals(1, analysis.getMergeablePairs().size());
		DTOMergePair pair = analysis.getMergeablePairs().get(0);
		assertEquals("archer", pair.getUnitLabel());
		assertEquals(0, pair.getSource().getCol());
		assertEquals(1, pair.getTarget().getCol());
		assertTrue(pair.getSource().isAdjacentTo(pair.getTarget()));
	}

	@Test
	@DisplayName("Vertical neighbours are paired too, unknown occupants never are")
	void verticalPairs() {
		VisionFixtures.drawCell(screen, GRID, 2, 0, VisionFixtures.unitCell(80, 80, GREEN_UNIT));
		VisionFixtures.drawCell(screen, GRID, 3, 0, VisionFixtures.unitCell(80, 80, GREEN_UNIT));
		VisionFixtures.drawCell(screen, GRID, 2, 3, VisionFixtures.unitCell(80, 80, new Color(220, 220, 0)));

		List<DTOMergePair> pairs = pipeline.analyzeGrid(screen, GRID).getMergeablePairs();

		assertEquals(2, pairs.size());
		assertTrue(pairs.stream().anyMatch(p -> p.getSource().getRow() == 2 && p.getTarget().getRow() == 3
				&& p.getSource().getCol() == 0));
		assertTrue(pairs.stream().noneMatch(p -> DTOGridCell.UNKNOWN_LABEL.equals(p.getUnitLabel())));
	}

	@Test
	@DisplayName("The same frame and references always give the same result")
	void deterministic() {
		byte[] frame = VisionFixtures.png(screen);

		List<String> first = describe(pipeline.analyzeGrid(frame, GRID));
		List<String> second = describe(pipeline.analyzeGrid(frame, GRID));

		assertEquals(first, second);
		assertEquals(describe(pipeline.analyzeGrid(screen, GRID)), first);
	}

	private static List<String> describe(DTOGridAnalysis analysis) {
		return analysis.getCells().stream().map(DTOGridCell::toString).collect(Collectors.toList());
	}

	@Test
	@DisplayName("An undecodable frame yields an empty zero-confidence grid")
	void undecodableFrame() {
		DTOGridAnalysis analysis = pipeline.analyzeGrid(new byte[] { 1, 2, 3, 4 }, GRID);

		assertFalse(analysis.isDecoded());
		assertEquals(16, analysis.getCells().size());
		assertTrue(analysis.getCells().stream().noneMatch(DTOGridCell::isOccupied));
		assertTrue(analysis.getCells().stream().allMatch(cell -> cell.getConfidence() == 0.0));
		assertTrue(analysis.getMergeablePairs().isEmpty());
		assertEquals(1, pipeline.getStats().getDecodeFailures());
	}

	@Test
	@DisplayName("A confident rank prediction is appended to the unit label")
	void rankSuffix() {
		GridAnalyzer analyzer = new GridAnalyzer(new UnitColorMatcher(REFERENCES), new TemplateMatcher(List.of()),
				cell -> new DTORankPrediction(3, 0.9), new VisionStatistics());

		DTOGridAnalysis analysis = analyzer.analyze(screen, GRID, System.nanoTime());

		assertEquals("archer_rank_3", analysis.getCell(0, 0).getUnitLabel());
		assertEquals(3, analysis.getCell(0, 0).getRank());
		assertEquals(0.9, analysis.getCell(0, 0).getRankConfidence(), 1e-9);
		assertEquals(1, analysis.getMergeablePairs().size());
	}

	@Test
	@DisplayName("A weak rank prediction keeps the plain unit label")
	void weakRankIgnoredInLabel() {
		GridAnalyzer analyzer = new GridAnalyzer(new UnitColorMatcher(REFERENCES), new TemplateMatcher(List.of()),
				cell -> new DTORankPrediction(2, 0.4), new VisionStatistics());

		assertEquals("archer", analyzer.analyze(screen, GRID, System.nanoTime()).getCell(0, 0).getUnitLabel());
	}

	@Test
	@DisplayName("Statistics count analyses")
	void countsAnalyses() {
		pipeline.analyzeGrid(screen, GRID);
		pipeline.analyzeGrid(screen, GRID);

		assertEquals(2, pipeline.getStats().getGridAnalyses());
		assertEquals(2, pipeline.getStats().getTotalAnalyses());
		assertEquals(2, pipeline.getStats().getReferenceColors());
		assertFalse(pipeline.getStats().isRankModelLoaded());
	}
}
