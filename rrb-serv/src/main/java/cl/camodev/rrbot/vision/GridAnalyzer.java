package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import cl.camodev.rrbot.ot.DTOArea;
import cl.camodev.rrbot.ot.DTOGridAnalysis;
import cl.camodev.rrbot.ot.DTOGridCell;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOMergePair;
import cl.camodev.rrbot.ot.DTORankPrediction;
import cl.camodev.utiles.UtilImage;

/**
 * Classifies every slot of the grid.
 * <p>
 * Per cell: a brightness outside [30, 220] means empty; otherwise the colour signature decides the
 * unit, then template matching, and failing both the cell is an unidentified occupant.
 */
public class GridAnalyzer {
	public static final double MIN_BRIGHTNESS = 30.0;
	public static final double MAX_BRIGHTNESS = 220.0;
	public static final double EMPTY_CONFIDENCE = 0.1;
	public static final double UNKNOWN_CONFIDENCE = 0.5;
	public static final double RANK_LABEL_CONFIDENCE = 0.5;

	private final UnitColorMatcher colorMatcher;
	private final TemplateMatcher templateMatcher;
	private final Function<BufferedImage, DTORankPrediction> rankDetector;
	private final VisionStatistics statistics;

	public GridAnalyzer(UnitColorMatcher colorMatcher, TemplateMatcher templateMatcher,
			Function<BufferedImage, DTORankPrediction> rankDetector, VisionStatistics statistics) {
		this.colorMatcher = colorMatcher;
		this.templateMatcher = templateMatcher;
		this.rankDetector = rankDetector;
		this.statistics = statistics;
	}

	public DTOGridAnalysis analyze(BufferedImage screen, DTOGridConfig grid, long startNanos) {
		List<DTOGridCell> cells = new ArrayList<>(grid.getCellCount());
		for (int row = 0; row < grid.getRows(); row++) {
			for (int col = 0; col < grid.getCols(); col++) {
				DTOArea area = grid.cellArea(row, col);
				BufferedImage cellImage = UtilImage.crop(screen, area.getX(), area.getY(), area.getWidth(),
						area.getHeight());
				cells.add(analyzeCell(row, col, area, cellImage));
			}
		}
		long elapsed = (System.nanoTime() - startNanos) / 1_000_000;
		return new DTOGridAnalysis(grid, cells, findMergeablePairs(cells, grid), true, elapsed);
	}

	/**
	 * Result for a frame that could not be decoded: every slot empty with zero confidence.
	 */
	public static DTOGridAnalysis undecoded(DTOGridConfig grid) {
		List<DTOGridCell> cells = new ArrayList<>(grid.getCellCount());
		for (int row = 0; row < grid.getRows(); row++) {
			for (int col = 0; col < grid.getCols(); col++) {
				cells.add(DTOGridCell.empty(row, col, grid.cellArea(row, col), 0.0));
			}
		}
		return new DTOGridAnalysis(grid, cells, List.of(), false, 0);
	}

	DTOGridCell analyzeCell(int row, int col, DTOArea area, BufferedImage cellImage) {
		if (cellImage == null) {
			return DTOGridCell.empty(row, col, area, 0.0);
		}
		double brightness = UtilImage.meanBrightness(cellImage);
		if (brightness < MIN_BRIGHTNESS || brightness > MAX_BRIGHTNESS) {
			return DTOGridCell.empty(row, col, area, EMPTY_CONFIDENCE);
		}

		Optional<UnitColorMatcher.ColorMatch> colorMatch = colorMatcher.match(cellImage);
		if (colorMatch.isPresent()) {
			UnitColorMatcher.ColorMatch match = colorMatch.get();
			DTORankPrediction rank = rankDetector.apply(cellImage);
			String label = match.getLabel();
			if (rank.isDetected() && rank.getConfidence() > RANK_LABEL_CONFIDENCE) {
				label = label + "_rank_" + rank.getRank();
			}
			return new DTOGridCell(row, col, area, true, label, match.getConfidence(), rank.getRank(),
					rank.getConfidence());
		}

		Optional<TemplateMatcher.TemplateMatch> templateMatch = templateMatcher.match(cellImage);
		if (templateMatch.isPresent()) {
			statistics.recordTemplateMatch();
			return new DTOGridCell(row, col, area, true, templateMatch.get().getName(), templateMatch.get().getScore(),
					0, 0.0);
		}

		return new DTOGridCell(row, col, area, true, DTOGridCell.UNKNOWN_LABEL, UNKNOWN_CONFIDENCE, 0, 0.0);
	}

	/**
	 * Pairs of horizontally or vertically adjacent identified cells carrying the same label.
	 * Each pair is reported once, from the upper or left cell to its neighbour.
	 */
	static List<DTOMergePair> findMergeablePairs(List<DTOGridCell> cells, DTOGridConfig grid) {
		List<DTOMergePair> pairs = new ArrayList<>();
		int cols = grid.getCols();
		for (DTOGridCell cell : cells) {
			if (!cell.isIdentified()) {
				continue;
			}
			int index = cell.getRow() * cols + cell.getCol();
			if (cell.getCol() + 1 < cols) {
				addIfSameUnit(pairs, cell, cells.get(index + 1));
			}
			if (cell.getRow() + 1 < grid.getRows()) {
				addIfSameUnit(pairs, cell, cells.get(index + cols));
			}
		}
		return pairs;
	}

	private static void addIfSameUnit(List<DTOMergePair> pairs, DTOGridCell cell, DTOGridCell neighbour) {
		if (neighbour.isIdentified() && cell.getUnitLabel().equals(neighbour.getUnitLabel())) {
			pairs.add(new DTOMergePair(cell, neighbour));
		}
	}
}
