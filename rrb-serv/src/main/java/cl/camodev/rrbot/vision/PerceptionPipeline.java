package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.ex.ClassifierUnavailableException;
import cl.camodev.rrbot.ex.PerceptionDecodeException;
import cl.camodev.rrbot.ot.DTOGameState;
import cl.camodev.rrbot.ot.DTOGridAnalysis;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOManaConfig;
import cl.camodev.rrbot.ot.DTOManaReading;
import cl.camodev.rrbot.ot.DTORankPrediction;
import cl.camodev.rrbot.ot.DTOVisionStats;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.utiles.UtilImage;

/**
 * Turns raw screenshots into a structured view of the board.
 * <p>
 * Analysis never fails on bad input: a frame that cannot be decoded yields an all empty grid and
 * a zero mana reading. Every component that depends on optional assets (reference colours,
 * templates, rank model, native OpenCV) degrades to "not detected" when the asset is missing.
 */
public class PerceptionPipeline {
	private static final Logger logger = LoggerFactory.getLogger(PerceptionPipeline.class);

	private final UnitColorMatcher colorMatcher;
	private final TemplateMatcher templateMatcher;
	private final RankClassifier rankClassifier;
	private final EdgeFeatureExtractor featureExtractor;
	private final VisionStatistics statistics = new VisionStatistics();
	private final GridAnalyzer gridAnalyzer;
	private final ManaAnalyzer manaAnalyzer = new ManaAnalyzer();

	public PerceptionPipeline(UnitColorMatcher colorMatcher, TemplateMatcher templateMatcher,
			RankClassifier rankClassifier, EdgeFeatureExtractor featureExtractor) {
		this.colorMatcher = colorMatcher;
		this.templateMatcher = templateMatcher;
		this.rankClassifier = rankClassifier;
		this.featureExtractor = featureExtractor;
		this.gridAnalyzer = new GridAnalyzer(colorMatcher, templateMatcher, this::classifyRank, statistics);
	}

	/**
	 * Builds a pipeline with the assets referenced by the configuration. Missing assets are logged
	 * and the matching capability is disabled.
	 */
	public static PerceptionPipeline fromConfig(BotConfig config) {
		UnitColorMatcher matcher = new UnitColorMatcher(new ReferenceColorLoader().load(config.getReferenceDirectory()));
		TemplateMatcher templates = TemplateMatcher.loadDirectory(config.getTemplateDirectory());
		RankClassifier classifier = loadRankClassifier(config.getRankModelPath());
		logger.info("Perception ready: {} reference colours, {} templates, rank model {}",
				matcher.getReferences().size(), templates.size(), classifier.isLoaded() ? "loaded" : "not loaded");
		return new PerceptionPipeline(matcher, templates, classifier, new EdgeFeatureExtractor());
	}

	static RankClassifier loadRankClassifier(String location) {
		if (location == null || location.isBlank()) {
			return new UnavailableRankClassifier();
		}
		Path path = Path.of(location);
		if (!Files.isRegularFile(path)) {
			logger.warn("Rank model {} not found, rank detection disabled", path);
			return new UnavailableRankClassifier();
		}
		try {
			return LogisticRankClassifier.load(path);
		} catch (ClassifierUnavailableException e) {
			logger.warn("Rank model {} could not be loaded, rank detection disabled: {}", path, e.getMessage());
			return new UnavailableRankClassifier();
		}
	}

	// ===================== Grid =====================

	public DTOGridAnalysis analyzeGrid(byte[] screenshot, DTOGridConfig grid) {
		try {
			return analyzeGrid(decode(screenshot), grid);
		} catch (PerceptionDecodeException e) {
			logger.warn("Grid analysis skipped: {}", e.getMessage());
			return GridAnalyzer.undecoded(grid);
		}
	}

	public DTOGridAnalysis analyzeGrid(BufferedImage screen, DTOGridConfig grid) {
		long start = System.nanoTime();
		DTOGridAnalysis analysis = gridAnalyzer.analyze(screen, grid, start);
		statistics.recordGrid(analysis.getProcessingTimeMs());
		logger.debug("Grid analysed in {} ms: {} occupied, {} mergeable pairs", analysis.getProcessingTimeMs(),
				analysis.getOccupiedCells().size(), analysis.getMergeablePairs().size());
		return analysis;
	}

	// ===================== Mana =====================

	public DTOManaReading analyzeMana(byte[] screenshot, DTOManaConfig mana) {
		try {
			return analyzeMana(decode(screenshot), mana);
		} catch (PerceptionDecodeException e) {
			logger.warn("Mana analysis skipped: {}", e.getMessage());
			return DTOManaReading.none(mana.getMaxMana());
		}
	}

	public DTOManaReading analyzeMana(BufferedImage screen, DTOManaConfig mana) {
		long start = System.nanoTime();
		DTOManaReading reading = manaAnalyzer.analyze(screen, mana);
		statistics.recordMana((System.nanoTime() - start) / 1_000_000);
		return reading;
	}

	// ===================== Rank =====================

	/**
	 * Predicts the merge rank of a unit cell. Returns {@link DTORankPrediction#NONE} when no model is
	 * loaded or edge extraction is unavailable.
	 */
	public DTORankPrediction classifyRank(BufferedImage cell) {
		if (!rankClassifier.isLoaded() || !OpenCvSupport.isAvailable()) {
			return DTORankPrediction.NONE;
		}
		float[] features = featureExtractor.extract(cell, rankClassifier.getInputWidth(),
				rankClassifier.getInputHeight());
		DTORankPrediction prediction = rankClassifier.predict(features);
		statistics.recordRankPrediction();
		return prediction;
	}

	// ===================== Frame =====================

	/**
	 * Decodes the frame once and reads both the grid and the mana bar from it.
	 */
	public DTOGameState analyze(byte[] screenshot, DTOGridConfig grid, DTOManaConfig mana) {
		LocalDateTime capturedAt = LocalDateTime.now();
		BufferedImage screen;
		try {
			screen = decode(screenshot);
		} catch (PerceptionDecodeException e) {
			logger.warn("Frame skipped: {}", e.getMessage());
			return new DTOGameState(GridAnalyzer.undecoded(grid), DTOManaReading.none(mana.getMaxMana()), capturedAt);
		}
		return new DTOGameState(analyzeGrid(screen, grid), analyzeMana(screen, mana), capturedAt);
	}

	public DTOVisionStats getStats() {
		return statistics.snapshot(colorMatcher.getReferences().size(), templateMatcher.size(),
				rankClassifier.isLoaded());
	}

	BufferedImage decode(byte[] screenshot) throws PerceptionDecodeException {
		try {
			return UtilImage.decode(screenshot);
		} catch (IOException | RuntimeException e) {
			statistics.recordDecodeFailure();
			throw new PerceptionDecodeException("Could not decode screenshot: " + e.getMessage(), e);
		}
	}
}
