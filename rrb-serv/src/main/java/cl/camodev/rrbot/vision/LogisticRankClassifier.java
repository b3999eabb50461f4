package cl.camodev.rrbot.vision;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import cl.camodev.rrbot.ex.ClassifierUnavailableException;
import cl.camodev.rrbot.ot.DTORankPrediction;

/**
 * Softmax over per-rank linear scores of the edge features.
 */
public class LogisticRankClassifier implements RankClassifier {
	private static final Logger logger = LoggerFactory.getLogger(LogisticRankClassifier.class);
	private static final Gson GSON = new Gson();

	private final RankModel model;

	LogisticRankClassifier(RankModel model) {
		String problem = model.validate();
		if (problem != null) {
			throw new IllegalArgumentException(problem);
		}
		this.model = model;
	}

	public static LogisticRankClassifier load(Path file) throws ClassifierUnavailableException {
		if (!Files.isRegularFile(file)) {
			throw new ClassifierUnavailableException("Rank model " + file + " does not exist");
		}
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			RankModel model = GSON.fromJson(reader, RankModel.class);
			if (model == null) {
				throw new ClassifierUnavailableException("Rank model " + file + " is empty");
			}
			String problem = model.validate();
			if (problem != null) {
				throw new ClassifierUnavailableException("Rank model " + file + " is invalid: " + problem);
			}
			logger.info("Loaded rank model {} with ranks {} ({}x{} input)", file, Arrays.toString(model.classes),
					model.inputWidth, model.inputHeight);
			return new LogisticRankClassifier(model);
		} catch (IOException | JsonParseException e) {
			throw new ClassifierUnavailableException("Could not read rank model " + file, e);
		}
	}

	public void save(Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(file, GSON.toJson(model), StandardCharsets.UTF_8);
	}

	@Override
	public DTORankPrediction predict(float[] features) {
		if (features == null || features.length != model.inputWidth * model.inputHeight) {
			logger.debug("Feature vector of length {} does not fit the model",
					features == null ? 0 : features.length);
			return DTORankPrediction.NONE;
		}
		double[] probabilities = probabilities(features);
		int best = 0;
		for (int k = 1; k < probabilities.length; k++) {
			if (probabilities[k] > probabilities[best]) {
				best = k;
			}
		}
		return new DTORankPrediction(model.classes[best], probabilities[best]);
	}

	double[] probabilities(float[] features) {
		int classes = model.classes.length;
		double[] scores = new double[classes];
		double max = Double.NEGATIVE_INFINITY;
		for (int k = 0; k < classes; k++) {
			double score = model.intercepts[k];
			double[] weights = model.coefficients[k];
			for (int i = 0; i < features.length; i++) {
				score += weights[i] * features[i];
			}
			scores[k] = score;
			max = Math.max(max, score);
		}
		double sum = 0;
		for (int k = 0; k < classes; k++) {
			scores[k] = Math.exp(scores[k] - max);
			sum += scores[k];
		}
		for (int k = 0; k < classes; k++) {
			scores[k] /= sum;
		}
		return scores;
	}

	@Override
	public boolean isLoaded() {
		return true;
	}

	@Override
	public int getInputWidth() {
		return model.inputWidth;
	}

	@Override
	public int getInputHeight() {
		return model.inputHeight;
	}

	public int[] getRanks() {
		return model.classes.clone();
	}
}
