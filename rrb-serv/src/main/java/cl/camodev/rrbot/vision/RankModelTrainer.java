package cl.camodev.rrbot.vision;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.ex.ClassifierUnavailableException;

/**
 * Fits a {@link LogisticRankClassifier} with full batch gradient descent on the softmax cross-entropy.
 * <p>
 * Training images are named {@code <rank>_<anything>.png}; files whose prefix is not a number are skipped.
 */
public class RankModelTrainer {
	private static final Logger logger = LoggerFactory.getLogger(RankModelTrainer.class);

	private final int epochs;
	private final double learningRate;
	private final double l2;

	public RankModelTrainer() {
		this(300, 0.5, 1e-4);
	}

	public RankModelTrainer(int epochs, double learningRate, double l2) {
		this.epochs = epochs;
		this.learningRate = learningRate;
		this.l2 = l2;
	}

	public LogisticRankClassifier trainFromDirectory(Path directory, int width, int height)
			throws ClassifierUnavailableException {
		if (!OpenCvSupport.isAvailable()) {
			throw new ClassifierUnavailableException("OpenCV is required to extract training features");
		}
		EdgeFeatureExtractor extractor = new EdgeFeatureExtractor();
		List<float[]> samples = new ArrayList<>();
		List<Integer> labels = new ArrayList<>();

		TreeSet<Path> files = new TreeSet<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.png")) {
			stream.forEach(files::add);
		} catch (IOException e) {
			throw new ClassifierUnavailableException("Could not list training data in " + directory, e);
		}

		for (Path file : files) {
			String name = file.getFileName().toString();
			int separator = name.indexOf('_');
			if (separator <= 0) {
				continue;
			}
			int rank;
			try {
				rank = Integer.parseInt(name.substring(0, separator));
			} catch (NumberFormatException e) {
				logger.debug("Skipping {}: no rank prefix", name);
				continue;
			}
			try {
				BufferedImage image = ImageIO.read(file.toFile());
				if (image == null) {
					logger.warn("Skipping unreadable training image {}", file);
					continue;
				}
				samples.add(extractor.extract(image, width, height));
				labels.add(rank);
			} catch (IOException e) {
				logger.warn("Skipping training image {}: {}", file, e.getMessage());
			}
		}
		return train(samples, labels.stream().mapToInt(Integer::intValue).toArray(), width, height);
	}

	/**
	 * @param samples feature vectors of length {@code width * height}
	 * @param labels  rank of each sample
	 */
	public LogisticRankClassifier train(List<float[]> samples, int[] labels, int width, int height)
			throws ClassifierUnavailableException {
		if (samples.size() < 2 || samples.size() != labels.length) {
			throw new ClassifierUnavailableException("At least two labelled samples are needed, got " + samples.size());
		}
		int features = width * height;
		for (float[] sample : samples) {
			if (sample.length != features) {
				throw new ClassifierUnavailableException("Sample length " + sample.length + " differs from " + features);
			}
		}

		int[] classes = Arrays.stream(labels).distinct().sorted().toArray();

		int k = classes.length;
		int n = samples.size();
		double[][] weights = new double[k][features];
		double[] bias = new double[k];
		int[] target = new int[n];
		for (int i = 0; i < n; i++) {
			for (int c = 0; c < k; c++) {
				if (classes[c] == labels[i]) {
					target[i] = c;
				}
			}
		}

		RankModel model = new RankModel(classes, weights, bias, width, height, null);
		LogisticRankClassifier classifier = new LogisticRankClassifier(model);
		for (int epoch = 0; epoch < epochs; epoch++) {
			double[][] gradW = new double[k][features];
			double[] gradB = new double[k];
			for (int i = 0; i < n; i++) {
				float[] x = samples.get(i);
				double[] p = classifier.probabilities(x);
				for (int c = 0; c < k; c++) {
					double error = p[c] - (target[i] == c ? 1.0 : 0.0);
					gradB[c] += error;
					if (error != 0.0) {
						double[] row = gradW[c];
						for (int f = 0; f < features; f++) {
							if (x[f] != 0f) {
								row[f] += error * x[f];
							}
						}
					}
				}
			}
			for (int c = 0; c < k; c++) {
				bias[c] -= learningRate * gradB[c] / n;
				for (int f = 0; f < features; f++) {
					weights[c][f] -= learningRate * (gradW[c][f] / n + l2 * weights[c][f]);
				}
			}
		}
		model.trainedAt = LocalDateTime.now().toString();
		logger.info("Trained rank model on {} samples, ranks {}", n, Arrays.toString(classes));
		return classifier;
	}
}
