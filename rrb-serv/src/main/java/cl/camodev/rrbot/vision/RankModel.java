package cl.camodev.rrbot.vision;

/**
 * JSON form of a multinomial logistic regression rank model.
 * {@code coefficients[k]} holds the weights of {@code classes[k]} over the flattened edge map.
 */
public class RankModel {
	int[] classes;
	double[][] coefficients;
	double[] intercepts;
	int inputWidth;
	int inputHeight;
	String trainedAt;

	RankModel() {
	}

	RankModel(int[] classes, double[][] coefficients, double[] intercepts, int inputWidth, int inputHeight,
			String trainedAt) {
		this.classes = classes;
		this.coefficients = coefficients;
		this.intercepts = intercepts;
		this.inputWidth = inputWidth;
		this.inputHeight = inputHeight;
		this.trainedAt = trainedAt;
	}

	/**
	 * @return a description of the first inconsistency found, or null if the model is usable
	 */
	String validate() {
		if (classes == null || classes.length == 0) {
			return "model has no classes";
		}
		if (inputWidth <= 0 || inputHeight <= 0) {
			return "model input size is not set";
		}
		if (coefficients == null || coefficients.length != classes.length) {
			return "coefficient rows do not match classes";
		}
		if (intercepts == null || intercepts.length != classes.length) {
			return "intercepts do not match classes";
		}
		int features = inputWidth * inputHeight;
		for (double[] row : coefficients) {
			if (row == null || row.length != features) {
				return "coefficient row length differs from " + features + " features";
			}
		}
		return null;
	}
}
