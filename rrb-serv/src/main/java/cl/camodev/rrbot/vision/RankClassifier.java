package cl.camodev.rrbot.vision;

import cl.camodev.rrbot.ot.DTORankPrediction;

/**
 * Maps an edge feature vector to a unit rank.
 */
public interface RankClassifier {

	/**
	 * @param features flattened edge map of an {@link #getInputWidth()} x {@link #getInputHeight()} cell
	 * @return most probable rank and its probability, or {@link DTORankPrediction#NONE}
	 */
	DTORankPrediction predict(float[] features);

	boolean isLoaded();

	int getInputWidth();

	int getInputHeight();
}
