package cl.camodev.rrbot.vision;

import cl.camodev.rrbot.ot.DTORankPrediction;

/**
 * Used when no trained model is present: every prediction is rank 0 with confidence 0.
 */
public class UnavailableRankClassifier implements RankClassifier {

	@Override
	public DTORankPrediction predict(float[] features) {
		return DTORankPrediction.NONE;
	}

	@Override
	public boolean isLoaded() {
		return false;
	}

	@Override
	public int getInputWidth() {
		return 0;
	}

	@Override
	public int getInputHeight() {
		return 0;
	}
}
