package cl.camodev.rrbot.ot;

public class DTORankPrediction {
    public static final DTORankPrediction NONE = new DTORankPrediction(0, 0.0);

    private final int rank;
    private final double confidence;

    public DTORankPrediction(int rank, double confidence) {
        this.rank = rank;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public int getRank() {
        return rank;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isDetected() {
        return rank > 0;
    }
}
