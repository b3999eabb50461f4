package cl.camodev.rrbot.ot;

public class DTOManaReading {
    private final int current;
    private final int max;
    private final double percentage;
    private final double confidence;

    public DTOManaReading(int current, int max, double percentage, double confidence) {
        this.current = current;
        this.max = max;
        this.percentage = percentage;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static DTOManaReading none(int max) {
        return new DTOManaReading(0, max, 0.0, 0.0);
    }

    public int getCurrent() { return current; }
    public int getMax() { return max; }
    public double getPercentage() { return percentage; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return current + "/" + max + " (" + String.format("%.1f", percentage) + "%)";
    }
}
