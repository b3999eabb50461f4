package cl.camodev.rrbot.ot;

import org.jetbrains.annotations.NotNull;

/**
 * Result of classifying one grid slot in one frame.
 */
public class DTOGridCell {
    public static final String UNKNOWN_LABEL = "unknown";

    private final int row;
    private final int col;
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final boolean occupied;
    private final String unitLabel;
    private final double confidence;
    private final int rank;
    private final double rankConfidence;

    public DTOGridCell(int row, int col, DTOArea area, boolean occupied, String unitLabel, double confidence,
            int rank, double rankConfidence) {
        this.row = row;
        this.col = col;
        this.x = area.getX();
        this.y = area.getY();
        this.width = area.getWidth();
        this.height = area.getHeight();
        this.occupied = occupied;
        this.unitLabel = unitLabel;
        this.confidence = clamp(confidence);
        this.rank = Math.max(0, rank);
        this.rankConfidence = clamp(rankConfidence);
    }

    public static DTOGridCell empty(int row, int col, DTOArea area, double confidence) {
        return new DTOGridCell(row, col, area, false, null, confidence, 0, 0.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public int getRow() { return row; }
    public int getCol() { return col; }
    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public boolean isOccupied() { return occupied; }
    public String getUnitLabel() { return unitLabel; }
    public double getConfidence() { return confidence; }
    public int getRank() { return rank; }
    public double getRankConfidence() { return rankConfidence; }

    public DTOPoint center() {
        return new DTOPoint(x + width / 2, y + height / 2);
    }

    public boolean isIdentified() {
        return occupied && unitLabel != null && !UNKNOWN_LABEL.equals(unitLabel);
    }

    public boolean isAdjacentTo(DTOGridCell other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col) == 1;
    }

    @Override
    public @NotNull String toString() {
        return "[" + row + "," + col + "] " + (occupied ? unitLabel + " " + String.format("%.2f", confidence) : "empty");
    }
}
