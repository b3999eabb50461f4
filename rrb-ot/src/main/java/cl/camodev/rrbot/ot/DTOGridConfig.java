package cl.camodev.rrbot.ot;

/**
 * Fixed geometry of the playfield grid. Cell (row, col) starts at
 * {@code originX + col * (cellWidth + spacing)}, {@code originY + row * (cellHeight + spacing)}.
 */
public class DTOGridConfig {
    private final int rows;
    private final int cols;
    private final int cellWidth;
    private final int cellHeight;
    private final int originX;
    private final int originY;
    private final int spacing;

    public DTOGridConfig(int rows, int cols, int cellWidth, int cellHeight, int originX, int originY, int spacing) {
        this.rows = rows;
        this.cols = cols;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.originX = originX;
        this.originY = originY;
        this.spacing = spacing;
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public int getCellWidth() { return cellWidth; }
    public int getCellHeight() { return cellHeight; }
    public int getOriginX() { return originX; }
    public int getOriginY() { return originY; }
    public int getSpacing() { return spacing; }

    public int getCellCount() {
        return rows * cols;
    }

    public DTOArea cellArea(int row, int col) {
        int x = originX + col * (cellWidth + spacing);
        int y = originY + row * (cellHeight + spacing);
        return DTOArea.of(x, y, cellWidth, cellHeight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DTOGridConfig)) return false;
        DTOGridConfig other = (DTOGridConfig) o;
        return rows == other.rows && cols == other.cols && cellWidth == other.cellWidth
                && cellHeight == other.cellHeight && originX == other.originX && originY == other.originY
                && spacing == other.spacing;
    }

    @Override
    public int hashCode() {
        int result = rows;
        result = 31 * result + cols;
        result = 31 * result + cellWidth;
        result = 31 * result + cellHeight;
        result = 31 * result + originX;
        result = 31 * result + originY;
        result = 31 * result + spacing;
        return result;
    }

    @Override
    public String toString() {
        return rows + "x" + cols + " cells " + cellWidth + "x" + cellHeight + " at (" + originX + "," + originY
                + ") spacing " + spacing;
    }
}
