package cl.camodev.rrbot.ot;

/**
 * Reference colour of a unit, RGB order, used for nearest colour matching.
 */
public class DTOUnitSignature {
    private final String label;
    private final int red;
    private final int green;
    private final int blue;

    public DTOUnitSignature(String label, int red, int green, int blue) {
        this.label = label;
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public String getLabel() { return label; }
    public int getRed() { return red; }
    public int getGreen() { return green; }
    public int getBlue() { return blue; }

    public int squaredDistance(int r, int g, int b) {
        int dr = r - red;
        int dg = g - green;
        int db = b - blue;
        return dr * dr + dg * dg + db * db;
    }

    @Override
    public String toString() {
        return label + "(" + red + "," + green + "," + blue + ")";
    }
}
