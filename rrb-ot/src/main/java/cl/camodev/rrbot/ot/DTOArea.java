package cl.camodev.rrbot.ot;

/**
 * Axis aligned screen rectangle. The bottom right corner is exclusive.
 */
public class DTOArea {
    private final DTOPoint topLeft;
    private final DTOPoint bottomRight;

    public DTOArea(DTOPoint topLeft, DTOPoint bottomRight) {
        this.topLeft = topLeft;
        this.bottomRight = bottomRight;
    }

    public static DTOArea of(int x, int y, int width, int height) {
        return new DTOArea(new DTOPoint(x, y), new DTOPoint(x + width, y + height));
    }

    public DTOPoint topLeft() {
        return topLeft;
    }

    public DTOPoint bottomRight() {
        return bottomRight;
    }

    public int getX() {
        return topLeft.getX();
    }

    public int getY() {
        return topLeft.getY();
    }

    public int getWidth() {
        return bottomRight.getX() - topLeft.getX();
    }

    public int getHeight() {
        return bottomRight.getY() - topLeft.getY();
    }

    @Override
    public String toString() {
        return "[" + getX() + "," + getY() + " " + getWidth() + "x" + getHeight() + "]";
    }
}
