package cl.camodev.rrbot.ot;

import java.util.Arrays;

/**
 * Where the mana bar is drawn and which HSV range counts as "filled".
 * Hue is on the 0-180 scale, saturation and value on 0-255.
 */
public class DTOManaConfig {
    private final DTOArea region;
    private final int[] lowerHsv;
    private final int[] upperHsv;
    private final int maxMana;

    public DTOManaConfig(DTOArea region, int[] lowerHsv, int[] upperHsv, int maxMana) {
        this.region = region;
        this.lowerHsv = Arrays.copyOf(lowerHsv, 3);
        this.upperHsv = Arrays.copyOf(upperHsv, 3);
        this.maxMana = maxMana;
    }

    public DTOArea getRegion() {
        return region;
    }

    public int[] getLowerHsv() {
        return Arrays.copyOf(lowerHsv, 3);
    }

    public int[] getUpperHsv() {
        return Arrays.copyOf(upperHsv, 3);
    }

    public int getMaxMana() {
        return maxMana;
    }

    public boolean inRange(int h, int s, int v) {
        return h >= lowerHsv[0] && h <= upperHsv[0]
                && s >= lowerHsv[1] && s <= upperHsv[1]
                && v >= lowerHsv[2] && v <= upperHsv[2];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DTOManaConfig)) return false;
        DTOManaConfig other = (DTOManaConfig) o;
        return maxMana == other.maxMana
                && region.getX() == other.region.getX() && region.getY() == other.region.getY()
                && region.getWidth() == other.region.getWidth() && region.getHeight() == other.region.getHeight()
                && Arrays.equals(lowerHsv, other.lowerHsv) && Arrays.equals(upperHsv, other.upperHsv);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(lowerHsv);
        result = 31 * result + Arrays.hashCode(upperHsv);
        result = 31 * result + maxMana;
        result = 31 * result + region.getX() * 7 + region.getY() * 13 + region.getWidth() * 17 + region.getHeight();
        return result;
    }
}
