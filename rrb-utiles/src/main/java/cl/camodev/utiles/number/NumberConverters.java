package cl.camodev.utiles.number;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for turning device property output into numbers.
 */
public final class NumberConverters {

    private NumberConverters() {}

    /**
     * Finds the first match of the pattern anywhere in the input and parses its first capturing group.
     *
     * @param input   text to search, may be null
     * @param pattern pattern with at least one capturing group
     * @return the parsed value, or {@code null} if there is no match or the group is not a number
     */
    public static Long findLong(String input, Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (input == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        String numberStr = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
        try {
            return Long.parseLong(numberStr.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer findInt(String input, Pattern pattern) {
        Long value = findLong(input, pattern);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    /**
     * Parses a comma separated triple such as {@code "100,150,200"}.
     *
     * @throws IllegalArgumentException if there are not exactly three integers
     */
    public static int[] parseTriple(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Missing triple");
        }
        String[] parts = input.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected three comma separated values: " + input);
        }
        int[] values = new int[3];
        for (int i = 0; i < 3; i++) {
            values[i] = Integer.parseInt(parts[i].trim());
        }
        return values;
    }

    /**
     * Formats a kilobyte count the way /proc/meminfo values are shown to the operator, e.g. {@code 3.7 GB}.
     */
    public static String formatKilobytes(long kilobytes) {
        if (kilobytes < 1024) {
            return kilobytes + " KB";
        }
        double mb = kilobytes / 1024.0;
        if (mb < 1024) {
            return String.format(Locale.ROOT, "%.1f MB", mb);
        }
        return String.format(Locale.ROOT, "%.1f GB", mb / 1024.0);
    }
}
