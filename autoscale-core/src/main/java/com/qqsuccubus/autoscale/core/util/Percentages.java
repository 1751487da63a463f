package com.qqsuccubus.autoscale.core.util;

import java.util.Locale;

/**
 * Formatting of utilization percentages for human-readable scaling reasons.
 */
public final class Percentages {
    private Percentages() {
    }

    private static final int MAX_REASON_DECIMALS = 4;

    /**
     * Formats a percentage with at most one decimal and no trailing {@code .0}.
     * <p>
     * {@code 90.0 -> "90"}, {@code 87.25 -> "87.3"}, {@code 11 -> "11"}
     * </p>
     *
     * @param value percentage value
     * @return formatted value without the percent sign
     */
    public static String format(double value) {
        return format(value, 1);
    }

    private static String format(double value, int decimals) {
        String formatted = String.format(Locale.ROOT, "%." + decimals + "f", value);
        if (formatted.indexOf('.') >= 0) {
            int end = formatted.length();
            while (formatted.charAt(end - 1) == '0') {
                end--;
            }
            if (formatted.charAt(end - 1) == '.') {
                end--;
            }
            formatted = formatted.substring(0, end);
        }
        if ("-0".equals(formatted)) {
            return "0";
        }
        return formatted;
    }

    /**
     * Scale-up reason, e.g. {@code "90% > 85%"}.
     * Values that differ only past the first decimal get more decimals ({@code "85.04% > 85%"}).
     */
    public static String above(double observed, double threshold) {
        return comparison(observed, " > ", threshold);
    }

    /**
     * Scale-down reason, e.g. {@code "11% < 25%"}.
     */
    public static String below(double observed, double threshold) {
        return comparison(observed, " < ", threshold);
    }

    private static String comparison(double observed, String operator, double threshold) {
        int decimals = 1;
        String left = format(observed, decimals);
        String right = format(threshold, decimals);
        while (left.equals(right) && decimals < MAX_REASON_DECIMALS) {
            decimals++;
            left = format(observed, decimals);
            right = format(threshold, decimals);
        }
        return left + "%" + operator + right + "%";
    }
}
