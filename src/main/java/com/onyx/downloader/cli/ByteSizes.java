package com.onyx.downloader.cli;

import java.util.Locale;

/**
 * Human-readable byte sizes with binary multiples: {@code 1KB} is 1024 bytes.
 */
public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteSizes() {
    }

    /**
     * Parses {@code 100MB}, {@code 1.5GB} or a plain byte count.
     *
     * @throws IllegalArgumentException when the value is not a size
     */
    public static long parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Size must not be empty");
        }

        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (int i = UNITS.length - 1; i >= 1; i--) {
            if (normalized.endsWith(UNITS[i])) {
                return scaled(normalized.substring(0, normalized.length() - UNITS[i].length()), i, value);
            }
        }
        if (normalized.endsWith("B")) {
            return scaled(normalized.substring(0, normalized.length() - 1), 0, value);
        }
        return scaled(normalized, 0, value);
    }

    public static String format(double bytes) {
        double size = bytes;
        for (String unit : UNITS) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.1f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f PB", size);
    }

    private static long scaled(String number, int exponent, String original) {
        try {
            double amount = Double.parseDouble(number.trim());
            if (amount < 0 || Double.isNaN(amount) || Double.isInfinite(amount)) {
                throw new IllegalArgumentException("Invalid size: " + original);
            }
            return (long) (amount * Math.pow(1024, exponent));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid size: " + original, e);
        }
    }
}
