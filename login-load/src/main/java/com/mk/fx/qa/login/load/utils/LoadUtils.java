package com.mk.fx.qa.login.load.utils;

import java.time.Duration;

public final class LoadUtils {

    private LoadUtils() {
        // Utility class, no instantiation
    }

    /** Zero-pads an iteration index to three digits, e.g. {@code 7 -> "007"}. */
    public static String padIndex(int index) {
        return String.format("%03d", index);
    }

    /** Converts a duration to fractional seconds at millisecond precision. */
    public static double toSeconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    /** Parses {@code 250ms}, {@code 30s}, {@code 5m} or {@code 1h}; blank input yields zero. */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = value.trim().toLowerCase();
        if (trimmed.endsWith("ms")) {
            long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2));
            return Duration.ofMillis(ms);
        }
        char unit = trimmed.charAt(trimmed.length() - 1);
        long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
        return switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
        };
    }
}
