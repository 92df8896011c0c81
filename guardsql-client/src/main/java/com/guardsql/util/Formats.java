package com.guardsql.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Human-readable sizes and durations for result listings and status lines.
 */
public final class Formats {
    private static final long KB = 1024;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    private Formats() {
    }

    public static String size(long bytes) {
        if (bytes >= GB) {
            return String.format(Locale.ROOT, "%.2f GB", (double) bytes / GB);
        } else if (bytes >= MB) {
            return String.format(Locale.ROOT, "%.2f MB", (double) bytes / MB);
        } else if (bytes >= KB) {
            return String.format(Locale.ROOT, "%.2f KB", (double) bytes / KB);
        }
        return bytes + " B";
    }

    public static String duration(Duration duration) {
        double millis = duration.toNanos() / 1_000_000.0;
        if (millis < 1.0) {
            return String.format(Locale.ROOT, "%.2f μs", millis * 1000.0);
        } else if (millis < 1000.0) {
            return String.format(Locale.ROOT, "%.2f ms", millis);
        } else if (millis < 60_000.0) {
            return String.format(Locale.ROOT, "%.2f s", millis / 1000.0);
        }
        long seconds = duration.getSeconds();
        return String.format(Locale.ROOT, "%d:%02d", seconds / 60, seconds % 60);
    }
}
