package io.trackimport.lambda;

import java.util.Locale;

/**
 * Human readable byte counts in powers of 1000.
 */
public final class ByteCountFormatter {
    private static final long KB = 1_000L;
    private static final long MB = 1_000_000L;
    private static final long GB = 1_000_000_000L;

    private ByteCountFormatter() {}

    public static String format(long bytes) {
        if (bytes >= GB) {
            return String.format(Locale.ROOT, "%,.1f GB", (double) bytes / GB);
        }
        if (bytes >= MB) {
            return String.format(Locale.ROOT, "%,.1f MB", (double) bytes / MB);
        }
        if (bytes >= KB) {
            return String.format(Locale.ROOT, "%,.1f KB", (double) bytes / KB);
        }
        return bytes + " B";
    }
}
