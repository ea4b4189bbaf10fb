package com.filehub.api.model;

import java.util.Locale;

public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteSizes() {
    }

    // "1.50 KB", two decimals in every unit
    public static String format(long bytes) {
        double value = bytes;
        for (String unit : UNITS) {
            if (value < 1024) {
                return String.format(Locale.ROOT, "%.2f %s", value, unit);
            }
            value /= 1024;
        }
        return String.format(Locale.ROOT, "%.2f PB", value);
    }
}
