package com.dedupstore.common.util;

import java.util.Locale;

public final class FileUtils {

    private static final String[] SIZE_UNITS = {"Bytes", "KB", "MB", "GB", "TB"};

    private FileUtils() {}

    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }

    public static String stripExtension(String filename) {
        if (filename == null) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        return lastDot <= 0 ? filename : filename.substring(0, lastDot);
    }

    /**
     * Human-readable size with 1024-based units, e.g. {@code 1.5 MB}.
     */
    public static String formatFileSize(long sizeBytes) {
        if (sizeBytes <= 0) {
            return "0 Bytes";
        }
        int unit = (int) Math.min(SIZE_UNITS.length - 1, Math.floor(Math.log(sizeBytes) / Math.log(1024)));
        double value = sizeBytes / Math.pow(1024, unit);
        double rounded = Math.round(value * 100.0) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return String.format(Locale.ROOT, "%d %s", (long) rounded, SIZE_UNITS[unit]);
        }
        return String.format(Locale.ROOT, "%s %s", rounded, SIZE_UNITS[unit]);
    }
}
