package com.minidrive.file.service;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/** 1536 → "1.5 KB" */
public final class FileSizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileSizeFormatter() {
    }

    public static String format(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        DecimalFormat pattern = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return pattern.format(size) + " " + UNITS[unit];
    }
}
