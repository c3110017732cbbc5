package com.phillippitts.windpressure.util;

import java.nio.file.Path;

/** File-name conventions of the correction outputs. */
public final class FileNames {

    public static final String PULSATION_SUFFIX = "_puls.csv";

    private FileNames() {}

    /**
     * Part of the file name before its first underscore, or the whole name when it has none.
     * {@code "P12_mean_0deg.csv"} yields {@code "P12"}.
     */
    public static String basename(Path file) {
        Path name = file.getFileName();
        String s = name == null ? file.toString() : name.toString();
        int underscore = s.indexOf('_');
        return underscore < 0 ? s : s.substring(0, underscore);
    }

    /**
     * Output name of the pulsation pipeline for the given input file.
     */
    public static String pulsationOutputName(Path input) {
        return basename(input) + PULSATION_SUFFIX;
    }

    /**
     * Output name of the peak pipeline for the given mode token ("min" or "max").
     */
    public static String peakOutputName(String modeToken) {
        return modeToken + ".csv";
    }
}
