package com.phillippitts.windpressure.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of statistic a measurement file holds. {@link #MEAN} files feed the pulsation pipeline;
 * {@link #MIN} and {@link #MAX} files feed the peak pipeline.
 */
public enum MeasurementMode {
    MEAN("mean"),
    MIN("min"),
    MAX("max");

    private final String token;

    MeasurementMode(String token) {
        this.token = token;
    }

    /**
     * Lower-case token matched against file names and used for peak output names.
     */
    public String token() {
        return token;
    }

    /**
     * Token with a capitalized first letter, used as the pressure column header ("Min", "Max").
     */
    public String columnHeader() {
        return Character.toUpperCase(token.charAt(0)) + token.substring(1);
    }

    public boolean isPeak() {
        return this != MEAN;
    }

    /**
     * Infers the mode from a file name by substring match, case-insensitively. {@code mean} takes
     * precedence, then {@code max}, then {@code min}, so incidental words such as "terminal" or
     * "maximum" do not make a name ambiguous. Empty when no token occurs.
     */
    public static Optional<MeasurementMode> fromFileName(Path path) {
        for (MeasurementMode mode : List.of(MEAN, MAX, MIN)) {
            if (mode.appearsIn(path)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether this mode's token occurs anywhere in the file name, case-insensitively.
     */
    public boolean appearsIn(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).contains(token);
    }
}
