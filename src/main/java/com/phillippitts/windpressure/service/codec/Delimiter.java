package com.phillippitts.windpressure.service.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field separators understood by {@link RecordCodec}.
 */
public enum Delimiter {
    TAB("\t"),
    COMMA(","),
    /** Runs of spaces or tabs on read; a single space on write. */
    WHITESPACE(" ");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final String separator;

    Delimiter(String separator) {
        this.separator = separator;
    }

    /**
     * Separator written between fields.
     */
    public String separator() {
        return separator;
    }

    /**
     * Splits one line into trimmed fields.
     */
    public List<String> split(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        String[] parts = switch (this) {
            case TAB -> trimmed.split("\t", -1);
            case COMMA -> trimmed.split(",", -1);
            case WHITESPACE -> WHITESPACE_RUN.split(trimmed);
        };
        List<String> fields = new ArrayList<>(parts.length);
        for (String p : parts) {
            fields.add(p.strip());
        }
        return fields;
    }

    /**
     * Picks the delimiter of a record file from a sample line: tab if present, else comma if
     * present, else whitespace.
     */
    public static Delimiter infer(String sampleLine) {
        if (sampleLine.indexOf('\t') >= 0) {
            return TAB;
        }
        if (sampleLine.indexOf(',') >= 0) {
            return COMMA;
        }
        return WHITESPACE;
    }
}
