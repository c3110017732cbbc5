package com.phillippitts.windpressure.exception;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when the files of a peak aggregation do not have equal data row counts, which breaks
 * the positional correspondence between their rows.
 */
public class AggregationMismatchException extends WindPressureException {

    private final Map<Path, Integer> rowCounts;

    public AggregationMismatchException(Map<Path, Integer> rowCounts) {
        super("Peak files have unequal row counts: " + rowCounts);
        this.rowCounts = Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts));
    }

    /**
     * @return data rows read per file before the mismatch was detected, in request order
     */
    public Map<Path, Integer> getRowCounts() {
        return rowCounts;
    }
}
