package com.phillippitts.windpressure.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of the cross-file selection at one row position.
 *
 * @param position   zero-based data row position (header excluded)
 * @param row        the corrected row
 * @param sourceFile file whose row won the min/max selection
 */
public record AggregatedRow(int position, MeasurementRow row, Path sourceFile) {

    public AggregatedRow {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
    }
}
