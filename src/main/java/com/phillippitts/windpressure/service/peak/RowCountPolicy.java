package com.phillippitts.windpressure.service.peak;

/**
 * What peak aggregation does when its files have different numbers of data rows.
 */
public enum RowCountPolicy {
    /** Fail the aggregation with {@link com.phillippitts.windpressure.exception.AggregationMismatchException}. */
    STRICT,
    /** Stop at the end of the shortest file and log a warning; rows past it are not aggregated. */
    TRUNCATE
}
