package com.phillippitts.windpressure.domain;

/**
 * The two processing pipelines.
 */
public enum Pipeline {
    /** Per-file correction of mean pressures. */
    PULSATION("pulsation"),
    /** Sort/normalize pass followed by cross-file min/max aggregation. */
    PEAK("peak");

    private final String tag;

    Pipeline(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean accepts(MeasurementMode mode) {
        return this == PULSATION ? mode == MeasurementMode.MEAN : mode.isPeak();
    }
}
