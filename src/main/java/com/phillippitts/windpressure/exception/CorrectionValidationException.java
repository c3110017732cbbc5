package com.phillippitts.windpressure.exception;

import java.util.Objects;

/**
 * Thrown when a correction request is rejected before any task is dispatched.
 * The {@link Reason} identifies which precondition failed.
 */
public class CorrectionValidationException extends WindPressureException {

    /**
     * Rejection reason codes.
     */
    public enum Reason {
        NO_FILES,
        MISSING_DIMENSIONS,
        MISSING_TERRAIN,
        MISSING_MODE,
        INVALID_CORRELATION_COEFFICIENT,
        UNRESOLVED_DYNAMIC_COEFFICIENT,
        UNKNOWN_FILE_MODE,
        MIXED_FILE_MODES,
        PIPELINE_MODE_MISMATCH,
        DUPLICATE_OUTPUT_NAME,
        DUPLICATE_INPUT_FILE
    }

    private final Reason reason;

    public CorrectionValidationException(Reason reason, String detail) {
        super("Correction request rejected [" + Objects.requireNonNull(reason, "reason") + "]: " + detail);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
