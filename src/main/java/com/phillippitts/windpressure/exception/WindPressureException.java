package com.phillippitts.windpressure.exception;

/**
 * Base exception for all wind-pressure correction errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class WindPressureException extends RuntimeException {

    public WindPressureException(String message) {
        super(message);
    }

    public WindPressureException(String message, Throwable cause) {
        super(message, cause);
    }

    public WindPressureException(Throwable cause) {
        super(cause);
    }
}
