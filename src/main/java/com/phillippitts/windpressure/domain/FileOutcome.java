package com.phillippitts.windpressure.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of one per-file task.
 *
 * @param source     input file the task worked on
 * @param status     how the task ended
 * @param output     file written by the task, null unless it succeeded
 * @param error      failure description, null unless it failed
 * @param durationMs wall time spent in the task
 */
public record FileOutcome(Path source, Status status, Path output, String error, long durationMs) {

    public enum Status { SUCCEEDED, FAILED, CANCELLED }

    public FileOutcome {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static FileOutcome succeeded(Path source, Path output, long durationMs) {
        return new FileOutcome(source, Status.SUCCEEDED, output, null, durationMs);
    }

    public static FileOutcome failed(Path source, String error, long durationMs) {
        return new FileOutcome(source, Status.FAILED, null, error, durationMs);
    }

    public static FileOutcome cancelled(Path source) {
        return new FileOutcome(source, Status.CANCELLED, null, null, 0L);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
