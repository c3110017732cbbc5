package com.phillippitts.windpressure.domain;

import com.phillippitts.windpressure.util.TimeUtils;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Structured result of a correction run, delivered when every task has finished.
 *
 * @param runId     correlation id of the run (also present in log context)
 * @param pipeline  pipeline that ran
 * @param mode      mode of the request
 * @param files     per-file outcomes in request order (pulsation transforms or peak normalization)
 * @param aggregate outcome of the peak aggregation step; null for the pulsation pipeline or
 *                  when aggregation never started
 * @param elapsed   wall time from dispatch to completion
 */
public record CorrectionOutcome(String runId,
                                Pipeline pipeline,
                                MeasurementMode mode,
                                List<FileOutcome> files,
                                FileOutcome aggregate,
                                Duration elapsed) {

    public CorrectionOutcome {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(pipeline, "pipeline must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        files = List.copyOf(files);
    }

    public long succeededCount() {
        return count(FileOutcome.Status.SUCCEEDED);
    }

    public long failedCount() {
        return count(FileOutcome.Status.FAILED);
    }

    public long cancelledCount() {
        return count(FileOutcome.Status.CANCELLED);
    }

    /**
     * True when every file succeeded and, for the peak pipeline, the aggregation succeeded too.
     */
    public boolean isSuccess() {
        boolean filesOk = succeededCount() == files.size();
        if (pipeline == Pipeline.PEAK) {
            return filesOk && aggregate != null && aggregate.isSuccess();
        }
        return filesOk;
    }

    /**
     * One-line status summarizing counts and elapsed time, e.g.
     * {@code "pulsation done: 3 succeeded, 0 failed, 0 cancelled in 0:00:01.250000"}.
     */
    public String statusText() {
        StringBuilder sb = new StringBuilder()
                .append(pipeline.tag())
                .append(isSuccess() ? " done: " : " finished with errors: ")
                .append(succeededCount()).append(" succeeded, ")
                .append(failedCount()).append(" failed, ")
                .append(cancelledCount()).append(" cancelled");
        if (pipeline == Pipeline.PEAK) {
            sb.append(", aggregation ")
              .append(aggregate == null ? "skipped" : aggregate.status().name().toLowerCase(Locale.ROOT));
        }
        return sb.append(" in ").append(TimeUtils.formatElapsed(elapsed)).toString();
    }

    private long count(FileOutcome.Status status) {
        return files.stream().filter(f -> f.status() == status).count();
    }
}
