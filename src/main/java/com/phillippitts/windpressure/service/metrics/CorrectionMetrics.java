package com.phillippitts.windpressure.service.metrics;

import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.domain.Pipeline;
import com.phillippitts.windpressure.exception.CorrectionValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics tracking for correction runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Run latency per pipeline (pulsation, peak)</li>
 *   <li>File outcomes per pipeline and status (succeeded, failed, cancelled)</li>
 *   <li>Rejected requests per validation reason</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CorrectionMetrics {

    private static final String METRIC_PREFIX = "windpressure.correction";

    private final MeterRegistry registry;

    public CorrectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records wall time of one run, from dispatch to completion.
     *
     * @param pipeline pipeline that ran
     * @param elapsed  run duration
     */
    public void recordRun(Pipeline pipeline, Duration elapsed) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a correction run")
                .tag("pipeline", pipeline.tag())
                .register(registry)
                .record(elapsed);
    }

    /**
     * Counts one file outcome.
     *
     * @param pipeline pipeline the file ran through
     * @param status   how the file's task ended
     */
    public void recordFile(Pipeline pipeline, FileOutcome.Status status) {
        Counter.builder(METRIC_PREFIX + ".files")
                .description("Number of processed files by outcome")
                .tag("pipeline", pipeline.tag())
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts one rejected request.
     *
     * @param reason validation reason code
     */
    public void recordRejection(CorrectionValidationException.Reason reason) {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Number of correction requests rejected by validation")
                .tag("reason", reason.name())
                .register(registry)
                .increment();
    }
}
