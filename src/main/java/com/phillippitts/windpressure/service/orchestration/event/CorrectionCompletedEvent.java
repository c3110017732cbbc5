package com.phillippitts.windpressure.service.orchestration.event;

import com.phillippitts.windpressure.domain.CorrectionOutcome;

import java.time.Instant;

/**
 * Emitted when every task of a correction run has ended.
 *
 * @param outcome   per-file results, aggregate result and elapsed time
 * @param timestamp when the run completed
 */
public record CorrectionCompletedEvent(
        CorrectionOutcome outcome,
        Instant timestamp
) {}
