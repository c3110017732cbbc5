package com.phillippitts.windpressure.service.orchestration;

import com.phillippitts.windpressure.domain.CorrectionOutcome;
import com.phillippitts.windpressure.domain.CorrectionRequest;
import com.phillippitts.windpressure.service.dispatch.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the correction pipelines, called by the form collaborator.
 *
 * <p>Both operations validate the request on the calling thread and throw
 * {@link com.phillippitts.windpressure.exception.CorrectionValidationException} before any work is
 * dispatched. Otherwise they return at once; the future completes with the structured outcome
 * when every task has ended, and a
 * {@link com.phillippitts.windpressure.service.orchestration.event.CorrectionCompletedEvent} is
 * published at the same time.
 */
public interface CorrectionOrchestrator {

    /**
     * Corrects every mean file of the request independently.
     */
    default CompletableFuture<CorrectionOutcome> runPulsation(CorrectionRequest request) {
        return runPulsation(request, new CancellationToken());
    }

    CompletableFuture<CorrectionOutcome> runPulsation(CorrectionRequest request, CancellationToken token);

    /**
     * Normalizes every min/max file, then aggregates them into one output file.
     */
    default CompletableFuture<CorrectionOutcome> runPeak(CorrectionRequest request) {
        return runPeak(request, new CancellationToken());
    }

    CompletableFuture<CorrectionOutcome> runPeak(CorrectionRequest request, CancellationToken token);
}
