package com.phillippitts.windpressure.service.orchestration;

import com.phillippitts.windpressure.domain.CorrectionContext;
import com.phillippitts.windpressure.domain.CorrectionOutcome;
import com.phillippitts.windpressure.domain.CorrectionRequest;
import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.domain.MeasurementMode;
import com.phillippitts.windpressure.domain.Pipeline;
import com.phillippitts.windpressure.exception.CorrectionValidationException;
import com.phillippitts.windpressure.service.dispatch.CancellationToken;
import com.phillippitts.windpressure.service.dispatch.ParallelTaskDispatcher;
import com.phillippitts.windpressure.service.metrics.CorrectionMetrics;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionCompletedEvent;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent.Stage;
import com.phillippitts.windpressure.service.peak.PeakAggregator;
import com.phillippitts.windpressure.service.pulsation.PulsationProcessor;
import com.phillippitts.windpressure.service.validation.CorrectionRequestValidator;
import com.phillippitts.windpressure.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Default {@link CorrectionOrchestrator}: validate, build the run context, dispatch, report.
 *
 * <p><b>Pulsation:</b> one task per file on the dispatcher; the run completes when all have ended.
 *
 * <p><b>Peak:</b> stage 1 normalizes every file in parallel. Only when all of them succeeded is
 * stage 2 dispatched as a single aggregation task; otherwise aggregation is skipped and the
 * outcome reports it as such.
 *
 * <p>Every run gets a random run id which is placed in the Log4j2 ThreadContext under
 * {@value #MDC_RUN_ID} for the duration of its tasks, carried on every progress event and on the
 * outcome. Completion is recorded in {@link CorrectionMetrics} and published as a
 * {@link CorrectionCompletedEvent}.
 */
@Service
public class DefaultCorrectionOrchestrator implements CorrectionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultCorrectionOrchestrator.class);

    /** ThreadContext key holding the id of the current run. */
    public static final String MDC_RUN_ID = "runId";

    private final CorrectionRequestValidator validator;
    private final CorrectionContextFactory contextFactory;
    private final PulsationProcessor pulsationProcessor;
    private final PeakAggregator peakAggregator;
    private final ParallelTaskDispatcher dispatcher;
    private final ApplicationEventPublisher publisher;
    private final CorrectionMetrics metrics;

    public DefaultCorrectionOrchestrator(CorrectionRequestValidator validator,
                                         CorrectionContextFactory contextFactory,
                                         PulsationProcessor pulsationProcessor,
                                         PeakAggregator peakAggregator,
                                         ParallelTaskDispatcher dispatcher,
                                         ApplicationEventPublisher publisher,
                                         CorrectionMetrics metrics) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
        this.pulsationProcessor = Objects.requireNonNull(pulsationProcessor, "pulsationProcessor");
        this.peakAggregator = Objects.requireNonNull(peakAggregator, "peakAggregator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public CompletableFuture<CorrectionOutcome> runPulsation(CorrectionRequest request, CancellationToken token) {
        Objects.requireNonNull(token, "token");
        String runId = newRunId();
        ThreadContext.put(MDC_RUN_ID, runId);
        try {
            try {
                validator.validatePulsation(request);
            } catch (CorrectionValidationException e) {
                reject(e);
                throw e;
            }
            CorrectionContext ctx = contextFactory.forPulsation(request);
            Path outputDir = contextFactory.outputDir(request);
            LOG.info("Pulsation run over {} file(s): geometryIndex={}, dynamic={}, corr={}, output={}",
                    request.files().size(), ctx.geometryIndex(), ctx.dynamicCoefficient(),
                    ctx.correlationCoefficient(), outputDir);

            long t0 = System.nanoTime();
            progress(runId, Pipeline.PULSATION, Stage.STARTED);
            return dispatcher.dispatch(request.files(),
                            file -> pulsationProcessor.process(file, ctx, outputDir), token)
                    .thenApply(files -> complete(runId, Pipeline.PULSATION, request.mode(), files, null, t0));
        } finally {
            ThreadContext.remove(MDC_RUN_ID);
        }
    }

    @Override
    public CompletableFuture<CorrectionOutcome> runPeak(CorrectionRequest request, CancellationToken token) {
        Objects.requireNonNull(token, "token");
        String runId = newRunId();
        ThreadContext.put(MDC_RUN_ID, runId);
        try {
            try {
                validator.validatePeak(request);
            } catch (CorrectionValidationException e) {
                reject(e);
                throw e;
            }
            CorrectionContext ctx = contextFactory.forPeak(request);
            Path outputDir = contextFactory.outputDir(request);
            MeasurementMode mode = request.mode();
            List<Path> files = request.files();
            LOG.info("Peak run ({}) over {} file(s): geometryIndex={}, corr={}, output={}",
                    mode.token(), files.size(), ctx.geometryIndex(), ctx.correlationCoefficient(), outputDir);

            long t0 = System.nanoTime();
            progress(runId, Pipeline.PEAK, Stage.NORMALIZING);
            return dispatcher.dispatch(files, peakAggregator::normalize, token)
                    .thenCompose(normalized -> {
                        progress(runId, Pipeline.PEAK, Stage.NORMALIZED);
                        if (!normalized.stream().allMatch(FileOutcome::isSuccess)) {
                            LOG.warn("Skipping aggregation: not every file was normalized");
                            return CompletableFuture.completedFuture(
                                    complete(runId, Pipeline.PEAK, mode, normalized, null, t0));
                        }
                        progress(runId, Pipeline.PEAK, Stage.COMPUTING);
                        Path target = outputDir.resolve(peakAggregator.outputFileName(mode));
                        return dispatcher.runSingle(target,
                                        ignored -> peakAggregator.aggregate(files, mode, ctx, outputDir), token)
                                .thenApply(aggregate -> complete(runId, Pipeline.PEAK, mode, normalized, aggregate, t0));
                    });
        } finally {
            ThreadContext.remove(MDC_RUN_ID);
        }
    }

    private CorrectionOutcome complete(String runId, Pipeline pipeline, MeasurementMode mode,
                                       List<FileOutcome> files, FileOutcome aggregate, long t0) {
        CorrectionOutcome outcome = new CorrectionOutcome(runId, pipeline, mode, files, aggregate,
                TimeUtils.elapsedSince(t0));
        metrics.recordRun(pipeline, outcome.elapsed());
        for (FileOutcome f : files) {
            metrics.recordFile(pipeline, f.status());
        }
        if (aggregate != null) {
            metrics.recordFile(pipeline, aggregate.status());
        }
        progress(runId, pipeline, Stage.FINISHED);
        publisher.publishEvent(new CorrectionCompletedEvent(outcome, Instant.now()));
        return outcome;
    }

    private void progress(String runId, Pipeline pipeline, Stage stage) {
        publisher.publishEvent(new CorrectionProgressEvent(runId, pipeline, stage, Instant.now()));
    }

    private void reject(CorrectionValidationException e) {
        metrics.recordRejection(e.getReason());
        LOG.warn(e.getMessage());
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}
