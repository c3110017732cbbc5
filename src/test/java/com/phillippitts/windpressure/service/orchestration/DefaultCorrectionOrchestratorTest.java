package com.phillippitts.windpressure.service.orchestration;

import com.phillippitts.windpressure.config.properties.CorrectionProperties;
import com.phillippitts.windpressure.domain.CorrectionOutcome;
import com.phillippitts.windpressure.domain.CorrectionRequest;
import com.phillippitts.windpressure.domain.DynamicResponse;
import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.domain.MeasurementMode;
import com.phillippitts.windpressure.domain.Pipeline;
import com.phillippitts.windpressure.domain.TerrainCategory;
import com.phillippitts.windpressure.exception.CorrectionValidationException;
import com.phillippitts.windpressure.service.dispatch.CancellationToken;
import com.phillippitts.windpressure.service.dispatch.ParallelTaskDispatcher;
import com.phillippitts.windpressure.service.metrics.CorrectionMetrics;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent.Stage;
import com.phillippitts.windpressure.service.peak.PeakAggregator;
import com.phillippitts.windpressure.service.peak.RowCountPolicy;
import com.phillippitts.windpressure.service.pulsation.PulsationProcessor;
import com.phillippitts.windpressure.service.validation.CorrectionRequestValidator;
import com.phillippitts.windpressure.testutil.EventCapturingPublisher;
import com.phillippitts.windpressure.testutil.MeasurementFiles;
import com.phillippitts.windpressure.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultCorrectionOrchestratorTest {

    @TempDir
    Path dir;

    private Path out;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private ExecutorService pool;

    @BeforeEach
    void setUp() throws IOException {
        out = Files.createDirectory(dir.resolve("out"));
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
        ThreadContext.clearMap();
    }

    @Test
    void pulsationRunWritesOneOutputPerFile() throws Exception {
        Path p1 = MeasurementFiles.write(dir, "P1_mean.csv", "Mean\tX\tY\tZ", new double[] {100, 0, 0, 5});
        Path p2 = MeasurementFiles.write(dir, "P2_mean.csv", "Mean\tX\tY\tZ", new double[] {-20, 1, 1, 40});

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPulsation(pulsation(p1, p2)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.pipeline()).isEqualTo(Pipeline.PULSATION);
        assertThat(outcome.files()).extracting(FileOutcome::output)
                .containsExactly(out.resolve("P1_puls.csv"), out.resolve("P2_puls.csv"));
        assertThat(out.resolve("P1_puls.csv")).exists();
        assertThat(out.resolve("P2_puls.csv")).exists();
        assertThat(outcome.statusText()).startsWith("pulsation done: 2 succeeded, 0 failed, 0 cancelled in ");

        assertThat(publisher.progressStages()).containsExactly(Stage.STARTED, Stage.FINISHED);
        assertThat(publisher.completedEvents()).hasSize(1);
        assertThat(publisher.completedEvents().get(0).outcome().runId()).isEqualTo(outcome.runId());
        assertThat(registry.get("windpressure.correction.files")
                .tags("pipeline", "pulsation", "status", "succeeded").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("windpressure.correction.latency").tags("pipeline", "pulsation").timer().count())
                .isEqualTo(1);
    }

    @Test
    void pulsationReportsMalformedFileAndKeepsTheOthers() throws Exception {
        Path good = MeasurementFiles.write(dir, "G_mean.csv", "Mean\tX\tY\tZ", new double[] {100, 0, 0, 5});
        Path bad = Files.writeString(dir.resolve("B_mean.csv"), "Mean\tX\tY\tZ\nabc\t0\t0\t5\n");

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPulsation(pulsation(good, bad)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.files()).extracting(FileOutcome::status)
                .containsExactly(FileOutcome.Status.SUCCEEDED, FileOutcome.Status.FAILED);
        assertThat(outcome.files().get(1).error()).contains("abc");
        assertThat(out.resolve("G_puls.csv")).exists();
        assertThat(out.resolve("B_puls.csv")).doesNotExist();
    }

    @Test
    void peakRunNormalizesThenAggregates() throws Exception {
        Path p1 = MeasurementFiles.write(dir, "P1_max.csv", "Max\tX\tY\tZ",
                new double[] {3, 1, 0, 5}, new double[] {10, 0, 0, 5});
        Path p2 = MeasurementFiles.write(dir, "P2_max.csv", "Max\tX\tY\tZ",
                new double[] {8, 1, 0, 5}, new double[] {1, 0, 0, 5});

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPeak(peak(MeasurementMode.MAX, p1, p2)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.aggregate().output()).isEqualTo(out.resolve("max.csv"));
        assertThat(Files.readAllLines(p1).get(1)).isEqualTo("10.0\t0.0\t0.0\t5.0");
        assertThat(Files.readAllLines(out.resolve("max.csv"))).hasSize(3);
        assertThat(outcome.statusText()).contains("aggregation succeeded");
        assertThat(publisher.progressStages()).containsExactly(
                Stage.NORMALIZING, Stage.NORMALIZED, Stage.COMPUTING, Stage.FINISHED);
        assertThat(registry.get("windpressure.correction.files")
                .tags("pipeline", "peak", "status", "succeeded").counter().count()).isEqualTo(3.0);
    }

    @Test
    void peakSkipsAggregationWhenNormalizationFails() throws Exception {
        Path p1 = MeasurementFiles.write(dir, "P1_min.csv", "Min\tX\tY\tZ", new double[] {-3, 0, 0, 5});
        Path p2 = Files.writeString(dir.resolve("P2_min.csv"), "Min\tX\tY\tZ\n-1\t0\t0\n");

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPeak(peak(MeasurementMode.MIN, p1, p2)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.aggregate()).isNull();
        assertThat(outcome.statusText()).contains("aggregation skipped");
        assertThat(out.resolve("min.csv")).doesNotExist();
        assertThat(publisher.progressStages()).containsExactly(Stage.NORMALIZING, Stage.NORMALIZED, Stage.FINISHED);
    }

    @Test
    void peakReportsFailedAggregationOnRowCountMismatch() throws Exception {
        Path p1 = MeasurementFiles.write(dir, "P1_max.csv", "Max\tX\tY\tZ", new double[] {1, 0, 0, 1});
        Path p2 = MeasurementFiles.write(dir, "P2_max.csv", "Max\tX\tY\tZ",
                new double[] {1, 0, 0, 1}, new double[] {2, 0, 0, 2});

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPeak(peak(MeasurementMode.MAX, p1, p2)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.files()).allMatch(FileOutcome::isSuccess);
        assertThat(outcome.aggregate().status()).isEqualTo(FileOutcome.Status.FAILED);
        assertThat(outcome.aggregate().error()).contains("P1_max.csv=1").contains("P2_max.csv=2");
        assertThat(out.resolve("max.csv")).doesNotExist();
        assertThat(registry.get("windpressure.correction.files")
                .tags("pipeline", "peak", "status", "succeeded").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("windpressure.correction.files")
                .tags("pipeline", "peak", "status", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void rejectedRequestThrowsBeforeAnyEvent() {
        CorrectionRequest noFiles = CorrectionRequest.builder()
                .mode(MeasurementMode.MEAN)
                .dimensions(50.0, 20.0)
                .build();
        DefaultCorrectionOrchestrator orchestrator = orchestrator(new SyncExecutor());

        assertThatThrownBy(() -> orchestrator.runPulsation(noFiles))
                .isInstanceOf(CorrectionValidationException.class);
        assertThat(publisher.isEmpty()).isTrue();
        assertThat(registry.get("windpressure.correction.rejected").tag("reason", "NO_FILES").counter().count())
                .isEqualTo(1.0);
        assertThat(ThreadContext.get(DefaultCorrectionOrchestrator.MDC_RUN_ID)).isNull();
    }

    @Test
    void cancelledRunReportsUnstartedFiles() throws Exception {
        Path p1 = MeasurementFiles.write(dir, "P1_mean.csv", "Mean\tX\tY\tZ", new double[] {100, 0, 0, 5});
        CancellationToken token = new CancellationToken();
        token.cancel();

        CorrectionOutcome outcome = orchestrator(new SyncExecutor())
                .runPulsation(pulsation(p1), token).get(5, TimeUnit.SECONDS);

        assertThat(outcome.cancelledCount()).isEqualTo(1);
        assertThat(out.resolve("P1_puls.csv")).doesNotExist();
    }

    @Test
    void runsOnAThreadPoolWithoutBlockingTheCaller() {
        pool = Executors.newFixedThreadPool(3);
        Path[] files = new Path[6];
        for (int i = 0; i < files.length; i++) {
            files[i] = MeasurementFiles.write(dir, "F" + i + "_mean.csv", "Mean\tX\tY\tZ",
                    new double[] {10 * i, i, 0, 5}, new double[] {-i, i, 1, 30});
        }

        CompletableFuture<CorrectionOutcome> future = orchestrator(pool).runPulsation(pulsation(files));

        await().atMost(Duration.ofSeconds(10)).until(future::isDone);
        CorrectionOutcome outcome = future.join();
        assertThat(outcome.succeededCount()).isEqualTo(6);
        assertThat(outcome.files()).extracting(FileOutcome::source).containsExactly(files);
        await().atMost(Duration.ofSeconds(5)).until(() -> publisher.completedEvents().size() == 1);
    }

    private DefaultCorrectionOrchestrator orchestrator(Executor executor) {
        CorrectionContextFactory contextFactory = new CorrectionContextFactory(CorrectionProperties.defaults());
        return new DefaultCorrectionOrchestrator(
                new CorrectionRequestValidator(contextFactory),
                contextFactory,
                new PulsationProcessor(),
                new PeakAggregator(RowCountPolicy.STRICT),
                new ParallelTaskDispatcher(executor),
                publisher,
                new CorrectionMetrics(registry));
    }

    private CorrectionRequest pulsation(Path... files) {
        return CorrectionRequest.builder()
                .files(List.of(files))
                .mode(MeasurementMode.MEAN)
                .dimensions(50.0, 20.0)
                .terrain(TerrainCategory.B)
                .dynamicResponse(DynamicResponse.notApplicable())
                .outputDir(out)
                .build();
    }

    private CorrectionRequest peak(MeasurementMode mode, Path... files) {
        return CorrectionRequest.builder()
                .files(List.of(files))
                .mode(mode)
                .dimensions(50.0, 20.0)
                .terrain(TerrainCategory.B)
                .outputDir(out)
                .build();
    }
}
