package com.phillippitts.windpressure.service.events;

import com.phillippitts.windpressure.domain.CorrectionOutcome;
import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.domain.MeasurementMode;
import com.phillippitts.windpressure.domain.Pipeline;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionCompletedEvent;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;

class CorrectionEventsListenerTest {

    private final CorrectionEventsListener listener = new CorrectionEventsListener();

    @Test
    void logsProgress() {
        assertThatCode(() -> listener.onProgress(new CorrectionProgressEvent("run-1", Pipeline.PEAK,
                CorrectionProgressEvent.Stage.NORMALIZING, Instant.now())))
                .doesNotThrowAnyException();
    }

    @Test
    void logsFailedFilesAndAggregation() {
        CorrectionOutcome outcome = new CorrectionOutcome("run-2", Pipeline.PEAK, MeasurementMode.MAX,
                List.of(FileOutcome.succeeded(Path.of("a_max.csv"), Path.of("a_max.csv"), 2)),
                FileOutcome.failed(Path.of("max.csv"), "Peak files have unequal row counts", 4),
                Duration.ofMillis(6));

        assertThatCode(() -> listener.onCompleted(new CorrectionCompletedEvent(outcome, Instant.now())))
                .doesNotThrowAnyException();
    }

    @Test
    void logsSuccessfulRun() {
        CorrectionOutcome outcome = new CorrectionOutcome("run-3", Pipeline.PULSATION, MeasurementMode.MEAN,
                List.of(FileOutcome.succeeded(Path.of("a_mean.csv"), Path.of("A_puls.csv"), 2)),
                null, Duration.ofMillis(2));

        assertThatCode(() -> listener.onCompleted(new CorrectionCompletedEvent(outcome, Instant.now())))
                .doesNotThrowAnyException();
    }
}
