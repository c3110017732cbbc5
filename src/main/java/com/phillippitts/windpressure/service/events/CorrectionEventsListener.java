package com.phillippitts.windpressure.service.events;

import com.phillippitts.windpressure.domain.CorrectionOutcome;
import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionCompletedEvent;
import com.phillippitts.windpressure.service.orchestration.event.CorrectionProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs correction progress and completion. Failed files are listed individually so the log
 * carries the reason next to the file name.
 */
@Component
class CorrectionEventsListener {
    private static final Logger LOG = LogManager.getLogger(CorrectionEventsListener.class);

    @EventListener
    void onProgress(CorrectionProgressEvent e) {
        LOG.info("[{}] {} {}", e.runId(), e.pipeline().tag(), e.stage().text());
    }

    @EventListener
    void onCompleted(CorrectionCompletedEvent e) {
        CorrectionOutcome outcome = e.outcome();
        if (outcome.isSuccess()) {
            LOG.info("[{}] {}", outcome.runId(), outcome.statusText());
            return;
        }
        LOG.warn("[{}] {}", outcome.runId(), outcome.statusText());
        for (FileOutcome f : outcome.files()) {
            if (f.status() == FileOutcome.Status.FAILED) {
                LOG.warn("[{}] {} failed: {}", outcome.runId(), f.source(), f.error());
            }
        }
        FileOutcome aggregate = outcome.aggregate();
        if (aggregate != null && aggregate.status() == FileOutcome.Status.FAILED) {
            LOG.warn("[{}] aggregation into {} failed: {}", outcome.runId(), aggregate.source(), aggregate.error());
        }
    }
}
