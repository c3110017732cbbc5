package com.phillippitts.windpressure.service.orchestration.event;

import com.phillippitts.windpressure.domain.Pipeline;

import java.time.Instant;

/**
 * Emitted when a correction run enters a new stage, for status display by the caller.
 *
 * @param runId     correlation id of the run
 * @param pipeline  pipeline that is running
 * @param stage     stage that was entered
 * @param timestamp when the stage was entered
 */
public record CorrectionProgressEvent(
        String runId,
        Pipeline pipeline,
        Stage stage,
        Instant timestamp
) {

    /**
     * Stages of a run, in the order they occur.
     */
    public enum Stage {
        STARTED("started"),
        NORMALIZING("sorting and normalizing"),
        NORMALIZED("normalization done"),
        COMPUTING("computing"),
        FINISHED("finished");

        private final String text;

        Stage(String text) {
            this.text = text;
        }

        /** Status line shown to the user. */
        public String text() {
            return text;
        }
    }
}
