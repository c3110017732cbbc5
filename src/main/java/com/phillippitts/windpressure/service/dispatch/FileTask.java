package com.phillippitts.windpressure.service.dispatch;

import java.nio.file.Path;

/**
 * Unit of per-file work run by {@link ParallelTaskDispatcher}.
 */
@FunctionalInterface
public interface FileTask {

    /**
     * @param file the file this task owns
     * @return the file the task wrote
     */
    Path run(Path file);
}
