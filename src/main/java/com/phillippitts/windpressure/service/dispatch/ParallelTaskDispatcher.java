package com.phillippitts.windpressure.service.dispatch;

import com.phillippitts.windpressure.domain.FileOutcome;
import com.phillippitts.windpressure.exception.WindPressureException;
import com.phillippitts.windpressure.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fans per-file tasks out over the correction executor and fans their outcomes back in.
 *
 * <p><b>Thread Model:</b> each file becomes one task on {@code correctionExecutor}. Tasks share
 * nothing but the immutable inputs captured by the {@link FileTask}; no locks are taken.
 *
 * <p><b>Error Handling:</b> a task's exception never leaves the task. It is logged and turned into
 * {@link FileOutcome#failed}, so the remaining files still complete. The futures returned here
 * therefore always complete normally.
 *
 * <p><b>Cancellation:</b> tasks that have not started when the {@link CancellationToken} is
 * cancelled are skipped and reported as {@link FileOutcome.Status#CANCELLED}.
 *
 * <p><b>Ordering:</b> outcomes are returned in input order regardless of completion order.
 */
@Component
public class ParallelTaskDispatcher {

    private static final Logger LOG = LogManager.getLogger(ParallelTaskDispatcher.class);

    /** ThreadContext key holding the file a worker is processing. */
    public static final String MDC_FILE = "file";

    private final Executor executor;

    public ParallelTaskDispatcher(@Qualifier("correctionExecutor") Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Runs {@code task} once per file concurrently.
     *
     * @param files files to process, one task each
     * @param task  work applied to every file
     * @param token cancellation token checked before each task starts
     * @return future completing with one outcome per file, in input order, once all tasks ended
     */
    public CompletableFuture<List<FileOutcome>> dispatch(List<Path> files, FileTask task, CancellationToken token) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(token, "token must not be null");

        List<CompletableFuture<FileOutcome>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(file, task, token), executor));
        }
        LOG.debug("Dispatched {} file task(s)", futures.size());

        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<FileOutcome> outcomes = new ArrayList<>(futures.size());
                    for (CompletableFuture<FileOutcome> f : futures) {
                        outcomes.add(f.join());
                    }
                    return outcomes;
                });
    }

    /**
     * Runs a single task, such as peak aggregation gated on a completed first stage.
     *
     * @param label path reported as the outcome's source (the task's target)
     * @param task  work to run with {@code label} as its argument
     * @param token cancellation token checked before the task starts
     * @return future completing with the task's outcome
     */
    public CompletableFuture<FileOutcome> runSingle(Path label, FileTask task, CancellationToken token) {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(token, "token must not be null");
        return CompletableFuture.supplyAsync(() -> execute(label, task, token), executor);
    }

    private FileOutcome execute(Path file, FileTask task, CancellationToken token) {
        if (token.isCancelled()) {
            LOG.info("Skipping {}: run cancelled", file.getFileName());
            return FileOutcome.cancelled(file);
        }
        String previousFile = ThreadContext.get(MDC_FILE);
        ThreadContext.put(MDC_FILE, String.valueOf(file.getFileName()));
        long t0 = System.nanoTime();
        try {
            Path output = task.run(file);
            long ms = TimeUtils.elapsedMillis(t0);
            LOG.debug("Finished in {} ms", ms);
            return FileOutcome.succeeded(file, output, ms);
        } catch (WindPressureException e) {
            LOG.warn("Failed: {}", e.getMessage());
            return FileOutcome.failed(file, e.getMessage(), TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            LOG.error("Unexpected error processing {}", file, e);
            return FileOutcome.failed(file, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    TimeUtils.elapsedMillis(t0));
        } finally {
            if (previousFile == null) {
                ThreadContext.remove(MDC_FILE);
            } else {
                ThreadContext.put(MDC_FILE, previousFile);
            }
        }
    }
}
