package com.phillippitts.windpressure.config;

import com.phillippitts.windpressure.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the worker pool that runs per-file correction tasks.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and default to the number of
 * available processors.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool for correction tasks.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue are
     * full, the submitting thread runs the task itself.
     *
     * <p>Thread naming: configured via {@code threadpool.correction.thread-name-prefix}.
     *
     * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext (run id) is copied to the
     * worker for the duration of each task.
     *
     * @return configured executor for correction tasks
     */
    @Bean(name = "correctionExecutor")
    public ThreadPoolTaskExecutor correctionExecutor() {
        ThreadPoolProperties.CorrectionPoolProperties props = threadPoolProperties.getCorrection();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Decorator that runs each task under the ThreadContext captured at submission and restores
     * the worker's own context afterwards.
     */
    static TaskDecorator threadContextPropagator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
