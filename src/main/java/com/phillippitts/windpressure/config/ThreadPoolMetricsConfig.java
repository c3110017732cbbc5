package com.phillippitts.windpressure.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Micrometer wiring: an in-memory registry when no other is configured, plus gauges for the
 * correction executor.
 *
 * <p>Gauges registered:
 * <ul>
 *   <li>correction.pool.size - Current number of threads in the pool</li>
 *   <li>correction.pool.active - Number of actively executing tasks</li>
 *   <li>correction.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>correction.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> correctionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("correctionExecutor") ObjectProvider<ThreadPoolTaskExecutor> correctionExecutorProvider) {
        this.correctionExecutorProvider = correctionExecutorProvider;
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Registers the correction pool gauges once all singletons exist.
     */
    @Bean
    public SmartInitializingSingleton correctionExecutorMetrics(MeterRegistry registry) {
        return () -> bindTo(registry);
    }

    void bindTo(MeterRegistry registry) {
        ThreadPoolExecutor executor = correctionExecutorProvider.getObject().getThreadPoolExecutor();

        Gauge.builder("correction.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the correction pool")
                .register(registry);

        Gauge.builder("correction.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing correction tasks")
                .register(registry);

        Gauge.builder("correction.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of correction tasks waiting in the queue")
                .register(registry);

        Gauge.builder("correction.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed correction tasks")
                .register(registry);

        LOG.debug("Correction thread pool metrics registered");
    }

    /**
     * Logs thread pool health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = correctionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Correction Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
