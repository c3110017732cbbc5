package com.phillippitts.windpressure.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The correction pool is sized to the number of available processors unless configured
 * otherwise under {@code threadpool.correction.*}.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private CorrectionPoolProperties correction = new CorrectionPoolProperties();

    public CorrectionPoolProperties getCorrection() {
        return correction;
    }

    public void setCorrection(CorrectionPoolProperties correction) {
        this.correction = correction;
    }

    /**
     * Correction executor pool configuration.
     */
    public static class CorrectionPoolProperties {
        @Min(1)
        private int corePoolSize = Runtime.getRuntime().availableProcessors();
        @Min(1)
        private int maxPoolSize = Runtime.getRuntime().availableProcessors();
        @Min(0)
        private int queueCapacity = 500;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "correction-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
