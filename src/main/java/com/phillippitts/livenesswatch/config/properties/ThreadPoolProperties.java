package com.phillippitts.livenesswatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The alert dispatch pool defaults to a single worker so alerts leave in the order the
 * watchdog produced them. Raising the pool size trades that ordering for throughput.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private NotifyPoolProperties notify = new NotifyPoolProperties();

    public NotifyPoolProperties getNotify() {
        return notify;
    }

    public void setNotify(NotifyPoolProperties notify) {
        this.notify = notify;
    }

    /**
     * Alert dispatch executor configuration.
     */
    public static class NotifyPoolProperties {
        @Positive
        private int corePoolSize = 1;
        @Positive
        private int maxPoolSize = 1;
        @PositiveOrZero
        private int queueCapacity = 100;
        @PositiveOrZero
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "notify-";

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
