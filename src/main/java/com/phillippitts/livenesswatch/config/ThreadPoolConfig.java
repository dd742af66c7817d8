package com.phillippitts.livenesswatch.config;

import com.phillippitts.livenesswatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that delivers watchdog alerts.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.notify.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor that runs channel I/O for watchdog alerts.
     *
     * <p>Pool sizing defaults:
     * <ul>
     *   <li>Core/max pool: 1 thread - alerts are delivered in the order they were queued</li>
     *   <li>Queue: 100 alerts - bounded so a dead channel cannot grow memory without limit</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Alerts are queued while the
     * watchdog holds its state lock, so the caller must never end up running channel I/O itself.
     * A rejected alert is reported as undelivered by the dispatcher.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (watchdog name) from the thread that
     * queued the alert to the worker.
     *
     * @return configured executor for alert delivery
     */
    @Bean(name = "notifyExecutor")
    public Executor notifyExecutor() {
        ThreadPoolProperties.NotifyPoolProperties notifyProps = threadPoolProperties.getNotify();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifyProps.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(notifyProps.getCorePoolSize(), notifyProps.getMaxPoolSize()));
        executor.setQueueCapacity(notifyProps.getQueueCapacity());
        executor.setThreadNamePrefix(notifyProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(notifyProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> submitted = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (submitted != null && !submitted.isEmpty()) {
                        ThreadContext.putAll(submitted);
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
