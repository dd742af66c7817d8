package com.phillippitts.livenesswatch.service.notification;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands alert messages to the dispatch worker so channel I/O never runs on the caller's thread.
 *
 * <p>{@link #dispatch(String)} only enqueues and returns; it is safe to call while holding the
 * watchdog's state lock. With the default single-thread executor alerts are delivered in the
 * order they were enqueued.
 */
@Component
public class AlertDispatcher {
    private static final Logger LOG = LogManager.getLogger(AlertDispatcher.class);

    private final AlertSender sender;
    private final Executor executor;

    public AlertDispatcher(AlertSender sender, @Qualifier("notifyExecutor") Executor executor) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Queues an alert for delivery.
     *
     * @param message alert text
     * @return future completed with the delivery outcome; completes with false (never
     *         exceptionally) if the queue is full or the sender fails unexpectedly
     */
    public CompletableFuture<Boolean> dispatch(String message) {
        try {
            return CompletableFuture.supplyAsync(() -> sender.send(message), executor)
                    .exceptionally(ex -> {
                        LOG.warn("Alert dispatch failed: {}", ex.toString());
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("Alert dispatch rejected, queue full: {}", e.toString());
            return CompletableFuture.completedFuture(false);
        }
    }
}
