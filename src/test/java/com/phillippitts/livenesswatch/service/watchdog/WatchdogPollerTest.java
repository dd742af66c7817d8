package com.phillippitts.livenesswatch.service.watchdog;

import com.phillippitts.livenesswatch.service.metrics.WatchdogMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WatchdogPollerTest {

    private Watchdog watchdog;
    private SimpleMeterRegistry registry;
    private WatchdogPoller poller;

    @BeforeEach
    void setUp() {
        watchdog = mock(Watchdog.class);
        when(watchdog.getName()).thenReturn("orders");
        registry = new SimpleMeterRegistry();
        poller = new WatchdogPoller(watchdog, new WatchdogMetrics(registry));
    }

    @Test
    void doesNotNotifyWhileHealthy() {
        when(watchdog.poll()).thenReturn(false);

        poller.tick();

        verify(watchdog, never()).notifyTimeoutAsync();
        assertThat(registry.find("livenesswatch.watchdog.timeouts").counter()).isNull();
    }

    @Test
    void notifiesWhenPollDetectsTimeout() {
        when(watchdog.poll()).thenReturn(true);
        when(watchdog.notifyTimeoutAsync()).thenReturn(CompletableFuture.completedFuture(true));

        poller.tick();

        verify(watchdog).notifyTimeoutAsync();
        verify(watchdog, never()).notifyTimeout();
        assertThat(registry.get("livenesswatch.watchdog.timeouts").tag("watchdog", "orders").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void undeliveredAlertDoesNotFailTheTick() {
        when(watchdog.poll()).thenReturn(true);
        when(watchdog.notifyTimeoutAsync()).thenReturn(CompletableFuture.completedFuture(false));

        poller.tick();

        verify(watchdog).notifyTimeoutAsync();
    }

    @Test
    void tickDoesNotWaitForPendingDelivery() {
        when(watchdog.poll()).thenReturn(true);
        CompletableFuture<Boolean> pending = new CompletableFuture<>();
        when(watchdog.notifyTimeoutAsync()).thenReturn(pending);

        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> poller.tick());

        pending.complete(true);
    }

    @Test
    void clearsWatchdogLogContextAfterTick() {
        when(watchdog.poll()).thenAnswer(invocation -> {
            assertThat(ThreadContext.get(WatchdogPoller.WATCHDOG_CONTEXT_KEY)).isEqualTo("orders");
            return false;
        });

        poller.tick();

        assertThat(ThreadContext.get(WatchdogPoller.WATCHDOG_CONTEXT_KEY)).isNull();
    }
}
