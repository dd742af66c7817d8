package com.phillippitts.livenesswatch.integration;

import com.phillippitts.livenesswatch.domain.ChannelId;
import com.phillippitts.livenesswatch.service.notification.ChannelNotifierFactory;
import com.phillippitts.livenesswatch.service.watchdog.Watchdog;
import com.phillippitts.livenesswatch.testutil.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application wiring: REST trigger, scheduled poll, router and dispatch worker, with the
 * HTTP transports replaced by in-memory notifiers.
 */
@SpringBootTest(properties = {
        "watchdog.name=integration",
        "watchdog.poll-interval-ms=50",
        "notification.default-channel=wechat",
        "notification.telegram.bot-token=123:abc",
        "notification.telegram.chat-id=42",
        "notification.wechat.webhook-key=robot-key"
})
@AutoConfigureMockMvc
class WatchdogAlertIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private Watchdog watchdog;

    @MockBean
    private ChannelNotifierFactory notifierFactory;

    private RecordingNotifier wechat;
    private RecordingNotifier telegram;

    @BeforeEach
    void setUp() {
        wechat = new RecordingNotifier(ChannelId.WECHAT, RecordingNotifier.Behavior.THROW);
        telegram = new RecordingNotifier(ChannelId.TELEGRAM, RecordingNotifier.Behavior.SUCCEED);
        when(notifierFactory.create(ChannelId.WECHAT)).thenReturn(Optional.of(wechat));
        when(notifierFactory.create(ChannelId.TELEGRAM)).thenReturn(Optional.of(telegram));
    }

    @Test
    void missedFeedProducesTimeoutAlertThroughFallbackChannel() throws Exception {
        mvc.perform(post("/api/v1/watchdog/feed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeoutMs\":300,\"info\":\"integration job\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(telegram.messages()).hasSize(3));

        List<String> delivered = telegram.messages();
        assertThat(delivered.get(0)).startsWith("[WATCHDOG] Auto-Started");
        assertThat(delivered.get(1))
                .startsWith("[WATCHDOG] Timeout Alert!")
                .contains("Start Info: integration job")
                .contains("Timeout Threshold: 300ms");
        assertThat(delivered.get(2)).contains("Reason: Timeout occurred");
        // default channel attempted first every time
        assertThat(wechat.attempts()).isEqualTo(3);

        await().atMost(Duration.ofSeconds(5)).until(() -> !watchdog.isRunning());
        mvc.perform(get("/api/v1/watchdog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.timeoutOccurred").value(false));

        mvc.perform(get("/actuator/health/watchdog"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.details.state").value("timeout"));
    }

    @Test
    void invalidFeedIsRejectedWithApiError() throws Exception {
        mvc.perform(post("/api/v1/watchdog/feed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeoutMs\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MethodArgumentNotValidException"))
                .andExpect(jsonPath("$.details").value("timeoutMs: timeoutMs must not be negative"));

        mvc.perform(post("/api/v1/watchdog/feed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));

        mvc.perform(post("/api/v1/watchdog/feed")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("x".repeat(4001)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ConstraintViolationException"))
                .andExpect(jsonPath("$.details").value("info: info must be at most 4000 characters"));

        mvc.perform(post("/api/v1/watchdog/feed")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("{\"timeoutMs\":\"soon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("timeoutMs must be a number"));
    }
}
