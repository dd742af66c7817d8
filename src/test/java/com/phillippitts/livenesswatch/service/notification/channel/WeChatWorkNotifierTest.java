package com.phillippitts.livenesswatch.service.notification.channel;

import com.phillippitts.livenesswatch.exception.NotificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WeChatWorkNotifierTest {

    private static final String WEBHOOK_URL = "https://wechat.test/cgi-bin/webhook/send?key=robot-key";

    private MockRestServiceServer server;
    private WeChatWorkNotifier notifier;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        notifier = new WeChatWorkNotifier(builder.build(), "https://wechat.test", "robot-key");
    }

    @Test
    void postsTextMessageToWebhook() {
        server.expect(requestTo(WEBHOOK_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.msgtype").value("text"))
                .andExpect(jsonPath("$.text.content").value("line one\n\nline two"))
                .andRespond(withSuccess("{\"errcode\":0,\"errmsg\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThat(notifier.sendMessage("line one\n\nline two")).isTrue();
        server.verify();
    }

    @Test
    void nonZeroErrcodeReturnsFalse() {
        server.expect(requestTo(WEBHOOK_URL))
                .andRespond(withSuccess("{\"errcode\":93000,\"errmsg\":\"invalid webhook url\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(notifier.sendMessage("hello")).isFalse();
    }

    @Test
    void missingErrcodeReturnsFalse() {
        server.expect(requestTo(WEBHOOK_URL))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(notifier.sendMessage("hello")).isFalse();
    }

    @Test
    void httpErrorIsReportedAsNotificationException() {
        server.expect(requestTo(WEBHOOK_URL)).andRespond(withBadRequest());

        assertThatThrownBy(() -> notifier.sendMessage("hello"))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("channel: wechat");
    }

    @Test
    void webhookKeyIsUrlEncoded() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer encodedServer = MockRestServiceServer.bindTo(builder).build();
        WeChatWorkNotifier encoded = new WeChatWorkNotifier(builder.build(), "https://wechat.test/", "a b&c");
        encodedServer.expect(requestTo("https://wechat.test/cgi-bin/webhook/send?key=a+b%26c"))
                .andRespond(withSuccess("{\"errcode\":0}", MediaType.APPLICATION_JSON));

        assertThat(encoded.sendMessage("hi")).isTrue();
        encodedServer.verify();
    }
}
