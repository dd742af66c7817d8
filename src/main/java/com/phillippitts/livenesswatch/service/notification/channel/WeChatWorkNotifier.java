package com.phillippitts.livenesswatch.service.notification.channel;

import com.phillippitts.livenesswatch.domain.ChannelId;
import com.phillippitts.livenesswatch.exception.NotificationException;
import com.phillippitts.livenesswatch.service.notification.ChannelNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sends alerts to a WeChat Work (Enterprise WeChat) group robot webhook as plain text messages.
 *
 * <p>The webhook answers {@code {"errcode": 0, "errmsg": "ok"}} on success; any other
 * {@code errcode} means the message was refused.
 */
public class WeChatWorkNotifier implements ChannelNotifier {
    private static final Logger LOG = LogManager.getLogger(WeChatWorkNotifier.class);

    private final RestClient restClient;
    private final URI webhookUri;

    public WeChatWorkNotifier(RestClient restClient, String apiBaseUrl, String webhookKey) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        Objects.requireNonNull(webhookKey, "webhookKey");
        this.webhookUri = URI.create(TelegramNotifier.stripTrailingSlash(apiBaseUrl)
                + "/cgi-bin/webhook/send?key=" + URLEncoder.encode(webhookKey, StandardCharsets.UTF_8));
    }

    @Override
    public boolean sendMessage(String text) {
        String payload = new JSONObject()
                .put("msgtype", "text")
                .put("text", new JSONObject().put("content", text == null ? "" : text))
                .toString();
        try {
            String body = restClient.post()
                    .uri(webhookUri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                LOG.warn("WeChat Work returned an empty response");
                return false;
            }
            JSONObject response = new JSONObject(body);
            int errcode = response.optInt("errcode", -1);
            if (errcode != 0) {
                LOG.warn("WeChat Work refused message: errcode={}, errmsg={}", errcode, response.optString("errmsg", ""));
                return false;
            }
            return true;
        } catch (RestClientException | JSONException e) {
            throw new NotificationException("WeChat Work webhook failed", channel().id(), e);
        }
    }

    @Override
    public ChannelId channel() {
        return ChannelId.WECHAT;
    }
}
