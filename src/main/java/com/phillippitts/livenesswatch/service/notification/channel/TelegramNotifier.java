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
import java.util.Objects;

/**
 * Sends alerts through the Telegram Bot API {@code sendMessage} method.
 *
 * <p>The Bot API answers {@code {"ok": true, ...}} on success and {@code {"ok": false,
 * "description": ...}} when it refuses the message; HTTP errors and unreadable bodies are
 * reported as {@link NotificationException}.
 */
public class TelegramNotifier implements ChannelNotifier {
    private static final Logger LOG = LogManager.getLogger(TelegramNotifier.class);

    private final RestClient restClient;
    private final URI sendMessageUri;
    private final String chatId;

    public TelegramNotifier(RestClient restClient, String apiBaseUrl, String botToken, String chatId) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        Objects.requireNonNull(botToken, "botToken");
        this.chatId = Objects.requireNonNull(chatId, "chatId");
        this.sendMessageUri = URI.create(stripTrailingSlash(apiBaseUrl) + "/bot" + botToken + "/sendMessage");
    }

    @Override
    public boolean sendMessage(String text) {
        String payload = new JSONObject()
                .put("chat_id", chatId)
                .put("text", text == null ? "" : text)
                .toString();
        try {
            String body = restClient.post()
                    .uri(sendMessageUri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                LOG.warn("Telegram returned an empty response");
                return false;
            }
            JSONObject response = new JSONObject(body);
            if (!response.optBoolean("ok", false)) {
                LOG.warn("Telegram refused message: {}", response.optString("description", "no description"));
                return false;
            }
            return true;
        } catch (RestClientException | JSONException e) {
            throw new NotificationException("Telegram sendMessage failed", channel().id(), e);
        }
    }

    @Override
    public ChannelId channel() {
        return ChannelId.TELEGRAM;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
