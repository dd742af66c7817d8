package com.phillippitts.livenesswatch.config.properties;

import com.phillippitts.livenesswatch.domain.ChannelId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Channel credentials and fallback preferences for watchdog alerts.
 *
 * <p>A channel counts as enabled only when it is listed in {@code channels} and its credentials
 * are present; blank credentials keep it out of the fallback order without failing startup.
 */
@ConfigurationProperties(prefix = "notification")
@Validated
public class NotificationProperties {

    /** Channel tried first when enabled. Optional. */
    private ChannelId defaultChannel;

    /** Fallback order of the remaining channels. */
    @NotNull
    private List<ChannelId> channels = new ArrayList<>(List.of(ChannelId.values()));

    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 5_000;

    @Positive(message = "Read timeout must be positive")
    private int readTimeoutMs = 10_000;

    @Valid
    private Telegram telegram = new Telegram();

    @Valid
    private WeChat wechat = new WeChat();

    public ChannelId getDefaultChannel() {
        return defaultChannel;
    }

    public void setDefaultChannel(ChannelId defaultChannel) {
        this.defaultChannel = defaultChannel;
    }

    public List<ChannelId> getChannels() {
        return channels;
    }

    public void setChannels(List<ChannelId> channels) {
        this.channels = channels;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    public void setTelegram(Telegram telegram) {
        this.telegram = telegram;
    }

    public WeChat getWechat() {
        return wechat;
    }

    public void setWechat(WeChat wechat) {
        this.wechat = wechat;
    }

    /**
     * Telegram Bot API credentials.
     */
    public static class Telegram {
        private String botToken;
        private String chatId;

        @NotBlank
        private String apiBaseUrl = "https://api.telegram.org";

        public boolean isConfigured() {
            return hasText(botToken) && hasText(chatId);
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }
    }

    /**
     * WeChat Work group robot webhook.
     */
    public static class WeChat {
        private String webhookKey;

        @NotBlank
        private String apiBaseUrl = "https://qyapi.weixin.qq.com";

        public boolean isConfigured() {
            return hasText(webhookKey);
        }

        public String getWebhookKey() {
            return webhookKey;
        }

        public void setWebhookKey(String webhookKey) {
            this.webhookKey = webhookKey;
        }

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
