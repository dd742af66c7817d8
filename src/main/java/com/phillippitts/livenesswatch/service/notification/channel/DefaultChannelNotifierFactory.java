package com.phillippitts.livenesswatch.service.notification.channel;

import com.phillippitts.livenesswatch.config.properties.NotificationProperties;
import com.phillippitts.livenesswatch.domain.ChannelId;
import com.phillippitts.livenesswatch.service.notification.ChannelNotifier;
import com.phillippitts.livenesswatch.service.notification.ChannelNotifierFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds HTTP-backed notifiers from {@link NotificationProperties}, sharing one {@link RestClient}.
 */
@Component
public class DefaultChannelNotifierFactory implements ChannelNotifierFactory {
    private static final Logger LOG = LogManager.getLogger(DefaultChannelNotifierFactory.class);

    private final RestClient restClient;
    private final NotificationProperties props;

    public DefaultChannelNotifierFactory(@Qualifier("notificationRestClient") RestClient restClient,
                                         NotificationProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Optional<ChannelNotifier> create(ChannelId channel) {
        return switch (channel) {
            case TELEGRAM -> telegram();
            case WECHAT -> wechat();
        };
    }

    private Optional<ChannelNotifier> telegram() {
        NotificationProperties.Telegram telegram = props.getTelegram();
        if (!telegram.isConfigured()) {
            return Optional.empty();
        }
        LOG.info("Creating Telegram notifier for chat {}", telegram.getChatId());
        return Optional.of(new TelegramNotifier(restClient, telegram.getApiBaseUrl(),
                telegram.getBotToken(), telegram.getChatId()));
    }

    private Optional<ChannelNotifier> wechat() {
        NotificationProperties.WeChat wechat = props.getWechat();
        if (!wechat.isConfigured()) {
            return Optional.empty();
        }
        LOG.info("Creating WeChat Work notifier");
        return Optional.of(new WeChatWorkNotifier(restClient, wechat.getApiBaseUrl(), wechat.getWebhookKey()));
    }
}
