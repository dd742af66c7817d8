package com.phillippitts.livenesswatch.service.notification;

import com.phillippitts.livenesswatch.config.properties.NotificationProperties;
import com.phillippitts.livenesswatch.domain.ChannelId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NotificationSettings} backed by {@link NotificationProperties}.
 *
 * <p>Reads the properties on every call so a refreshed binding is picked up by the next alert.
 */
@Component
public class PropertiesNotificationSettings implements NotificationSettings {

    private final NotificationProperties props;

    public PropertiesNotificationSettings(NotificationProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Optional<ChannelId> defaultChannel() {
        return Optional.ofNullable(props.getDefaultChannel());
    }

    @Override
    public List<ChannelId> enabledChannels() {
        List<ChannelId> enabled = new ArrayList<>();
        List<ChannelId> order = props.getChannels() == null ? List.of() : props.getChannels();
        for (ChannelId channel : order) {
            if (channel != null && !enabled.contains(channel) && isConfigured(channel)) {
                enabled.add(channel);
            }
        }
        return List.copyOf(enabled);
    }

    private boolean isConfigured(ChannelId channel) {
        return switch (channel) {
            case TELEGRAM -> props.getTelegram().isConfigured();
            case WECHAT -> props.getWechat().isConfigured();
        };
    }
}
