package com.phillippitts.livenesswatch.testutil;

import com.phillippitts.livenesswatch.domain.ChannelId;
import com.phillippitts.livenesswatch.service.notification.ChannelNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel notifier double: records each message, then succeeds, fails or throws.
 */
public class RecordingNotifier implements ChannelNotifier {

    public enum Behavior { SUCCEED, FAIL, THROW }

    private final ChannelId channel;
    private final Behavior behavior;
    private final List<String> messages = new CopyOnWriteArrayList<>();

    public RecordingNotifier(ChannelId channel, Behavior behavior) {
        this.channel = channel;
        this.behavior = behavior;
    }

    @Override
    public boolean sendMessage(String text) {
        messages.add(text);
        return switch (behavior) {
            case SUCCEED -> true;
            case FAIL -> false;
            case THROW -> throw new IllegalStateException(channel.id() + " backend unreachable");
        };
    }

    @Override
    public ChannelId channel() {
        return channel;
    }

    public int attempts() {
        return messages.size();
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }
}
