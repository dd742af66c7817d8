package com.phillippitts.livenesswatch.testutil;

import com.phillippitts.livenesswatch.service.notification.AlertSender;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Alert sender that records every message and answers with a fixed outcome.
 */
public class RecordingAlertSender implements AlertSender {

    private final List<String> messages = new CopyOnWriteArrayList<>();
    private volatile boolean result;

    public RecordingAlertSender(boolean result) {
        this.result = result;
    }

    @Override
    public boolean send(String message) {
        messages.add(message);
        return result;
    }

    public void setResult(boolean result) {
        this.result = result;
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }

    public String last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
