package com.phillippitts.livenesswatch.presentation.controller;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Body of a feed trigger. Both fields are optional; an absent {@code timeoutMs} keeps the
 * current threshold (or arms with the default one).
 */
record FeedRequest(
        @PositiveOrZero(message = "timeoutMs must not be negative") Long timeoutMs,
        @Size(max = 4000, message = "info must be at most 4000 characters") String info
) {
    static final FeedRequest EMPTY = new FeedRequest(null, "");

    /**
     * Reads a plain-text trigger. A JSON object is read like a JSON body ({@code timeout_ms} is
     * accepted as an alias); any other text is the {@code info} string.
     *
     * @throws IllegalArgumentException if the object carries a non-numeric timeout
     */
    static FeedRequest fromText(String text) {
        if (text == null) {
            return EMPTY;
        }
        JSONObject json = TextBodies.parseObject(text);
        if (json == null) {
            return new FeedRequest(null, text);
        }
        String key = json.has("timeoutMs") ? "timeoutMs" : "timeout_ms";
        Long timeoutMs = null;
        if (json.has(key) && !json.isNull(key)) {
            try {
                timeoutMs = json.getLong(key);
            } catch (JSONException e) {
                throw new IllegalArgumentException("timeoutMs must be a number", e);
            }
        }
        return new FeedRequest(timeoutMs, json.optString("info", ""));
    }
}
