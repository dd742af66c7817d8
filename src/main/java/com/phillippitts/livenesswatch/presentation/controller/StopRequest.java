package com.phillippitts.livenesswatch.presentation.controller;

import jakarta.validation.constraints.Size;
import org.json.JSONObject;

/** Body of a stop trigger. */
record StopRequest(
        @Size(max = 4000, message = "info must be at most 4000 characters") String info
) {
    static final StopRequest EMPTY = new StopRequest("");

    /** Plain-text trigger: a JSON object supplies {@code info}, any other text is the info itself. */
    static StopRequest fromText(String text) {
        if (text == null) {
            return EMPTY;
        }
        JSONObject json = TextBodies.parseObject(text);
        return json == null ? new StopRequest(text) : new StopRequest(json.optString("info", ""));
    }
}
