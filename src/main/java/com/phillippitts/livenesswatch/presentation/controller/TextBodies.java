package com.phillippitts.livenesswatch.presentation.controller;

import org.json.JSONException;
import org.json.JSONObject;

final class TextBodies {

    private TextBodies() {
    }

    /** The text as a JSON object, or null when it is not one. */
    static JSONObject parseObject(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return new JSONObject(trimmed);
        } catch (JSONException e) {
            return null;
        }
    }
}
