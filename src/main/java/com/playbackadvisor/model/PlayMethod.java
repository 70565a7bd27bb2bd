package com.playbackadvisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Delivery method the host actually used for a playback session.
 */
public enum PlayMethod {
    DIRECT_PLAY("DirectPlay"),
    DIRECT_STREAM("DirectStream"),
    TRANSCODE("Transcode"),
    UNKNOWN("Unknown");

    private final String value;

    PlayMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse: host play-method strings vary in case and separators, anything
     * unrecognised is UNKNOWN rather than an error.
     */
    @JsonCreator
    public static PlayMethod fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.replace("_", "").replace("-", "").trim();
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
