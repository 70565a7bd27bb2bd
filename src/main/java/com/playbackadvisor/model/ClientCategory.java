package com.playbackadvisor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Client platform families. Compatibility rules key their static tables on this value.
 */
public enum ClientCategory {
    UNKNOWN("unknown"),
    WEB_BROWSER("web_browser"),
    ANDROID_TV("android_tv"),
    ANDROID_MOBILE("android_mobile"),
    ROKU("roku"),
    FIRE_TV("fire_tv"),
    SWIFTFIN_IOS("swiftfin_ios"),
    SWIFTFIN_TVOS("swiftfin_tvos"),
    DESKTOP("desktop"),
    XBOX("xbox"),
    KODI("kodi"),
    DLNA("dlna");

    private final String value;

    ClientCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ClientCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown client category: " + raw));
    }
}
