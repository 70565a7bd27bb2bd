package com.playbackadvisor.model;

import java.util.Locale;
import java.util.Set;

/**
 * Codec and container vocabulary shared by the rules and the cost estimator.
 * All names are compared in lowercase.
 */
public final class MediaFormats {

    public static final Set<String> H264 = Set.of("h264", "avc");
    public static final Set<String> HEVC = Set.of("hevc", "h265");

    /** Containers every mainstream client opens without repackaging. */
    public static final Set<String> UNIVERSAL_CONTAINERS = Set.of("mp4", "m4v", "mov");

    public static final Set<String> LEGACY_CONTAINERS = Set.of("avi", "wmv", "flv");

    public static final Set<String> LOSSLESS_AUDIO = Set.of("truehd", "dts-hd ma", "dts-hd hra");

    private MediaFormats() {
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean isH264(String codec) {
        return H264.contains(normalize(codec));
    }

    public static boolean isHevc(String codec) {
        return HEVC.contains(normalize(codec));
    }

    /** True for any dynamic range other than SDR; absent range counts as SDR. */
    public static boolean isHdr(String rangeType) {
        return !isBlank(rangeType) && !"sdr".equals(normalize(rangeType));
    }

    public static boolean isDolbyVision(String rangeType) {
        String range = normalize(rangeType);
        return range.contains("dovi") || range.contains("dolbyvision") || range.contains("dolby vision");
    }
}
