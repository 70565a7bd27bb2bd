package com.playbackadvisor.model;

/**
 * Heuristic tier for how expensive transcoding a media source would be.
 * Declaration order is significant: tiers compare by ordinal.
 */
public enum TranscodeCost {
    /** Not estimated yet. */
    UNKNOWN,
    /** Container repackaging only. */
    REMUX,
    LOW,
    MEDIUM,
    /** 4K, HDR tone-mapping or subtitle burn-in. */
    HIGH,
    EXTREME;

    public boolean isAtMost(TranscodeCost other) {
        return compareTo(other) <= 0;
    }
}
