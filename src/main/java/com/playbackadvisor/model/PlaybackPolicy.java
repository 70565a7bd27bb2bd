package com.playbackadvisor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Advisory recommendation for one (client, media) pair. The host may ignore it.
 *
 * @param bitrateCap recommended ceiling in bits/sec, or null for no cap
 * @param confidence belief in this recommendation, in [0, 1]
 * @param rationale one line per rule finding and refinement step, in evaluation order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaybackPolicy(
    boolean allowDirectPlay,
    boolean allowDirectStream,
    boolean allowTranscoding,
    Long bitrateCap,
    double confidence,
    String rationale
) {

    public static final String PASS_THROUGH_RATIONALE = "Default pass-through, no policy influence.";

    private static final PlaybackPolicy PASS_THROUGH =
        new PlaybackPolicy(true, true, true, null, 0.0, PASS_THROUGH_RATIONALE);

    /**
     * The canonical neutral recommendation: everything allowed, no cap, zero confidence.
     */
    public static PlaybackPolicy passThrough() {
        return PASS_THROUGH;
    }

    @JsonProperty("is_default")
    public boolean isDefault() {
        return allowDirectPlay && allowDirectStream && allowTranscoding
            && bitrateCap == null && confidence == 0.0;
    }
}
