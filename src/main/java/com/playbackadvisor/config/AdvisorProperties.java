package com.playbackadvisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Deployment switches consumed by the decision engine, the learning service and telemetry.
 *
 * @param enableDynamicPolicies    false means observe-only: policies are computed but the host is not shaped
 * @param enableLearning           whether playback outcomes update client confidence
 * @param conservativeMode         defer to host defaults; only short-circuits together with observe-only
 * @param globalMaxBitrateOverride bits/sec ceiling applied to every client, or null
 * @param outcomeRetentionDays     outcomes older than this are pruned; at least 1
 */
@ConfigurationProperties(prefix = "advisor")
public record AdvisorProperties(
    @DefaultValue("false") boolean enableDynamicPolicies,
    @DefaultValue("false") boolean enableLearning,
    @DefaultValue("true") boolean conservativeMode,
    Long globalMaxBitrateOverride,
    @DefaultValue("90") int outcomeRetentionDays
) {

    public AdvisorProperties {
        if (outcomeRetentionDays < 1) {
            throw new IllegalArgumentException(
                "advisor.outcome-retention-days must be at least 1, was " + outcomeRetentionDays);
        }
    }

    public static AdvisorProperties defaults() {
        return new AdvisorProperties(false, false, true, null, 90);
    }

    /** Observe-only and conservative: the engine returns the pass-through policy without computing. */
    public boolean isObserveOnlyConservative() {
        return conservativeMode && !enableDynamicPolicies;
    }
}
