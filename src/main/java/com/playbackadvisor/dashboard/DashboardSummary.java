package com.playbackadvisor.dashboard;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.playbackadvisor.config.AdvisorProperties;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardSummary(
    Config config,
    Stats stats
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Config(
        boolean conservativeMode,
        boolean enableDynamicPolicies,
        boolean enableLearning,
        Long globalMaxBitrateOverride,
        int outcomeRetentionDays
    ) {

        static Config of(AdvisorProperties properties) {
            return new Config(
                properties.conservativeMode(),
                properties.enableDynamicPolicies(),
                properties.enableLearning(),
                properties.globalMaxBitrateOverride(),
                properties.outcomeRetentionDays());
        }
    }

    /**
     * Session counts over the last seven days.
     *
     * @param directPlayRate percentage of sessions that direct played, one decimal
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Stats(
        int totalClients,
        int totalSessions7d,
        long directPlayCount,
        long directStreamCount,
        long transcodeCount,
        long failureCount,
        double directPlayRate
    ) {
    }
}
