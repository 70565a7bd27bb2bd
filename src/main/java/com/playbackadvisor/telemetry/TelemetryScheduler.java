package com.playbackadvisor.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily retention sweep over recorded playback outcomes.
 */
@Component
public class TelemetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(TelemetryScheduler.class);

    private final TelemetryService telemetryService;

    public TelemetryScheduler(TelemetryService telemetryService) {
        this.telemetryService = telemetryService;
    }

    @Scheduled(cron = "${advisor.prune-cron:0 30 3 * * *}")
    public void pruneOutcomes() {
        try {
            telemetryService.pruneOldData();
        } catch (RuntimeException ex) {
            log.error("Outcome pruning failed", ex);
        }
    }
}
