package com.playbackadvisor.dashboard;

import com.playbackadvisor.config.AdvisorProperties;
import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackResult;
import com.playbackadvisor.store.ClientProfileStore;
import com.playbackadvisor.store.OutcomeStore;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class DashboardService {

    private static final Duration SUMMARY_WINDOW = Duration.ofDays(7);

    private final ClientProfileStore clientStore;
    private final OutcomeStore outcomeStore;
    private final AdvisorProperties properties;

    public DashboardService(ClientProfileStore clientStore, OutcomeStore outcomeStore, AdvisorProperties properties) {
        this.clientStore = clientStore;
        this.outcomeStore = outcomeStore;
        this.properties = properties;
    }

    /**
     * @param hours look-back window, at least one hour
     */
    public List<PlaybackOutcome> recentOutcomes(int hours) {
        return outcomeStore.findSince(Instant.now().minus(Duration.ofHours(Math.max(hours, 1))));
    }

    public DashboardSummary summary() {
        List<PlaybackOutcome> recent = outcomeStore.findSince(Instant.now().minus(SUMMARY_WINDOW));

        int total = recent.size();
        long directPlay = countMethod(recent, PlayMethod.DIRECT_PLAY);
        long directStream = countMethod(recent, PlayMethod.DIRECT_STREAM);
        long transcode = countMethod(recent, PlayMethod.TRANSCODE);
        long failures = recent.stream()
            .filter(o -> o.getResult() == PlaybackResult.FAILURE || o.getResult() == PlaybackResult.SUSPECTED_FAILURE)
            .count();
        double directPlayRate = total > 0 ? Math.round(1000.0 * directPlay / total) / 10.0 : 0.0;

        return new DashboardSummary(DashboardSummary.Config.of(properties), new DashboardSummary.Stats(
            clientStore.findAll().size(), total, directPlay, directStream, transcode, failures, directPlayRate));
    }

    private static long countMethod(List<PlaybackOutcome> outcomes, PlayMethod method) {
        return outcomes.stream().filter(o -> o.getPlayMethod() == method).count();
    }
}
