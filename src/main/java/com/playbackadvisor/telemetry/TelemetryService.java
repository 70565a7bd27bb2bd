package com.playbackadvisor.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playbackadvisor.config.AdvisorProperties;
import com.playbackadvisor.learning.OutcomeClassifier;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.model.PlaybackResult;
import com.playbackadvisor.store.OutcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records one outcome per playback session: opened at start with the active policy,
 * finalized at stop with the played/total ticks.
 */
public class TelemetryService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryService.class);

    private final OutcomeStore outcomeStore;
    private final ObjectMapper objectMapper;
    private final AdvisorProperties properties;

    public TelemetryService(OutcomeStore outcomeStore, ObjectMapper objectMapper, AdvisorProperties properties) {
        this.outcomeStore = outcomeStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public PlaybackOutcome recordPlaybackStart(ClientProfile client,
                                               MediaCharacteristics media,
                                               PlaybackPolicy policy,
                                               String playSessionId,
                                               PlayMethod playMethod,
                                               String transcodeReasons) {
        PlaybackOutcome outcome = new PlaybackOutcome();
        outcome.setDeviceId(client.getDeviceId());
        outcome.setClientName(client.getClientName());
        outcome.setItemId(media.getItemId());
        outcome.setPlaySessionId(playSessionId);
        outcome.setVideoCodec(media.getVideoCodec());
        outcome.setAudioCodec(media.getAudioCodec());
        outcome.setContainer(media.getContainer());
        outcome.setPlayMethod(playMethod);
        outcome.setTranscodeReasons(transcodeReasons == null ? "" : transcodeReasons);
        outcome.setResult(playMethod == PlayMethod.TRANSCODE ? PlaybackResult.TRANSCODED : PlaybackResult.UNKNOWN);
        outcome.setPolicySnapshot(snapshot(policy));
        outcome.setTimestamp(Instant.now());

        outcomeStore.record(outcome);

        log.info("Playback started: client={} device={} {}/{} in {} -> {}{}",
            client.getClientName(), client.getDeviceId(),
            media.getVideoCodec(), media.getAudioCodec(), media.getContainer(),
            outcome.getPlayMethod().getValue(),
            outcome.getTranscodeReasons().isEmpty() ? "" : " (reasons: " + outcome.getTranscodeReasons() + ")");
        return outcome;
    }

    /**
     * @return the finalized outcome, or empty when no start was recorded for the session
     */
    public Optional<PlaybackOutcome> recordPlaybackStop(String playSessionId, Long playedTicks, Long totalTicks) {
        Optional<PlaybackOutcome> found = outcomeStore.findBySession(playSessionId);
        if (found.isEmpty()) {
            log.debug("No start record for play session {}", playSessionId);
            return Optional.empty();
        }

        PlaybackOutcome outcome = found.get();
        outcome.setPlayedTicks(playedTicks);
        outcome.setTotalTicks(totalTicks);
        outcome.setResult(OutcomeClassifier.resolveAtStop(outcome));
        outcomeStore.record(outcome);

        log.info("Playback stopped: session={} result={} played={}/{}",
            playSessionId, outcome.getResult(), playedTicks, totalTicks);
        return Optional.of(outcome);
    }

    /**
     * @return number of outcomes deleted
     */
    public int pruneOldData() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(properties.outcomeRetentionDays()));
        int removed = outcomeStore.prune(cutoff);
        log.info("Pruned {} outcomes older than {} days", removed, properties.outcomeRetentionDays());
        return removed;
    }

    public List<PlaybackOutcome> outcomesSince(Instant since) {
        return outcomeStore.findSince(since);
    }

    private String snapshot(PlaybackPolicy policy) {
        if (policy == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(policy);
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize policy snapshot: {}", ex.getMessage());
            return "";
        }
    }
}
