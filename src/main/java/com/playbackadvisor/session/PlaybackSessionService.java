package com.playbackadvisor.session;

import com.playbackadvisor.client.ClientRegistry;
import com.playbackadvisor.decision.DecisionEngine;
import com.playbackadvisor.learning.LearningService;
import com.playbackadvisor.media.MediaCatalog;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.telemetry.TelemetryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Wires host playback events to the decision engine, telemetry and learning.
 *
 * <p>Nothing here may block playback: faults are logged and the start path falls back to
 * {@link PlaybackPolicy#passThrough()}.
 */
public class PlaybackSessionService {

    private static final Logger log = LoggerFactory.getLogger(PlaybackSessionService.class);

    private final ClientRegistry clientRegistry;
    private final MediaCatalog mediaCatalog;
    private final DecisionEngine decisionEngine;
    private final TelemetryService telemetryService;
    private final LearningService learningService;

    public PlaybackSessionService(ClientRegistry clientRegistry,
                                  MediaCatalog mediaCatalog,
                                  DecisionEngine decisionEngine,
                                  TelemetryService telemetryService,
                                  LearningService learningService) {
        this.clientRegistry = clientRegistry;
        this.mediaCatalog = mediaCatalog;
        this.decisionEngine = decisionEngine;
        this.telemetryService = telemetryService;
        this.learningService = learningService;
    }

    /**
     * Compute the policy for a starting session and open its outcome record.
     */
    public PlaybackPolicy onPlaybackStart(PlaybackStart start) {
        try {
            ClientProfile client = clientRegistry.register(start.client());
            MediaCharacteristics media = start.media() == null
                ? new MediaCharacteristics()
                : mediaCatalog.resolve(start.media());
            PlaybackPolicy policy = decisionEngine.computePolicy(client, media);

            PlayMethod playMethod = start.playMethod() == null ? PlayMethod.UNKNOWN : start.playMethod();
            telemetryService.recordPlaybackStart(client, media, policy,
                start.playSessionId(), playMethod, start.transcodeReasons());
            return policy;
        } catch (RuntimeException ex) {
            log.error("Playback start handling failed for session={}, returning pass-through",
                start.playSessionId(), ex);
            return PlaybackPolicy.passThrough();
        }
    }

    /**
     * Finalize the session's outcome and feed it to learning.
     *
     * @return the finalized outcome, or empty when the session is unknown or handling failed
     */
    public Optional<PlaybackOutcome> onPlaybackStop(String playSessionId, Long playedTicks, Long totalTicks) {
        if (playSessionId == null || playSessionId.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<PlaybackOutcome> outcome = telemetryService.recordPlaybackStop(playSessionId, playedTicks, totalTicks);
            outcome.ifPresent(o -> clientRegistry.find(o.getDeviceId())
                .ifPresentOrElse(
                    client -> learningService.processOutcome(o, client),
                    () -> log.warn("Outcome for session={} references unknown device={}", playSessionId, o.getDeviceId())));
            return outcome;
        } catch (RuntimeException ex) {
            log.error("Playback stop handling failed for session={}", playSessionId, ex);
            return Optional.empty();
        }
    }

    /**
     * Compute a policy for a registered client without recording a session.
     */
    public Optional<PlaybackPolicy> advise(String deviceId, MediaCharacteristics media) {
        return clientRegistry.find(deviceId)
            .map(client -> decisionEngine.computePolicy(client, mediaCatalog.resolve(media)));
    }
}
