package com.playbackadvisor.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.playbackadvisor.client.ClientRegistry.ClientRegistration;
import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.session.PlaybackSessionService;
import com.playbackadvisor.session.PlaybackStart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/playback")
public class PlaybackController {

    private final PlaybackSessionService sessionService;

    public PlaybackController(PlaybackSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping("/start")
    public PlaybackPolicy start(@RequestBody StartRequest request) {
        requireText(request.deviceId(), "device_id");
        requireText(request.playSessionId(), "play_session_id");

        return sessionService.onPlaybackStart(new PlaybackStart(
            new ClientRegistration(
                request.deviceId(),
                request.deviceName(),
                request.clientName(),
                request.clientVersion(),
                request.category(),
                null,
                null,
                null),
            request.media(),
            request.playSessionId(),
            request.playMethod(),
            request.transcodeReasons()
        ));
    }

    @PostMapping("/stop")
    public Map<String, Object> stop(@RequestBody StopRequest request) {
        requireText(request.playSessionId(), "play_session_id");

        Optional<PlaybackOutcome> outcome = sessionService.onPlaybackStop(
            request.playSessionId(), request.playedTicks(), request.totalTicks());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("play_session_id", request.playSessionId());
        if (outcome.isPresent()) {
            body.put("status", "recorded");
            body.put("outcome", outcome.get());
        } else {
            body.put("status", "unmatched");
        }
        return body;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StartRequest(
        String deviceId,
        String deviceName,
        String clientName,
        String clientVersion,
        ClientCategory category,
        String playSessionId,
        PlayMethod playMethod,
        String transcodeReasons,
        MediaCharacteristics media
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StopRequest(String playSessionId, Long playedTicks, Long totalTicks) {
    }
}
