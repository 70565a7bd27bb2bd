package com.playbackadvisor.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.session.PlaybackSessionService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PlaybackSessionService sessionService;

    public PolicyController(PlaybackSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Dry evaluation: computes the policy a registered client would get, records nothing.
     */
    @PostMapping
    public PlaybackPolicy compute(@RequestBody PolicyRequest request) {
        if (request.deviceId() == null || request.deviceId().isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }
        if (request.media() == null) {
            throw new IllegalArgumentException("media is required");
        }
        return sessionService.advise(request.deviceId(), request.media())
            .orElseThrow(() -> new UnknownClientException(request.deviceId()));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PolicyRequest(String deviceId, MediaCharacteristics media) {
    }
}
