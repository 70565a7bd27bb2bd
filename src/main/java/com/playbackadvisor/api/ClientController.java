package com.playbackadvisor.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.playbackadvisor.client.ClientRegistry;
import com.playbackadvisor.client.ClientRegistry.ClientRegistration;
import com.playbackadvisor.learning.LearningService;
import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/clients")
public class ClientController {

    private final ClientRegistry clientRegistry;
    private final LearningService learningService;

    public ClientController(ClientRegistry clientRegistry, LearningService learningService) {
        this.clientRegistry = clientRegistry;
        this.learningService = learningService;
    }

    @PutMapping("/{deviceId}")
    public ClientProfile register(@PathVariable String deviceId, @RequestBody ClientRequest request) {
        return clientRegistry.register(new ClientRegistration(
            deviceId,
            request.deviceName(),
            request.clientName(),
            request.clientVersion(),
            request.category(),
            request.maxBitrate(),
            request.codecConfidence(),
            request.containerConfidence()
        ));
    }

    @GetMapping
    public List<ClientProfile> list() {
        return clientRegistry.findAll();
    }

    @GetMapping("/{deviceId}")
    public ClientProfile get(@PathVariable String deviceId) {
        return clientRegistry.find(deviceId).orElseThrow(() -> new UnknownClientException(deviceId));
    }

    @PostMapping("/{deviceId}/recalibrate")
    public ClientProfile recalibrate(@PathVariable String deviceId) {
        ClientProfile client = get(deviceId);
        learningService.recalibrateClient(client);
        return client;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ClientRequest(
        String deviceName,
        String clientName,
        String clientVersion,
        ClientCategory category,
        Long maxBitrate,
        Map<String, Double> codecConfidence,
        Map<String, Double> containerConfidence
    ) {
    }
}
