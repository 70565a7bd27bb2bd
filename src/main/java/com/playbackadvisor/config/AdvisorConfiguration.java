package com.playbackadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playbackadvisor.client.ClientRegistry;
import com.playbackadvisor.cost.TranscodeCostEstimator;
import com.playbackadvisor.decision.DecisionEngine;
import com.playbackadvisor.learning.LearningService;
import com.playbackadvisor.media.MediaCatalog;
import com.playbackadvisor.rules.AudioPassthroughRule;
import com.playbackadvisor.rules.BitDepthCompatibilityRule;
import com.playbackadvisor.rules.BitrateCapRule;
import com.playbackadvisor.rules.ContainerCodecCompatibilityRule;
import com.playbackadvisor.rules.HdrCompatibilityRule;
import com.playbackadvisor.rules.PlaybackRule;
import com.playbackadvisor.session.PlaybackSessionService;
import com.playbackadvisor.store.ClientProfileStore;
import com.playbackadvisor.store.OutcomeStore;
import com.playbackadvisor.telemetry.TelemetryService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.List;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(AdvisorProperties.class)
public class AdvisorConfiguration {

    /**
     * Registration order matters: among findings of equal severity the later one wins.
     */
    static List<PlaybackRule> defaultRules() {
        return List.of(
            new ContainerCodecCompatibilityRule(),
            new BitDepthCompatibilityRule(),
            new AudioPassthroughRule(),
            new HdrCompatibilityRule(),
            new BitrateCapRule()
        );
    }

    @Bean
    public TranscodeCostEstimator transcodeCostEstimator() {
        return new TranscodeCostEstimator();
    }

    @Bean
    public DecisionEngine decisionEngine(TranscodeCostEstimator transcodeCostEstimator,
                                         AdvisorProperties properties) {
        return new DecisionEngine(defaultRules(), transcodeCostEstimator, properties);
    }

    @Bean
    public LearningService learningService(ClientProfileStore clientStore,
                                           OutcomeStore outcomeStore,
                                           AdvisorProperties properties) {
        return new LearningService(clientStore, outcomeStore, properties);
    }

    @Bean
    public MediaCatalog mediaCatalog(TranscodeCostEstimator transcodeCostEstimator) {
        return new MediaCatalog(transcodeCostEstimator);
    }

    @Bean
    public ClientRegistry clientRegistry(ClientProfileStore clientStore) {
        return new ClientRegistry(clientStore);
    }

    @Bean
    public TelemetryService telemetryService(OutcomeStore outcomeStore,
                                             ObjectMapper objectMapper,
                                             AdvisorProperties properties) {
        return new TelemetryService(outcomeStore, objectMapper, properties);
    }

    @Bean
    public PlaybackSessionService playbackSessionService(ClientRegistry clientRegistry,
                                                         MediaCatalog mediaCatalog,
                                                         DecisionEngine decisionEngine,
                                                         TelemetryService telemetryService,
                                                         LearningService learningService) {
        return new PlaybackSessionService(clientRegistry, mediaCatalog, decisionEngine,
            telemetryService, learningService);
    }
}
