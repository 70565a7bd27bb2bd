package com.playbackadvisor.decision;

import com.playbackadvisor.config.AdvisorProperties;
import com.playbackadvisor.cost.TranscodeCostEstimator;
import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.model.TranscodeCost;
import com.playbackadvisor.rules.AudioPassthroughRule;
import com.playbackadvisor.rules.BitDepthCompatibilityRule;
import com.playbackadvisor.rules.BitrateCapRule;
import com.playbackadvisor.rules.ContainerCodecCompatibilityRule;
import com.playbackadvisor.rules.HdrCompatibilityRule;
import com.playbackadvisor.rules.Opinion;
import com.playbackadvisor.rules.PlaybackRule;
import com.playbackadvisor.rules.RuleFinding;
import com.playbackadvisor.rules.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final AdvisorProperties ACTIVE = new AdvisorProperties(true, false, false, null, 90);

    private final DecisionEngine engine = new DecisionEngine(defaultRules(), new TranscodeCostEstimator(), ACTIVE);

    @Nested
    @DisplayName("Pass-through paths")
    class PassThrough {

        @Test
        void conservativeObserveOnly_returnsExactDefaultForAnyInput() {
            DecisionEngine conservative = new DecisionEngine(defaultRules(), new TranscodeCostEstimator(),
                AdvisorProperties.defaults());
            ClientProfile client = client(ClientCategory.WEB_BROWSER);
            client.putCodecConfidence("hevc", 0.1);

            PlaybackPolicy policy = conservative.computePolicy(client, media("hevc", "mkv"));

            assertSame(PlaybackPolicy.passThrough(), policy);
            assertTrue(policy.isDefault());
            assertEquals(0.0, policy.confidence());
            assertNull(policy.bitrateCap());
        }

        @Test
        void conservativeWithDynamicPolicies_stillComputes() {
            AdvisorProperties props = new AdvisorProperties(true, false, true, null, 90);
            PlaybackPolicy policy = engine.computePolicy(client(ClientCategory.WEB_BROWSER), media("hevc", "mkv"), props);
            assertFalse(policy.isDefault());
            assertFalse(policy.allowDirectPlay());
        }

        @Test
        void nullInputs_returnDefault() {
            assertTrue(engine.computePolicy(null, media("h264", "mp4")).isDefault());
            assertTrue(engine.computePolicy(client(ClientCategory.DESKTOP), null).isDefault());
        }

        @Test
        void finalConfidenceBelowThreshold_defersToHost() {
            ClientProfile client = client(ClientCategory.ANDROID_TV);
            client.putCodecConfidence("hevc", 0.2);
            client.putCodecConfidence("eac3", 0.2);
            MediaCharacteristics media = media("hevc", "mkv");
            media.setAudioCodec("eac3");

            // 0.5 - 0.1 (video) - 0.05 (audio) = 0.35
            assertSame(PlaybackPolicy.passThrough(), engine.computePolicy(client, media));
        }
    }

    @Nested
    @DisplayName("Confidence refinement")
    class Confidence {

        @Test
        void highCodecConfidence_allowsDirectPlay() {
            ClientProfile client = client(ClientCategory.DESKTOP);
            client.putCodecConfidence("h264", 0.9);

            PlaybackPolicy policy = engine.computePolicy(client, media("h264", "mp4"));

            assertTrue(policy.allowDirectPlay());
            assertEquals(0.7, policy.confidence(), 1e-9);
            assertTrue(policy.rationale().contains("favoring direct play"));
        }

        @Test
        void highCodecConfidence_cannotOverrideRequiredDenial() {
            ClientProfile client = client(ClientCategory.WEB_BROWSER);
            client.putCodecConfidence("h264", 0.9);

            PlaybackPolicy policy = engine.computePolicy(client, media("h264", "mkv"));

            assertFalse(policy.allowDirectPlay());
            assertTrue(policy.allowDirectStream());
            assertEquals(0.85, policy.confidence(), 1e-9);
            assertTrue(policy.rationale().contains("[Rule:web-container-unsupported]"));
        }

        @Test
        void highCodecConfidence_overridesRecommendedDenial() {
            ClientProfile client = client(ClientCategory.WEB_BROWSER);
            client.putCodecConfidence("hevc", 0.9);

            PlaybackPolicy policy = engine.computePolicy(client, media("hevc", "mp4"));

            assertTrue(policy.allowDirectPlay());
            assertEquals(0.8, policy.confidence(), 1e-9);
        }

        @Test
        void lowCodecConfidence_forcesTranscode() {
            ClientProfile client = client(ClientCategory.ANDROID_TV);
            client.putCodecConfidence("hevc", 0.2);

            PlaybackPolicy policy = engine.computePolicy(client, media("hevc", "mkv"));

            assertFalse(policy.allowDirectPlay());
            assertTrue(policy.allowTranscoding());
            assertEquals(0.4, policy.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Web client, HEVC at 0.2 in MKV: no direct play, transcode allowed")
        void webHevcMkvLowConfidence() {
            ClientProfile client = client(ClientCategory.WEB_BROWSER);
            client.putCodecConfidence("hevc", 0.2);

            PlaybackPolicy policy = engine.computePolicy(client, media("hevc", "mkv"));

            assertFalse(policy.allowDirectPlay());
            assertTrue(policy.allowTranscoding());
            assertEquals(0.55, policy.confidence(), 1e-9);
        }

        @Test
        void missingConfidence_defers() {
            PlaybackPolicy policy = engine.computePolicy(client(ClientCategory.DESKTOP), media("vp9", "webm"));

            assertTrue(policy.allowDirectPlay());
            assertEquals(0.5, policy.confidence(), 1e-9);
            assertTrue(policy.rationale().contains("Video codec 'vp9': no confidence data, deferring."));
        }

        @Test
        void lowContainerConfidence_prefersRemux() {
            ClientProfile client = client(ClientCategory.DESKTOP);
            client.putContainerConfidence("mkv", 0.1);

            PlaybackPolicy policy = engine.computePolicy(client, media("h264", "mkv"));

            assertFalse(policy.allowDirectPlay());
            assertTrue(policy.allowDirectStream());
        }

        @Test
        void cheapAudioOnlyTranscode_prefersDirectStream() {
            ClientProfile client = client(ClientCategory.DESKTOP);
            client.putCodecConfidence("h264", 0.9);
            client.putCodecConfidence("dts", 0.2);
            MediaCharacteristics media = media("h264", "mkv");
            media.setAudioCodec("dts");

            PlaybackPolicy policy = engine.computePolicy(client, media);

            assertTrue(policy.allowDirectPlay());
            assertTrue(policy.allowDirectStream());
            assertTrue(policy.allowTranscoding());
            assertEquals(0.65, policy.confidence(), 1e-9);
            assertTrue(policy.rationale().contains("Audio-only transcode is cheap"));
            assertTrue(policy.rationale().contains("REMUX"));
        }
    }

    @Nested
    @DisplayName("Bitrate caps")
    class Bitrate {

        @Test
        void clientCeilingBelowRuleCap_winsAsMinimum() {
            ClientProfile client = client(ClientCategory.ANDROID_MOBILE);
            client.setMaxBitrate(4_000_000L);
            MediaCharacteristics media = media("h264", "mp4");
            media.setBitrate(25_000_000L);

            PlaybackPolicy policy = engine.computePolicy(client, media);

            assertEquals(4_000_000L, policy.bitrateCap());
            assertTrue(policy.allowTranscoding());
        }

        @Test
        void ruleCapBelowGlobalOverride_isKept() {
            AdvisorProperties props = new AdvisorProperties(true, false, false, 12_000_000L, 90);
            ClientProfile client = client(ClientCategory.ANDROID_MOBILE);
            client.setMaxBitrate(2_000_000L);
            MediaCharacteristics media = media("h264", "mp4");
            media.setBitrate(25_000_000L);

            PlaybackPolicy policy = engine.computePolicy(client, media, props);

            // global override replaces the client ceiling, the rule cap of 8 Mbps is lower
            assertEquals(8_000_000L, policy.bitrateCap());
        }

        @Test
        void bitrateUnderCeiling_noCap() {
            ClientProfile client = client(ClientCategory.DESKTOP);
            client.setMaxBitrate(40_000_000L);
            MediaCharacteristics media = media("h264", "mp4");
            media.setBitrate(10_000_000L);

            assertNull(engine.computePolicy(client, media).bitrateCap());
        }
    }

    @Nested
    @DisplayName("Fault isolation")
    class Faults {

        @Test
        void throwingRule_isSkipped() {
            DecisionEngine withBrokenRule = new DecisionEngine(
                List.of(new ThrowingRule(), new BitrateCapRule()), new TranscodeCostEstimator(), ACTIVE);
            MediaCharacteristics media = media("h264", "mp4");
            media.setBitrate(30_000_000L);

            PlaybackPolicy policy = withBrokenRule.computePolicy(client(ClientCategory.ROKU), media);

            assertEquals(20_000_000L, policy.bitrateCap());
        }

        @Test
        @DisplayName("null configuration falls back to the engine's own")
        void nullProperties_useEngineDefaults() {
            ClientProfile client = client(ClientCategory.WEB_BROWSER);
            MediaCharacteristics media = media("hevc", "mkv");

            PlaybackPolicy policy = assertDoesNotThrow(() -> engine.computePolicy(client, media, null));

            assertEquals(engine.computePolicy(client, media), policy);
            assertFalse(policy.isDefault());

            DecisionEngine conservative = new DecisionEngine(defaultRules(), new TranscodeCostEstimator(),
                AdvisorProperties.defaults());
            assertSame(PlaybackPolicy.passThrough(), conservative.computePolicy(client, media, null));
        }

        @Test
        void emptyMediaAndUnknownClient_neverThrow() {
            PlaybackPolicy policy = assertDoesNotThrow(
                () -> engine.computePolicy(new ClientProfile(), new MediaCharacteristics()));
            assertTrue(policy.confidence() >= 0.0 && policy.confidence() <= 1.0);
            assertTrue(policy.rationale().contains("No video codec info available"));
        }

        @Test
        void engineDoesNotWriteCostEstimateOrConfidence() {
            ClientProfile client = client(ClientCategory.DESKTOP);
            client.putCodecConfidence("hevc", 0.9);
            MediaCharacteristics media = media("hevc", "mkv");

            engine.computePolicy(client, media);

            assertEquals(TranscodeCost.UNKNOWN, media.getTranscodeCostEstimate());
            assertEquals(0.9, client.codecConfidence("hevc").getAsDouble());
        }
    }

    @Test
    void extremeCostWithDirectPlayDenied_warns() {
        MediaCharacteristics media = media("hevc", "mkv");
        media.setWidth(3840);
        media.setHeight(2160);
        media.setVideoRangeType("HDR10");
        media.setBitDepth(10);

        PlaybackPolicy policy = engine.computePolicy(client(ClientCategory.WEB_BROWSER), media);

        assertFalse(policy.allowDirectPlay());
        assertTrue(policy.allowTranscoding());
        assertTrue(policy.rationale().contains("Transcode cost: EXTREME"));
        assertTrue(policy.rationale().contains("WARNING"));
        assertEquals(0.8, policy.confidence(), 1e-9);
    }

    @Test
    void equalSeverity_laterRuleWins() {
        RuleFinding deny = new RuleFinding("deny", Opinion.DENY, null, null, null, Severity.SUGGEST, "");
        RuleFinding allow = new RuleFinding("allow", Opinion.ALLOW, null, null, null, Severity.SUGGEST, "");

        DecisionEngine denyLast = new DecisionEngine(
            List.of(new FixedRule(allow), new FixedRule(deny)), new TranscodeCostEstimator(), ACTIVE);
        DecisionEngine allowLast = new DecisionEngine(
            List.of(new FixedRule(deny), new FixedRule(allow)), new TranscodeCostEstimator(), ACTIVE);

        assertFalse(denyLast.computePolicy(client(ClientCategory.DESKTOP), new MediaCharacteristics()).allowDirectPlay());
        assertTrue(allowLast.computePolicy(client(ClientCategory.DESKTOP), new MediaCharacteristics()).allowDirectPlay());
    }

    private static List<PlaybackRule> defaultRules() {
        return List.of(
            new ContainerCodecCompatibilityRule(),
            new BitDepthCompatibilityRule(),
            new AudioPassthroughRule(),
            new HdrCompatibilityRule(),
            new BitrateCapRule());
    }

    private static ClientProfile client(ClientCategory category) {
        return new ClientProfile("device-" + category.getValue(), category);
    }

    private static MediaCharacteristics media(String codec, String container) {
        MediaCharacteristics media = new MediaCharacteristics();
        media.setMediaSourceId("source-1");
        media.setVideoCodec(codec);
        media.setContainer(container);
        return media;
    }

    private record FixedRule(RuleFinding finding) implements PlaybackRule {

        @Override
        public String ruleId() {
            return "fixed-" + finding.findingName();
        }

        @Override
        public String ruleVersion() {
            return "test";
        }

        @Override
        public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
            return Optional.of(finding);
        }
    }

    private static class ThrowingRule implements PlaybackRule {

        @Override
        public String ruleId() {
            return "throwing";
        }

        @Override
        public String ruleVersion() {
            return "test";
        }

        @Override
        public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
            throw new IllegalStateException("boom");
        }
    }
}
