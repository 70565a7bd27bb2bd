package com.playbackadvisor.decision;

import com.playbackadvisor.config.AdvisorProperties;
import com.playbackadvisor.cost.TranscodeCostEstimator;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;
import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.model.TranscodeCost;
import com.playbackadvisor.rules.PlaybackRule;
import com.playbackadvisor.rules.RuleFinding;
import com.playbackadvisor.rules.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Computes an advisory playback policy from static rule findings, the client's learned
 * confidence and the estimated transcode cost.
 *
 * <p>Deterministic and stateless: safe to call concurrently. The engine reads confidence but
 * never writes it. It never throws; any fault or low confidence yields
 * {@link PlaybackPolicy#passThrough()}.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double HIGH_CONFIDENCE = 0.7;
    static final double LOW_CONFIDENCE = 0.4;
    static final double BASELINE_CONFIDENCE = 0.5;

    private static final double REQUIRE_BONUS = 0.15;
    private static final double RECOMMEND_BONUS = 0.10;

    private final List<PlaybackRule> rules;
    private final TranscodeCostEstimator costEstimator;
    private final AdvisorProperties defaultProperties;

    public DecisionEngine(List<PlaybackRule> rules,
                          TranscodeCostEstimator costEstimator,
                          AdvisorProperties defaultProperties) {
        this.rules = List.copyOf(rules);
        this.costEstimator = costEstimator;
        this.defaultProperties = defaultProperties != null ? defaultProperties : AdvisorProperties.defaults();
    }

    public PlaybackPolicy computePolicy(ClientProfile client, MediaCharacteristics media) {
        return computePolicy(client, media, defaultProperties);
    }

    /**
     * Compute a policy under an explicit configuration. A null configuration means the
     * engine's own.
     *
     * @return the assembled policy, or the pass-through policy when the deployment is
     *         observe-only and conservative, when confidence ends below 0.4, or on any fault
     */
    public PlaybackPolicy computePolicy(ClientProfile client, MediaCharacteristics media,
                                        AdvisorProperties properties) {
        AdvisorProperties effective = properties != null ? properties : defaultProperties;
        if (effective.isObserveOnlyConservative()) {
            return PlaybackPolicy.passThrough();
        }
        if (client == null || media == null) {
            log.warn("Policy requested without client or media, returning pass-through");
            return PlaybackPolicy.passThrough();
        }

        try {
            return evaluate(client, media, effective);
        } catch (RuntimeException ex) {
            log.error("Policy computation failed for device={} media={}, returning pass-through",
                client.getDeviceId(), media.getMediaSourceId(), ex);
            return PlaybackPolicy.passThrough();
        }
    }

    private PlaybackPolicy evaluate(ClientProfile client, MediaCharacteristics media,
                                    AdvisorProperties properties) {
        PolicyDraft draft = new PolicyDraft(BASELINE_CONFIDENCE);

        List<RuleFinding> findings = evaluateRules(client, media, draft);
        draft.applyFindings(findings);
        for (RuleFinding finding : findings) {
            if (finding.severity() == Severity.REQUIRE) {
                draft.adjustConfidence(REQUIRE_BONUS);
            } else if (finding.severity() == Severity.RECOMMEND) {
                draft.adjustConfidence(RECOMMEND_BONUS);
            }
        }

        TranscodeCost cost = media.getTranscodeCostEstimate() != TranscodeCost.UNKNOWN
            ? media.getTranscodeCostEstimate()
            : costEstimator.estimate(media);

        refineVideoCodec(client, media, draft);
        refineAudioCodec(client, media, cost, draft);
        refineContainer(client, media, draft);
        refineBitrate(client, media, properties, draft);
        annotateCost(cost, draft);

        PlaybackPolicy policy = draft.toPolicy();

        if (policy.confidence() < LOW_CONFIDENCE) {
            log.info("Low confidence {} for device={} media={}, deferring to host defaults",
                format(policy.confidence()), client.getDeviceId(), media.getMediaSourceId());
            return PlaybackPolicy.passThrough();
        }

        log.debug("Policy for device={} media={}: directPlay={}, directStream={}, transcode={}, cap={}, confidence={}",
            client.getDeviceId(), media.getMediaSourceId(),
            policy.allowDirectPlay(), policy.allowDirectStream(), policy.allowTranscoding(),
            policy.bitrateCap(), format(policy.confidence()));
        return policy;
    }

    private List<RuleFinding> evaluateRules(ClientProfile client, MediaCharacteristics media, PolicyDraft draft) {
        List<RuleFinding> findings = new ArrayList<>();
        for (PlaybackRule rule : rules) {
            try {
                Optional<RuleFinding> result = rule.evaluate(client, media);
                if (result != null && result.isPresent()) {
                    RuleFinding finding = result.get();
                    findings.add(finding);
                    draft.note("[Rule:" + finding.findingName() + "] " + finding.rationale());
                    log.debug("Rule {}/{} fired for device={} media={}: {}",
                        rule.ruleId(), rule.ruleVersion(), client.getDeviceId(),
                        media.getMediaSourceId(), finding.findingName());
                }
            } catch (RuntimeException ex) {
                log.error("Rule {}/{} threw, skipping it", rule.ruleId(), rule.ruleVersion(), ex);
            }
        }
        return findings;
    }

    private static void refineVideoCodec(ClientProfile client, MediaCharacteristics media, PolicyDraft draft) {
        String codec = media.getVideoCodec();
        if (MediaFormats.isBlank(codec)) {
            draft.note("No video codec info available, allowing all methods.");
            return;
        }

        OptionalDouble recorded = client.codecConfidence(codec);
        if (recorded.isEmpty()) {
            draft.note("Video codec '" + codec + "': no confidence data, deferring.");
            return;
        }

        double confidence = recorded.getAsDouble();
        if (confidence >= HIGH_CONFIDENCE) {
            draft.set(PolicyDraft.Dimension.DIRECT_PLAY, true);
            draft.note("Video codec '" + codec + "' confidence " + format(confidence) + ", favoring direct play.");
            draft.adjustConfidence(0.2);
        } else if (confidence >= LOW_CONFIDENCE) {
            draft.set(PolicyDraft.Dimension.DIRECT_PLAY, true);
            draft.set(PolicyDraft.Dimension.DIRECT_STREAM, true);
            draft.note("Video codec '" + codec + "' confidence " + format(confidence)
                + ", allowing direct play with direct stream fallback.");
        } else {
            draft.set(PolicyDraft.Dimension.DIRECT_PLAY, false);
            draft.set(PolicyDraft.Dimension.TRANSCODING, true);
            draft.note("Video codec '" + codec + "' confidence " + format(confidence)
                + ", codec likely unsupported, allowing transcode.");
            draft.adjustConfidence(-0.1);
        }
    }

    private static void refineAudioCodec(ClientProfile client, MediaCharacteristics media,
                                         TranscodeCost cost, PolicyDraft draft) {
        String codec = media.getAudioCodec();
        if (MediaFormats.isBlank(codec)) {
            return;
        }

        OptionalDouble recorded = client.codecConfidence(codec);
        if (recorded.isEmpty()) {
            draft.note("Audio codec '" + codec + "': no confidence data, deferring.");
            return;
        }

        double confidence = recorded.getAsDouble();
        if (confidence >= HIGH_CONFIDENCE) {
            draft.note("Audio codec '" + codec + "' confidence " + format(confidence) + ", compatible.");
            draft.adjustConfidence(0.05);
        } else if (confidence >= LOW_CONFIDENCE) {
            draft.note("Audio codec '" + codec + "' confidence " + format(confidence)
                + ", may need audio transcode.");
        } else {
            draft.set(PolicyDraft.Dimension.TRANSCODING, true);
            draft.note("Audio codec '" + codec + "' confidence " + format(confidence)
                + ", audio transcode likely required.");
            if (draft.get(PolicyDraft.Dimension.DIRECT_PLAY) && cost.isAtMost(TranscodeCost.REMUX)) {
                draft.set(PolicyDraft.Dimension.DIRECT_STREAM, true);
                draft.note("Audio-only transcode is cheap, direct stream with audio transcode preferred "
                    + "over a full video transcode.");
            }
            draft.adjustConfidence(-0.05);
        }
    }

    private static void refineContainer(ClientProfile client, MediaCharacteristics media, PolicyDraft draft) {
        String container = media.getContainer();
        if (MediaFormats.isBlank(container)) {
            return;
        }

        OptionalDouble recorded = client.containerConfidence(container);
        if (recorded.isEmpty()) {
            draft.note("Container '" + container + "': no confidence data, deferring.");
            return;
        }

        double confidence = recorded.getAsDouble();
        if (confidence >= HIGH_CONFIDENCE) {
            draft.note("Container '" + container + "' confidence " + format(confidence) + ", no remux needed.");
            draft.adjustConfidence(0.1);
        } else if (confidence >= LOW_CONFIDENCE) {
            draft.set(PolicyDraft.Dimension.DIRECT_STREAM, true);
            draft.note("Container '" + container + "' confidence " + format(confidence) + ", may need remux.");
        } else if (draft.get(PolicyDraft.Dimension.DIRECT_PLAY)) {
            draft.set(PolicyDraft.Dimension.DIRECT_PLAY, false);
            draft.set(PolicyDraft.Dimension.DIRECT_STREAM, true);
            draft.note("Container '" + container + "' confidence " + format(confidence)
                + ", forcing direct stream/remux over direct play.");
        }
    }

    private static void refineBitrate(ClientProfile client, MediaCharacteristics media,
                                      AdvisorProperties properties, PolicyDraft draft) {
        Long effectiveCap = properties.globalMaxBitrateOverride() != null
            ? properties.globalMaxBitrateOverride()
            : client.getMaxBitrate();
        Long bitrate = media.getBitrate();

        if (effectiveCap != null && bitrate != null && bitrate > effectiveCap) {
            draft.capBitrate(effectiveCap);
            draft.set(PolicyDraft.Dimension.TRANSCODING, true);
            draft.note(String.format(Locale.ROOT, "Media bitrate %.1f Mbps exceeds cap %.1f Mbps, transcode may be needed.",
                bitrate / 1_000_000.0, effectiveCap / 1_000_000.0));
        }
    }

    private static void annotateCost(TranscodeCost cost, PolicyDraft draft) {
        switch (cost) {
            case EXTREME -> {
                draft.note("Transcode cost: EXTREME, strongly prefer direct play if possible.");
                if (!draft.get(PolicyDraft.Dimension.DIRECT_PLAY)) {
                    draft.note("WARNING: Direct play disallowed but the fallback transcode will be very expensive.");
                }
            }
            case HIGH -> draft.note("Transcode cost: HIGH, prefer direct play or direct stream.");
            case MEDIUM -> draft.note("Transcode cost: MEDIUM, transcode is manageable but direct play still preferred.");
            case LOW -> draft.note("Transcode cost: LOW, lightweight transcode with no significant server impact.");
            case REMUX -> {
                draft.note("Transcode cost: REMUX only, container remux is cheap and direct stream is fine.");
                draft.set(PolicyDraft.Dimension.DIRECT_STREAM, true);
            }
            case UNKNOWN -> { /* estimator always assigns a tier */ }
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
