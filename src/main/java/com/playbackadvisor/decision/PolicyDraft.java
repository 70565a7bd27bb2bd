package com.playbackadvisor.decision;

import com.playbackadvisor.model.PlaybackPolicy;
import com.playbackadvisor.rules.Opinion;
import com.playbackadvisor.rules.RuleFinding;
import com.playbackadvisor.rules.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable working state of one decision call. Confined to a single thread.
 *
 * <p>Remembers which severity decided each dimension during the rule pass: confidence
 * refinement may overwrite a SUGGEST or RECOMMEND outcome but never a REQUIRE one.
 */
class PolicyDraft {

    enum Dimension {
        DIRECT_PLAY,
        DIRECT_STREAM,
        TRANSCODING
    }

    private final Map<Dimension, Boolean> flags = new EnumMap<>(Dimension.class);
    private final Map<Dimension, Severity> decidedBy = new EnumMap<>(Dimension.class);
    private final List<String> rationale = new ArrayList<>();
    private Long bitrateCap;
    private double confidence;

    PolicyDraft(double baselineConfidence) {
        for (Dimension dimension : Dimension.values()) {
            flags.put(dimension, true);
        }
        this.confidence = baselineConfidence;
    }

    /**
     * Arbitrate rule findings per dimension: the highest severity with an opinion wins and,
     * among equal severities, the finding registered last wins. Every cap is intersected.
     */
    void applyFindings(List<RuleFinding> findings) {
        for (RuleFinding finding : findings) {
            arbitrate(Dimension.DIRECT_PLAY, finding.directPlay(), finding.severity());
            arbitrate(Dimension.DIRECT_STREAM, finding.directStream(), finding.severity());
            arbitrate(Dimension.TRANSCODING, finding.transcoding(), finding.severity());
            if (finding.bitrateCap() != null) {
                capBitrate(finding.bitrateCap());
            }
        }
    }

    private void arbitrate(Dimension dimension, Opinion opinion, Severity severity) {
        if (!opinion.isExpressed()) {
            return;
        }
        Severity current = decidedBy.get(dimension);
        if (current == null || severity.compareTo(current) >= 0) {
            flags.put(dimension, opinion.allows());
            decidedBy.put(dimension, severity);
        }
    }

    boolean get(Dimension dimension) {
        return flags.get(dimension);
    }

    /**
     * Refinement write. Ignored when it would contradict a REQUIRE finding.
     */
    void set(Dimension dimension, boolean value) {
        if (decidedBy.get(dimension) == Severity.REQUIRE && flags.get(dimension) != value) {
            return;
        }
        flags.put(dimension, value);
    }

    void capBitrate(long cap) {
        bitrateCap = bitrateCap == null ? cap : Math.min(bitrateCap, cap);
    }

    void adjustConfidence(double delta) {
        confidence += delta;
    }

    void note(String line) {
        rationale.add(line);
    }

    PlaybackPolicy toPolicy() {
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return new PlaybackPolicy(
            flags.get(Dimension.DIRECT_PLAY),
            flags.get(Dimension.DIRECT_STREAM),
            flags.get(Dimension.TRANSCODING),
            bitrateCap,
            clamped,
            String.join("\n", rationale));
    }
}
