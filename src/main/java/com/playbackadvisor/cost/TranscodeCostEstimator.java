package com.playbackadvisor.cost;

import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;
import com.playbackadvisor.model.TranscodeCost;

import java.util.Set;

/**
 * Heuristic transcode cost estimation. Cost factors are additive so that several
 * moderate factors compound into a high tier; only the final bucketing uses cutoffs.
 *
 * <p>Pure and stateless: the same characteristics always produce the same tier.
 */
public class TranscodeCostEstimator {

    private static final Set<String> CHEAP_VIDEO = Set.of(
        "h264", "avc", "mpeg2video", "mpeg2", "mpeg4", "vp8", "theora");
    private static final Set<String> HEAVY_VIDEO = Set.of("av1");

    /** Video codecs that play almost everywhere once the container is fixed. */
    private static final Set<String> REMUX_FRIENDLY_VIDEO = Set.of("h264", "hevc", "h265");

    public TranscodeCost estimate(MediaCharacteristics media) {
        int score = score(media);
        if (score <= 0) {
            return remuxPotential(media);
        }
        if (score <= 1) {
            return TranscodeCost.LOW;
        }
        if (score <= 3) {
            return TranscodeCost.MEDIUM;
        }
        if (score <= 6) {
            return TranscodeCost.HIGH;
        }
        return TranscodeCost.EXTREME;
    }

    int score(MediaCharacteristics media) {
        int score = videoCodecWeight(media.getVideoCodec());

        if (is4k(media)) {
            score += 3;
        } else if (is1440p(media)) {
            score += 1;
        }

        if (MediaFormats.isDolbyVision(media.getVideoRangeType())) {
            score += 4;
        } else if (MediaFormats.isHdr(media.getVideoRangeType())) {
            score += 2;
        }

        Integer bitDepth = media.getBitDepth();
        if (bitDepth != null && bitDepth >= 12) {
            score += 2;
        } else if (bitDepth != null && bitDepth >= 10) {
            score += 1;
        }

        // text subtitles render client-side; image subtitles must be burned in
        if (media.hasImageSubtitles()) {
            score += 2;
        }

        score += audioWeight(media.getAudioCodec(), media.getAudioChannels());
        return score;
    }

    static int videoCodecWeight(String videoCodec) {
        if (MediaFormats.isBlank(videoCodec)) {
            return 0;
        }
        String codec = MediaFormats.normalize(videoCodec);
        if (CHEAP_VIDEO.contains(codec)) {
            return 0;
        }
        if (HEAVY_VIDEO.contains(codec)) {
            return 2;
        }
        // hevc, vp9, vc1, wmv3 and anything unknown
        return 1;
    }

    static int audioWeight(String audioCodec, Integer channels) {
        if (MediaFormats.isBlank(audioCodec)) {
            return 0;
        }
        int weight = MediaFormats.LOSSLESS_AUDIO.contains(MediaFormats.normalize(audioCodec)) ? 1 : 0;
        if (weight > 0 && channels != null && channels > 6) {
            weight += 1;
        }
        return weight;
    }

    private static boolean is4k(MediaCharacteristics media) {
        return atLeast(media.getWidth(), 3840) || atLeast(media.getHeight(), 2160);
    }

    private static boolean is1440p(MediaCharacteristics media) {
        return atLeast(media.getWidth(), 2560) || atLeast(media.getHeight(), 1440);
    }

    private static boolean atLeast(Integer value, int threshold) {
        return value != null && value >= threshold;
    }

    /**
     * Zero-score media needs no real transcode; decide whether it at least needs repackaging.
     */
    private static TranscodeCost remuxPotential(MediaCharacteristics media) {
        String container = MediaFormats.normalize(media.getContainer());
        String codec = MediaFormats.normalize(media.getVideoCodec());
        if (codec.isEmpty() || container.isEmpty()) {
            return TranscodeCost.LOW;
        }
        if (MediaFormats.UNIVERSAL_CONTAINERS.contains(container)) {
            return TranscodeCost.LOW;
        }
        if ("mkv".equals(container) && REMUX_FRIENDLY_VIDEO.contains(codec)) {
            return TranscodeCost.REMUX;
        }
        if (MediaFormats.LEGACY_CONTAINERS.contains(container)) {
            return TranscodeCost.REMUX;
        }
        return TranscodeCost.LOW;
    }
}
