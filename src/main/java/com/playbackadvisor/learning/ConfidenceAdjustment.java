package com.playbackadvisor.learning;

import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;

import java.util.Locale;

/**
 * Per-outcome confidence deltas, before the learning rate is applied.
 *
 * <p>Video takes the full magnitude. Audio and container take a fraction, and a transcode
 * only penalizes audio when the host's transcode reasons name audio and not video.
 */
record ConfidenceAdjustment(double video, double audio, double container) {

    static final double SUCCESS_BOOST = 0.08;
    static final double FAILURE_PENALTY = 0.12;
    static final double SUSPECTED_FAILURE_PENALTY = 0.08;
    static final double TRANSCODE_PENALTY = 0.05;

    private static final double AUDIO_SHARE = 0.5;
    private static final double CONTAINER_FAILURE_SHARE = 0.3;

    static ConfidenceAdjustment of(PlaybackOutcome outcome) {
        return new ConfidenceAdjustment(
            isBlank(outcome.getVideoCodec()) ? 0.0 : video(outcome),
            isBlank(outcome.getAudioCodec()) ? 0.0 : audio(outcome),
            isBlank(outcome.getContainer()) ? 0.0 : container(outcome));
    }

    private static double video(PlaybackOutcome outcome) {
        return switch (outcome.getResult()) {
            case SUCCESS -> isDirectPlay(outcome) ? SUCCESS_BOOST : SUCCESS_BOOST * 0.5;
            case FAILURE -> -FAILURE_PENALTY;
            case SUSPECTED_FAILURE -> -SUSPECTED_FAILURE_PENALTY;
            case TRANSCODED -> -TRANSCODE_PENALTY;
            case UNKNOWN -> 0.0;
        };
    }

    private static double audio(PlaybackOutcome outcome) {
        return switch (outcome.getResult()) {
            case SUCCESS -> isDirectPlay(outcome) ? SUCCESS_BOOST * AUDIO_SHARE : 0.0;
            case FAILURE -> -FAILURE_PENALTY * AUDIO_SHARE;
            case SUSPECTED_FAILURE -> -SUSPECTED_FAILURE_PENALTY * AUDIO_SHARE;
            case TRANSCODED -> isAudioOnlyTranscode(outcome) ? -TRANSCODE_PENALTY : 0.0;
            case UNKNOWN -> 0.0;
        };
    }

    private static double container(PlaybackOutcome outcome) {
        return switch (outcome.getResult()) {
            case SUCCESS -> isDirectPlay(outcome) ? SUCCESS_BOOST * AUDIO_SHARE : 0.0;
            case FAILURE -> -FAILURE_PENALTY * CONTAINER_FAILURE_SHARE;
            case SUSPECTED_FAILURE -> -SUSPECTED_FAILURE_PENALTY * CONTAINER_FAILURE_SHARE;
            case TRANSCODED, UNKNOWN -> 0.0;
        };
    }

    private static boolean isDirectPlay(PlaybackOutcome outcome) {
        return outcome.getPlayMethod() == PlayMethod.DIRECT_PLAY;
    }

    static boolean isAudioOnlyTranscode(PlaybackOutcome outcome) {
        String reasons = outcome.getTranscodeReasons() == null
            ? ""
            : outcome.getTranscodeReasons().toLowerCase(Locale.ROOT);
        return reasons.contains("audio") && !reasons.contains("video");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
