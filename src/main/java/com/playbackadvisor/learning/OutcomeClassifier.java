package com.playbackadvisor.learning;

import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackResult;

/**
 * Resolves the result of outcomes that arrived unclassified.
 *
 * <p>A transcoded session is always {@link PlaybackResult#TRANSCODED}. Otherwise the
 * played/total tick ratio decides: under {@value #MIN_PLAYBACK_RATIO_FOR_SUCCESS} the
 * session is treated as a suspected failure, at or above it as a success, and without
 * usable tick data the result stays {@link PlaybackResult#UNKNOWN}.
 */
public final class OutcomeClassifier {

    public static final double MIN_PLAYBACK_RATIO_FOR_SUCCESS = 0.15;

    /** Stop events only need to show that playback actually got going. */
    public static final double MIN_PLAYBACK_RATIO_AT_STOP = 0.02;

    private OutcomeClassifier() {
    }

    /**
     * Classify the outcome in place. Outcomes that already carry a result are left alone.
     *
     * @return the (possibly unchanged) result
     */
    public static PlaybackResult classify(PlaybackOutcome outcome) {
        if (outcome.getResult() != PlaybackResult.UNKNOWN) {
            return outcome.getResult();
        }
        outcome.setResult(resolve(outcome));
        return outcome.getResult();
    }

    /**
     * @return played/total, or -1 when either tick count is missing or the total is not positive
     */
    public static double playbackRatio(PlaybackOutcome outcome) {
        Long played = outcome.getPlayedTicks();
        Long total = outcome.getTotalTicks();
        if (played == null || total == null || total <= 0) {
            return -1.0;
        }
        return (double) played / total;
    }

    /**
     * Resolve the result once a session has ended and its final tick counts are known.
     * Under {@value #MIN_PLAYBACK_RATIO_AT_STOP} of the runtime the session is a suspected
     * failure even when it was transcoded; otherwise a transcoded session stays
     * {@link PlaybackResult#TRANSCODED}.
     */
    public static PlaybackResult resolveAtStop(PlaybackOutcome outcome) {
        boolean transcoded = outcome.getResult() == PlaybackResult.TRANSCODED
            || outcome.getPlayMethod() == PlayMethod.TRANSCODE;
        double ratio = playbackRatio(outcome);
        if (ratio < 0) {
            return transcoded ? PlaybackResult.TRANSCODED : PlaybackResult.UNKNOWN;
        }
        if (ratio < MIN_PLAYBACK_RATIO_AT_STOP) {
            return PlaybackResult.SUSPECTED_FAILURE;
        }
        return transcoded ? PlaybackResult.TRANSCODED : PlaybackResult.SUCCESS;
    }

    private static PlaybackResult resolve(PlaybackOutcome outcome) {
        if (outcome.getPlayMethod() == PlayMethod.TRANSCODE) {
            return PlaybackResult.TRANSCODED;
        }
        double ratio = playbackRatio(outcome);
        if (ratio < 0) {
            return PlaybackResult.UNKNOWN;
        }
        return ratio < MIN_PLAYBACK_RATIO_FOR_SUCCESS
            ? PlaybackResult.SUSPECTED_FAILURE
            : PlaybackResult.SUCCESS;
    }
}
