package com.playbackadvisor.learning;

import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeClassifierTest {

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("100 of 100000 ticks direct played is a suspected failure")
        void tinyRatio_isSuspectedFailure() {
            PlaybackOutcome outcome = outcome(PlayMethod.DIRECT_PLAY, 100L, 100_000L);
            assertEquals(PlaybackResult.SUSPECTED_FAILURE, OutcomeClassifier.classify(outcome));
            assertEquals(PlaybackResult.SUSPECTED_FAILURE, outcome.getResult());
        }

        @Test
        void ratioAtThreshold_isSuccess() {
            assertEquals(PlaybackResult.SUCCESS,
                OutcomeClassifier.classify(outcome(PlayMethod.DIRECT_PLAY, 15L, 100L)));
        }

        @Test
        void transcode_isTranscodedRegardlessOfTicks() {
            assertEquals(PlaybackResult.TRANSCODED,
                OutcomeClassifier.classify(outcome(PlayMethod.TRANSCODE, 1L, 100_000L)));
        }

        @Test
        void missingTicks_staysUnknown() {
            assertEquals(PlaybackResult.UNKNOWN,
                OutcomeClassifier.classify(outcome(PlayMethod.DIRECT_STREAM, null, 100L)));
            assertEquals(PlaybackResult.UNKNOWN,
                OutcomeClassifier.classify(outcome(PlayMethod.DIRECT_STREAM, 10L, 0L)));
        }

        @Test
        void alreadyClassified_isKept() {
            PlaybackOutcome outcome = outcome(PlayMethod.DIRECT_PLAY, 1L, 100L);
            outcome.setResult(PlaybackResult.FAILURE);
            assertEquals(PlaybackResult.FAILURE, OutcomeClassifier.classify(outcome));
        }
    }

    @Nested
    @DisplayName("resolveAtStop")
    class ResolveAtStop {

        @Test
        void shortTranscode_isSuspectedFailure() {
            PlaybackOutcome outcome = outcome(PlayMethod.TRANSCODE, 1L, 100L);
            outcome.setResult(PlaybackResult.TRANSCODED);
            assertEquals(PlaybackResult.SUSPECTED_FAILURE, OutcomeClassifier.resolveAtStop(outcome));
        }

        @Test
        void completedTranscode_staysTranscoded() {
            PlaybackOutcome outcome = outcome(PlayMethod.TRANSCODE, 90L, 100L);
            outcome.setResult(PlaybackResult.TRANSCODED);
            assertEquals(PlaybackResult.TRANSCODED, OutcomeClassifier.resolveAtStop(outcome));
        }

        @Test
        @DisplayName("a tenth of the runtime is enough at stop, though not for classify")
        void stopThresholdIsLowerThanClassifyThreshold() {
            assertEquals(PlaybackResult.SUCCESS,
                OutcomeClassifier.resolveAtStop(outcome(PlayMethod.DIRECT_PLAY, 10L, 100L)));
            assertEquals(PlaybackResult.SUSPECTED_FAILURE,
                OutcomeClassifier.classify(outcome(PlayMethod.DIRECT_PLAY, 10L, 100L)));
        }

        @Test
        void completedDirectPlay_isSuccess() {
            assertEquals(PlaybackResult.SUCCESS,
                OutcomeClassifier.resolveAtStop(outcome(PlayMethod.DIRECT_PLAY, 90L, 100L)));
        }
    }

    @Test
    void playbackRatio() {
        assertEquals(0.5, OutcomeClassifier.playbackRatio(outcome(PlayMethod.DIRECT_PLAY, 50L, 100L)));
        assertEquals(-1.0, OutcomeClassifier.playbackRatio(outcome(PlayMethod.DIRECT_PLAY, 50L, null)));
    }

    private static PlaybackOutcome outcome(PlayMethod method, Long played, Long total) {
        PlaybackOutcome outcome = new PlaybackOutcome();
        outcome.setPlayMethod(method);
        outcome.setPlayedTicks(played);
        outcome.setTotalTicks(total);
        return outcome;
    }
}
