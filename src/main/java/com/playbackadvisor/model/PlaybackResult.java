package com.playbackadvisor.model;

/**
 * Classification of a finished playback session.
 */
public enum PlaybackResult {
    /** Not classified yet, or not enough data to classify. */
    UNKNOWN,
    SUCCESS,
    FAILURE,
    /** Session ended very early relative to the runtime. */
    SUSPECTED_FAILURE,
    /** The host transcoded; not a failure but a signal against direct play. */
    TRANSCODED
}
