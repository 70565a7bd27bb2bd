package com.playbackadvisor.store;

import com.playbackadvisor.model.PlaybackOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OutcomeStore {

    /** Insert a new outcome (id assigned) or replace the stored one with the same id. */
    PlaybackOutcome record(PlaybackOutcome outcome);

    /** Most recent first. */
    List<PlaybackOutcome> findByDevice(String deviceId, int limit);

    List<PlaybackOutcome> findSince(Instant since);

    Optional<PlaybackOutcome> findBySession(String playSessionId);

    /** @return number of outcomes deleted */
    int prune(Instant olderThan);
}
