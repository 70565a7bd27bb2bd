package com.playbackadvisor.store;

import com.playbackadvisor.model.PlaybackOutcome;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
public class InMemoryOutcomeStore implements OutcomeStore {

    private final ConcurrentSkipListMap<Long, PlaybackOutcome> outcomes = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public PlaybackOutcome record(PlaybackOutcome outcome) {
        if (outcome.getId() == null) {
            outcome.setId(sequence.incrementAndGet());
        }
        outcomes.put(outcome.getId(), outcome);
        return outcome;
    }

    @Override
    public List<PlaybackOutcome> findByDevice(String deviceId, int limit) {
        if (limit <= 0 || deviceId == null) {
            return Collections.emptyList();
        }
        return outcomes.descendingMap().values().stream()
            .filter(o -> deviceId.equalsIgnoreCase(o.getDeviceId()))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<PlaybackOutcome> findSince(Instant since) {
        return outcomes.values().stream()
            .filter(o -> o.getTimestamp() != null && !o.getTimestamp().isBefore(since))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<PlaybackOutcome> findBySession(String playSessionId) {
        if (playSessionId == null || playSessionId.isBlank()) {
            return Optional.empty();
        }
        return outcomes.descendingMap().values().stream()
            .filter(o -> playSessionId.equalsIgnoreCase(o.getPlaySessionId()))
            .findFirst();
    }

    @Override
    public int prune(Instant olderThan) {
        int removed = 0;
        for (PlaybackOutcome outcome : outcomes.values()) {
            if (outcome.getTimestamp() != null && outcome.getTimestamp().isBefore(olderThan)
                && outcomes.remove(outcome.getId(), outcome)) {
                removed++;
            }
        }
        return removed;
    }
}
