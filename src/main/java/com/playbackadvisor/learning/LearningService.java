package com.playbackadvisor.learning;

import com.playbackadvisor.config.AdvisorProperties;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.PlayMethod;
import com.playbackadvisor.model.PlaybackOutcome;
import com.playbackadvisor.model.PlaybackResult;
import com.playbackadvisor.store.ClientProfileStore;
import com.playbackadvisor.store.OutcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Turns observed playback outcomes into per-client codec and container confidence.
 *
 * <p>Incremental updates move confidence by {@code adjustment * }{@value #LEARNING_RATE}
 * and clamp to [0, 1], so no single outcome can saturate a score. Recalibration replaces
 * that drift with a blend of the stored score and the observed direct-play success rate.
 *
 * <p>This is the only writer of confidence. Each client's read-adjust-write sequence runs
 * under a per-device lock; persistence failures are logged as lost updates and never thrown.
 */
public class LearningService {

    private static final Logger log = LoggerFactory.getLogger(LearningService.class);

    static final double LEARNING_RATE = 0.15;
    static final int RECALIBRATION_WINDOW = 500;
    static final int MIN_SAMPLES = 3;
    static final double EXISTING_WEIGHT = 0.3;
    static final double OBSERVED_WEIGHT = 0.7;

    private final ClientProfileStore clientStore;
    private final OutcomeStore outcomeStore;
    private final AdvisorProperties properties;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public LearningService(ClientProfileStore clientStore, OutcomeStore outcomeStore,
                           AdvisorProperties properties) {
        this.clientStore = clientStore;
        this.outcomeStore = outcomeStore;
        this.properties = properties;
    }

    /**
     * Classify the outcome if needed and fold it into the client's confidence maps.
     * No-op when learning is disabled.
     */
    public void processOutcome(PlaybackOutcome outcome, ClientProfile client) {
        if (!properties.enableLearning()) {
            log.debug("Learning disabled, ignoring outcome for device={}", client.getDeviceId());
            return;
        }

        OutcomeClassifier.classify(outcome);
        ConfidenceAdjustment adjustment = ConfidenceAdjustment.of(outcome);

        ReentrantLock lock = lockFor(client);
        lock.lock();
        try {
            adjust(client::codecConfidence, client::putCodecConfidence,
                outcome.getVideoCodec(), adjustment.video());
            adjust(client::codecConfidence, client::putCodecConfidence,
                outcome.getAudioCodec(), adjustment.audio());
            adjust(client::containerConfidence, client::putContainerConfidence,
                outcome.getContainer(), adjustment.container());
            client.setLastUpdated(Instant.now());
            persist(client);
        } finally {
            lock.unlock();
        }

        log.debug("Learning update device={} video={}({}) audio={}({}) container={}({}) result={} method={}",
            client.getDeviceId(),
            outcome.getVideoCodec(), signed(adjustment.video()),
            outcome.getAudioCodec(), signed(adjustment.audio()),
            outcome.getContainer(), signed(adjustment.container()),
            outcome.getResult(), outcome.getPlayMethod());
    }

    /**
     * Recompute confidence from the most recent outcomes recorded for the client.
     * Keys with fewer than {@value #MIN_SAMPLES} observations keep their current value.
     */
    public void recalibrateClient(ClientProfile client) {
        List<PlaybackOutcome> outcomes = outcomeStore.findByDevice(client.getDeviceId(), RECALIBRATION_WINDOW);
        if (outcomes.isEmpty()) {
            log.debug("No outcomes to recalibrate device={}", client.getDeviceId());
            return;
        }

        Map<String, SampleCount> videoStats = new LinkedHashMap<>();
        Map<String, SampleCount> audioStats = new LinkedHashMap<>();
        Map<String, SampleCount> containerStats = new LinkedHashMap<>();

        for (PlaybackOutcome outcome : outcomes) {
            OutcomeClassifier.classify(outcome);
            boolean success = outcome.getResult() == PlaybackResult.SUCCESS
                && outcome.getPlayMethod() == PlayMethod.DIRECT_PLAY;
            accumulate(videoStats, outcome.getVideoCodec(), success);
            accumulate(audioStats, outcome.getAudioCodec(), success);
            accumulate(containerStats, outcome.getContainer(), success);
        }

        ReentrantLock lock = lockFor(client);
        lock.lock();
        try {
            blend(client::codecConfidence, client::putCodecConfidence, videoStats);
            blend(client::codecConfidence, client::putCodecConfidence, audioStats);
            blend(client::containerConfidence, client::putContainerConfidence, containerStats);
            client.setLastUpdated(Instant.now());
            persist(client);
        } finally {
            lock.unlock();
        }

        log.info("Recalibrated device={} from {} outcomes: {} video codecs, {} audio codecs, {} containers",
            client.getDeviceId(), outcomes.size(), videoStats.size(), audioStats.size(), containerStats.size());
    }

    private static void adjust(Function<String, OptionalDouble> reader,
                               BiConsumer<String, Double> writer,
                               String key, double adjustment) {
        if (key == null || key.isBlank() || adjustment == 0.0) {
            return;
        }
        double current = reader.apply(key).orElse(0.0);
        writer.accept(key, clamp(current + adjustment * LEARNING_RATE));
    }

    private static void accumulate(Map<String, SampleCount> stats, String key, boolean success) {
        if (key == null || key.isBlank()) {
            return;
        }
        stats.computeIfAbsent(key.toLowerCase(Locale.ROOT), k -> new SampleCount()).add(success);
    }

    private static void blend(Function<String, OptionalDouble> reader,
                              BiConsumer<String, Double> writer,
                              Map<String, SampleCount> stats) {
        stats.forEach((key, count) -> {
            if (count.total < MIN_SAMPLES) {
                return;
            }
            double existing = reader.apply(key).orElse(0.0);
            writer.accept(key, clamp(existing * EXISTING_WEIGHT + count.rate() * OBSERVED_WEIGHT));
        });
    }

    private void persist(ClientProfile client) {
        try {
            clientStore.upsert(client);
        } catch (RuntimeException ex) {
            log.warn("Lost confidence update for device={}: client store write failed",
                client.getDeviceId(), ex);
        }
    }

    private ReentrantLock lockFor(ClientProfile client) {
        String key = client.getDeviceId() == null ? "" : client.getDeviceId().toLowerCase(Locale.ROOT);
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String signed(double value) {
        return String.format(Locale.ROOT, "%+.2f", value);
    }

    private static final class SampleCount {
        private int success;
        private int total;

        void add(boolean succeeded) {
            total++;
            if (succeeded) {
                success++;
            }
        }

        double rate() {
            return (double) success / total;
        }
    }
}
