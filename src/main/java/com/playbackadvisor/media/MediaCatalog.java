package com.playbackadvisor.media;

import com.playbackadvisor.cost.TranscodeCostEstimator;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.TranscodeCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches media characteristics by media source id and sets the transcode cost
 * estimate the first time a source is seen. Any estimate already on the incoming
 * record is overwritten.
 */
public class MediaCatalog {

    private static final Logger log = LoggerFactory.getLogger(MediaCatalog.class);

    private final ConcurrentHashMap<String, MediaCharacteristics> cache = new ConcurrentHashMap<>();
    private final TranscodeCostEstimator costEstimator;

    public MediaCatalog(TranscodeCostEstimator costEstimator) {
        this.costEstimator = costEstimator;
    }

    /**
     * Return the cached record for the media's source id, registering it if new.
     * Media without a source id is estimated but not cached.
     */
    public MediaCharacteristics resolve(MediaCharacteristics media) {
        String sourceId = media.getMediaSourceId();
        if (sourceId == null || sourceId.isBlank()) {
            return withEstimate(media);
        }
        return cache.computeIfAbsent(sourceId, id -> withEstimate(media));
    }

    public Optional<MediaCharacteristics> find(String mediaSourceId) {
        if (mediaSourceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(mediaSourceId));
    }

    public int size() {
        return cache.size();
    }

    public void invalidate(String mediaSourceId) {
        if (mediaSourceId != null) {
            cache.remove(mediaSourceId);
        }
    }

    public void invalidateAll() {
        int evicted = cache.size();
        cache.clear();
        log.info("Media catalog cleared, {} entries evicted", evicted);
    }

    private MediaCharacteristics withEstimate(MediaCharacteristics media) {
        TranscodeCost supplied = media.getTranscodeCostEstimate();
        TranscodeCost estimated = costEstimator.estimate(media);
        if (supplied != TranscodeCost.UNKNOWN && supplied != estimated) {
            log.debug("Replacing supplied cost {} with estimate {} for {}", supplied, estimated, media.getMediaSourceId());
        }
        media.setTranscodeCostEstimate(estimated);
        return media;
    }
}
