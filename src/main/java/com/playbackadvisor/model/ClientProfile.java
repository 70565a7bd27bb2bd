package com.playbackadvisor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Normalized view of one device/app installation and what it is believed to play.
 *
 * <p>The confidence maps are keyed by lowercase codec/container name. A missing key means
 * "no data", which the decision engine treats differently from a recorded 0.0
 * ("confirmed unsupported"). Only the learning service writes confidence.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientProfile {

    private String deviceId;
    private String deviceName;
    private String clientName;
    private String clientVersion;
    private ClientCategory category = ClientCategory.UNKNOWN;
    private final Map<String, Double> codecConfidence = new ConcurrentHashMap<>();
    private final Map<String, Double> containerConfidence = new ConcurrentHashMap<>();
    private Long maxBitrate;
    private double reliabilityScore = 0.5;
    private Instant firstSeen = Instant.now();
    private Instant lastUpdated = Instant.now();

    public ClientProfile() {
    }

    public ClientProfile(String deviceId, ClientCategory category) {
        this.deviceId = deviceId;
        setCategory(category);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    public void setClientVersion(String clientVersion) {
        this.clientVersion = clientVersion;
    }

    public ClientCategory getCategory() {
        return category;
    }

    public void setCategory(ClientCategory category) {
        this.category = category != null ? category : ClientCategory.UNKNOWN;
    }

    public Long getMaxBitrate() {
        return maxBitrate;
    }

    public void setMaxBitrate(Long maxBitrate) {
        this.maxBitrate = maxBitrate;
    }

    public double getReliabilityScore() {
        return reliabilityScore;
    }

    public void setReliabilityScore(double reliabilityScore) {
        this.reliabilityScore = reliabilityScore;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(Instant firstSeen) {
        this.firstSeen = firstSeen;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Map<String, Double> getCodecConfidence() {
        return Collections.unmodifiableMap(codecConfidence);
    }

    public void setCodecConfidence(Map<String, Double> values) {
        replace(codecConfidence, values);
    }

    public Map<String, Double> getContainerConfidence() {
        return Collections.unmodifiableMap(containerConfidence);
    }

    public void setContainerConfidence(Map<String, Double> values) {
        replace(containerConfidence, values);
    }

    public OptionalDouble codecConfidence(String codec) {
        return lookup(codecConfidence, codec);
    }

    public OptionalDouble containerConfidence(String container) {
        return lookup(containerConfidence, container);
    }

    public void putCodecConfidence(String codec, double value) {
        codecConfidence.put(MediaFormats.normalize(codec), value);
    }

    public void putContainerConfidence(String container, double value) {
        containerConfidence.put(MediaFormats.normalize(container), value);
    }

    private static OptionalDouble lookup(Map<String, Double> map, String key) {
        if (MediaFormats.isBlank(key)) {
            return OptionalDouble.empty();
        }
        Double value = map.get(MediaFormats.normalize(key));
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static void replace(Map<String, Double> target, Map<String, Double> values) {
        target.clear();
        if (values == null) {
            return;
        }
        values.forEach((key, value) -> {
            if (!MediaFormats.isBlank(key) && value != null) {
                target.put(MediaFormats.normalize(key), value);
            }
        });
    }
}
