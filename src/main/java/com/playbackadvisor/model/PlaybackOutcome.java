package com.playbackadvisor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One observed playback session.
 *
 * <p>Created at playback start with result UNKNOWN (TRANSCODED when the host started
 * by transcoding) and finalized at playback stop once played/total ticks are known.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaybackOutcome {

    private Long id;
    private String deviceId;
    private String clientName;
    private String itemId;
    private String playSessionId;
    private String videoCodec;
    private String audioCodec;
    private String container;
    private PlayMethod playMethod = PlayMethod.UNKNOWN;
    private String transcodeReasons = "";
    private PlaybackResult result = PlaybackResult.UNKNOWN;
    private Long playedTicks;
    private Long totalTicks;
    private String policySnapshot;
    private Instant timestamp = Instant.now();

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getPlaySessionId() {
        return playSessionId;
    }

    public void setPlaySessionId(String playSessionId) {
        this.playSessionId = playSessionId;
    }

    public String getVideoCodec() {
        return videoCodec;
    }

    public void setVideoCodec(String videoCodec) {
        this.videoCodec = videoCodec == null ? null : MediaFormats.normalize(videoCodec);
    }

    public String getAudioCodec() {
        return audioCodec;
    }

    public void setAudioCodec(String audioCodec) {
        this.audioCodec = audioCodec == null ? null : MediaFormats.normalize(audioCodec);
    }

    public String getContainer() {
        return container;
    }

    public void setContainer(String container) {
        this.container = container == null ? null : MediaFormats.normalize(container);
    }

    public PlayMethod getPlayMethod() {
        return playMethod;
    }

    public void setPlayMethod(PlayMethod playMethod) {
        this.playMethod = playMethod != null ? playMethod : PlayMethod.UNKNOWN;
    }

    public String getTranscodeReasons() {
        return transcodeReasons;
    }

    public void setTranscodeReasons(String transcodeReasons) {
        this.transcodeReasons = transcodeReasons;
    }

    public PlaybackResult getResult() {
        return result;
    }

    public void setResult(PlaybackResult result) {
        this.result = result != null ? result : PlaybackResult.UNKNOWN;
    }

    public Long getPlayedTicks() {
        return playedTicks;
    }

    public void setPlayedTicks(Long playedTicks) {
        this.playedTicks = playedTicks;
    }

    public Long getTotalTicks() {
        return totalTicks;
    }

    public void setTotalTicks(Long totalTicks) {
        this.totalTicks = totalTicks;
    }

    public String getPolicySnapshot() {
        return policySnapshot;
    }

    public void setPolicySnapshot(String policySnapshot) {
        this.policySnapshot = policySnapshot;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
