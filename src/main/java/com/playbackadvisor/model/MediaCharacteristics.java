package com.playbackadvisor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Already-extracted characteristics of one media source.
 *
 * <p>Every field is optional; rules and estimators treat an absent value as "no opinion".
 * Codec and container names are stored lowercase. {@code transcodeCostEstimate} is
 * derived and is written once by the media catalog.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MediaCharacteristics {

    private String mediaSourceId;
    private String itemId;
    private String videoCodec;
    private String container;
    private Long bitrate;
    private Integer width;
    private Integer height;
    private Integer bitDepth;
    private String videoRangeType;
    private String videoProfile;
    private String audioCodec;
    private Integer audioChannels;
    private boolean imageSubtitles;
    private boolean textSubtitles;
    private TranscodeCost transcodeCostEstimate = TranscodeCost.UNKNOWN;

    public String getMediaSourceId() {
        return mediaSourceId;
    }

    public void setMediaSourceId(String mediaSourceId) {
        this.mediaSourceId = mediaSourceId;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getVideoCodec() {
        return videoCodec;
    }

    public void setVideoCodec(String videoCodec) {
        this.videoCodec = videoCodec == null ? null : MediaFormats.normalize(videoCodec);
    }

    public String getContainer() {
        return container;
    }

    public void setContainer(String container) {
        this.container = container == null ? null : MediaFormats.normalize(container);
    }

    public Long getBitrate() {
        return bitrate;
    }

    public void setBitrate(Long bitrate) {
        this.bitrate = bitrate;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public Integer getBitDepth() {
        return bitDepth;
    }

    public void setBitDepth(Integer bitDepth) {
        this.bitDepth = bitDepth;
    }

    public String getVideoRangeType() {
        return videoRangeType;
    }

    public void setVideoRangeType(String videoRangeType) {
        this.videoRangeType = videoRangeType;
    }

    public String getVideoProfile() {
        return videoProfile;
    }

    public void setVideoProfile(String videoProfile) {
        this.videoProfile = videoProfile;
    }

    public String getAudioCodec() {
        return audioCodec;
    }

    public void setAudioCodec(String audioCodec) {
        this.audioCodec = audioCodec == null ? null : MediaFormats.normalize(audioCodec);
    }

    public Integer getAudioChannels() {
        return audioChannels;
    }

    public void setAudioChannels(Integer audioChannels) {
        this.audioChannels = audioChannels;
    }

    @JsonProperty("has_image_subtitles")
    public boolean hasImageSubtitles() {
        return imageSubtitles;
    }

    @JsonProperty("has_image_subtitles")
    public void setHasImageSubtitles(boolean imageSubtitles) {
        this.imageSubtitles = imageSubtitles;
    }

    @JsonProperty("has_text_subtitles")
    public boolean hasTextSubtitles() {
        return textSubtitles;
    }

    @JsonProperty("has_text_subtitles")
    public void setHasTextSubtitles(boolean textSubtitles) {
        this.textSubtitles = textSubtitles;
    }

    @JsonProperty(value = "transcode_cost_estimate", access = JsonProperty.Access.READ_ONLY)
    public TranscodeCost getTranscodeCostEstimate() {
        return transcodeCostEstimate;
    }

    public void setTranscodeCostEstimate(TranscodeCost transcodeCostEstimate) {
        this.transcodeCostEstimate = transcodeCostEstimate != null ? transcodeCostEstimate : TranscodeCost.UNKNOWN;
    }
}
