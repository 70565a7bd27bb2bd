package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * HDR and Dolby Vision support per client category. Tone-mapping to SDR is the most
 * CPU-expensive part of a transcode, so partial support gets a softer severity.
 */
public class HdrCompatibilityRule implements PlaybackRule {

    private static final HdrSupport FULL = new HdrSupport(null, null);

    private static final HdrSupport DOLBY_VISION_SUGGEST = new HdrSupport(
        new Response("generic-dolby-vision", Severity.SUGGEST,
            "Dolby Vision support is uncommon. Tone-mapping transcode may be required."),
        null);

    private static final Map<ClientCategory, HdrSupport> SUPPORT = new EnumMap<>(ClientCategory.class);

    static {
        SUPPORT.put(ClientCategory.WEB_BROWSER, new HdrSupport(
            new Response("web-dolby-vision", Severity.REQUIRE,
                "Web browsers cannot play Dolby Vision. Transcode with tone-mapping to SDR required."),
            new Response("web-tone-map-required", Severity.REQUIRE,
                "Web browsers cannot display %s. Transcode with tone-mapping to SDR required.")));
        SUPPORT.put(ClientCategory.ANDROID_MOBILE, new HdrSupport(
            new Response("mobile-dolby-vision", Severity.RECOMMEND,
                "Mobile devices typically cannot display %s. Tone-mapping transcode required."),
            new Response("mobile-tone-map-required", Severity.RECOMMEND,
                "Mobile devices typically cannot display %s. Tone-mapping transcode required.")));
        SUPPORT.put(ClientCategory.ROKU, new HdrSupport(
            new Response("roku-dolby-vision", Severity.RECOMMEND,
                "Roku has limited Dolby Vision support. Tone-mapping transcode likely required."),
            null));
        SUPPORT.put(ClientCategory.XBOX, new HdrSupport(
            new Response("xbox-dolby-vision", Severity.RECOMMEND,
                "Xbox Dolby Vision support is limited. Tone-mapping transcode recommended."),
            null));
        SUPPORT.put(ClientCategory.SWIFTFIN_IOS, new HdrSupport(
            new Response("ios-dolby-vision", Severity.SUGGEST,
                "iPhone displays have limited %s support. Tone-mapping transcode recommended."),
            new Response("ios-limited-hdr", Severity.SUGGEST,
                "iPhone displays have limited %s support. Tone-mapping transcode recommended.")));
        SUPPORT.put(ClientCategory.SWIFTFIN_TVOS, FULL);
        SUPPORT.put(ClientCategory.DESKTOP, FULL);
        SUPPORT.put(ClientCategory.KODI, FULL);
    }

    @Override
    public String ruleId() {
        return "hdr-compatibility";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
        String rangeType = media.getVideoRangeType();
        if (!MediaFormats.isHdr(rangeType)) {
            return Optional.empty();
        }

        HdrSupport support = SUPPORT.getOrDefault(client.getCategory(), DOLBY_VISION_SUGGEST);
        Response response = MediaFormats.isDolbyVision(rangeType) ? support.dolbyVision() : support.otherHdr();
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(RuleFinding.transcode(response.name(), response.severity(),
            response.reason().formatted(rangeType)));
    }

    /** A null response means the category handles that range natively. */
    record HdrSupport(Response dolbyVision, Response otherHdr) {
    }

    record Response(String name, Severity severity, String reason) {
    }
}
