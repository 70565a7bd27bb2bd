package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Audio codecs a client category can neither decode nor pass through to a receiver.
 * Findings only keep transcoding available: an audio-only transcode next to a remuxed
 * video stream is far cheaper than a full transcode, so direct play is left alone here.
 */
public class AudioPassthroughRule implements PlaybackRule {

    private static final Set<String> DTS_FAMILY = Set.of("dts", "dts-hd ma", "dts-hd hra");

    private static final Map<ClientCategory, AudioRestriction> RESTRICTIONS = Map.of(
        ClientCategory.WEB_BROWSER, new AudioRestriction("web-lossless-or-dts",
            Set.of("truehd", "dts-hd ma", "dts-hd hra", "dts"), Severity.REQUIRE,
            "Web browsers cannot decode %s. Audio transcode to AAC/Opus required."),
        ClientCategory.ANDROID_MOBILE, new AudioRestriction("mobile-no-passthrough",
            Set.of("truehd", "dts-hd ma", "dts-hd hra", "dts"), Severity.REQUIRE,
            "Mobile devices cannot pass through %s. Audio transcode required."),
        ClientCategory.ROKU, new AudioRestriction("roku-no-lossless",
            Set.of("truehd", "dts-hd ma"), Severity.REQUIRE,
            "Roku cannot decode or pass through %s. Audio transcode required."),
        ClientCategory.SWIFTFIN_IOS, new AudioRestriction("ios-no-dts",
            DTS_FAMILY, Severity.REQUIRE,
            "Apple platforms have no native DTS support. Audio transcode of %s required.")
    );

    /** Categories with full software decode or reliable passthrough. */
    private static final Set<ClientCategory> EXEMPT = EnumSet.of(ClientCategory.DESKTOP, ClientCategory.KODI);

    private static final AudioRestriction GENERIC_LOSSLESS = new AudioRestriction("generic-lossless-unsupported",
        MediaFormats.LOSSLESS_AUDIO, Severity.SUGGEST,
        "Lossless audio %s may not be supported. Audio transcode available as fallback.");

    @Override
    public String ruleId() {
        return "audio-passthrough";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
        String audioCodec = media.getAudioCodec();
        if (MediaFormats.isBlank(audioCodec) || EXEMPT.contains(client.getCategory())) {
            return Optional.empty();
        }

        AudioRestriction restriction = RESTRICTIONS.getOrDefault(client.getCategory(), GENERIC_LOSSLESS);
        if (!restriction.codecs().contains(audioCodec)) {
            return Optional.empty();
        }
        return Optional.of(RuleFinding.transcodeFallback(restriction.name(), restriction.severity(),
            restriction.reason().formatted(audioCodec)));
    }

    record AudioRestriction(String name, Set<String> codecs, Severity severity, String reason) {
    }
}
