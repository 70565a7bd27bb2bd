package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default bandwidth ceilings for categories that commonly sit on constrained links
 * (cellular, Wi-Fi sticks, DLNA renderers). Independent of codec and container.
 */
public class BitrateCapRule implements PlaybackRule {

    private static final long MOBILE_CAP = 8_000_000L;
    private static final long ROKU_CAP = 20_000_000L;
    private static final long DLNA_CAP = 15_000_000L;

    private static final Map<ClientCategory, Long> DEFAULT_CAPS = Map.of(
        ClientCategory.ANDROID_MOBILE, MOBILE_CAP,
        ClientCategory.SWIFTFIN_IOS, MOBILE_CAP,
        ClientCategory.ROKU, ROKU_CAP,
        ClientCategory.DLNA, DLNA_CAP
    );

    @Override
    public String ruleId() {
        return "bitrate-cap";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
        Long bitrate = media.getBitrate();
        Long cap = DEFAULT_CAPS.get(client.getCategory());
        if (bitrate == null || cap == null || bitrate <= cap) {
            return Optional.empty();
        }

        return Optional.of(RuleFinding.bitrateCap(
            "bitrate-cap-" + client.getCategory().getValue(),
            cap,
            String.format(Locale.ROOT, "Media bitrate %.1f Mbps exceeds %s default cap of %.1f Mbps.",
                bitrate / 1_000_000.0, client.getCategory().getValue(), cap / 1_000_000.0)));
    }
}
