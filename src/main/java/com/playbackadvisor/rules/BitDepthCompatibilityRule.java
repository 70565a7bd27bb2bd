package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Flags bit depths with poor decoder support. 10-bit H.264 (Hi10P) has essentially no
 * hardware decoders; 12-bit video only plays on clients with a full software decoder.
 */
public class BitDepthCompatibilityRule implements PlaybackRule {

    private static final Set<ClientCategory> SOFTWARE_DECODE_12_BIT =
        EnumSet.of(ClientCategory.DESKTOP, ClientCategory.KODI);

    @Override
    public String ruleId() {
        return "bit-depth-compatibility";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
        Integer bitDepth = media.getBitDepth();
        if (bitDepth == null || bitDepth <= 8) {
            return Optional.empty();
        }

        if (bitDepth >= 10 && MediaFormats.isH264(media.getVideoCodec())) {
            return Optional.of(RuleFinding.transcode("h264-hi10p", Severity.REQUIRE,
                "H.264 Hi10P (10-bit) has no hardware decoder on mainstream clients. Transcode required."));
        }

        if (bitDepth >= 12 && !SOFTWARE_DECODE_12_BIT.contains(client.getCategory())) {
            return Optional.of(RuleFinding.transcode("12-bit-video", Severity.RECOMMEND,
                "12-bit video has very limited client support. Transcode recommended."));
        }

        return Optional.empty();
    }
}
