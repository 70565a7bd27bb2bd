package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;
import com.playbackadvisor.model.MediaFormats;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known container and codec-in-container incompatibilities per client category.
 * Constraints for a category are checked in table order; the first match is the finding.
 */
public class ContainerCodecCompatibilityRule implements PlaybackRule {

    private static final Map<ClientCategory, List<Constraint>> CONSTRAINTS = Map.of(
        ClientCategory.ROKU, List.of(
            new UnsupportedContainer("roku-mkv-unsupported", Set.of("mkv"), Severity.REQUIRE,
                "Roku cannot play %s containers natively. Remux to MP4/HLS required."),
            new CodecContainerMismatch("roku-hevc-container-mismatch", MediaFormats.HEVC,
                MediaFormats.UNIVERSAL_CONTAINERS, Severity.REQUIRE,
                "Roku only plays HEVC inside MP4/M4V/MOV, not %s.")
        ),
        ClientCategory.WEB_BROWSER, List.of(
            new UnsupportedContainer("web-container-unsupported", Set.of("mkv", "avi", "wmv", "flv"),
                Severity.REQUIRE, "Web browsers cannot play %s containers natively. Remux required."),
            new UnsupportedCodec("web-hevc-limited", MediaFormats.HEVC, Severity.RECOMMEND,
                "Most web browsers cannot decode %s. Transcode to H.264 required.")
        ),
        ClientCategory.SWIFTFIN_IOS, List.of(
            new UnsupportedContainer("swiftfin-container-limited", Set.of("webm", "avi"), Severity.RECOMMEND,
                "Swiftfin has limited support for %s. Remux recommended.")
        ),
        ClientCategory.SWIFTFIN_TVOS, List.of(
            new UnsupportedContainer("swiftfin-container-limited", Set.of("webm", "avi"), Severity.RECOMMEND,
                "Swiftfin has limited support for %s. Remux recommended.")
        ),
        ClientCategory.XBOX, List.of(
            new UnsupportedContainer("xbox-container-limited", Set.of("mkv", "webm"), Severity.RECOMMEND,
                "Xbox has limited %s support. Remux to MP4 recommended.")
        ),
        ClientCategory.DLNA, List.of(
            new UnsupportedContainer("dlna-container-incompatible", Set.of("mkv", "webm"), Severity.REQUIRE,
                "Most DLNA renderers cannot play %s. Remux to MPEG-TS/MP4.")
        )
    );

    @Override
    public String ruleId() {
        return "container-codec-compatibility";
    }

    @Override
    public String ruleVersion() {
        return "v1";
    }

    @Override
    public Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media) {
        if (MediaFormats.isBlank(media.getContainer()) || MediaFormats.isBlank(media.getVideoCodec())) {
            return Optional.empty();
        }

        for (Constraint constraint : CONSTRAINTS.getOrDefault(client.getCategory(), List.of())) {
            Optional<RuleFinding> finding = constraint.apply(media);
            if (finding.isPresent()) {
                return finding;
            }
        }
        return Optional.empty();
    }

    sealed interface Constraint permits UnsupportedContainer, CodecContainerMismatch, UnsupportedCodec {
        Optional<RuleFinding> apply(MediaCharacteristics media);
    }

    /** The container itself cannot be opened; repackaging fixes it. */
    record UnsupportedContainer(String name, Set<String> containers, Severity severity, String reason)
        implements Constraint {

        @Override
        public Optional<RuleFinding> apply(MediaCharacteristics media) {
            if (!containers.contains(media.getContainer())) {
                return Optional.empty();
            }
            return Optional.of(RuleFinding.remux(name, severity, reason.formatted(media.getContainer())));
        }
    }

    /** The codec plays only inside specific containers; repackaging fixes it. */
    record CodecContainerMismatch(String name, Set<String> codecs, Set<String> supportedContainers,
                                  Severity severity, String reason) implements Constraint {

        @Override
        public Optional<RuleFinding> apply(MediaCharacteristics media) {
            if (!codecs.contains(media.getVideoCodec()) || supportedContainers.contains(media.getContainer())) {
                return Optional.empty();
            }
            return Optional.of(RuleFinding.remux(name, severity, reason.formatted(media.getContainer())));
        }
    }

    /** The codec cannot be decoded at all; only a transcode fixes it. */
    record UnsupportedCodec(String name, Set<String> codecs, Severity severity, String reason)
        implements Constraint {

        @Override
        public Optional<RuleFinding> apply(MediaCharacteristics media) {
            if (!codecs.contains(media.getVideoCodec())) {
                return Optional.empty();
            }
            return Optional.of(RuleFinding.transcode(name, severity, reason.formatted(media.getVideoCodec())));
        }
    }
}
