package com.playbackadvisor.rules;

import java.util.Objects;

/**
 * What one rule concluded for one decision call. Never persisted.
 *
 * @param findingName short identifier of the specific fact that fired, used in the rationale
 * @param bitrateCap  recommended ceiling in bits/sec, or null
 */
public record RuleFinding(
    String findingName,
    Opinion directPlay,
    Opinion directStream,
    Opinion transcoding,
    Long bitrateCap,
    Severity severity,
    String rationale
) {

    public RuleFinding {
        Objects.requireNonNull(findingName, "findingName");
        Objects.requireNonNull(severity, "severity");
        directPlay = directPlay != null ? directPlay : Opinion.NO_OPINION;
        directStream = directStream != null ? directStream : Opinion.NO_OPINION;
        transcoding = transcoding != null ? transcoding : Opinion.NO_OPINION;
        rationale = rationale != null ? rationale : "";
    }

    /** Container must change: no direct play, remux is fine. */
    public static RuleFinding remux(String findingName, Severity severity, String rationale) {
        return new RuleFinding(findingName, Opinion.DENY, Opinion.ALLOW, Opinion.NO_OPINION,
            null, severity, rationale);
    }

    /** Stream content must be re-encoded: no direct play, allow transcoding. */
    public static RuleFinding transcode(String findingName, Severity severity, String rationale) {
        return new RuleFinding(findingName, Opinion.DENY, Opinion.NO_OPINION, Opinion.ALLOW,
            null, severity, rationale);
    }

    /** Only makes sure transcoding stays available; says nothing about direct play. */
    public static RuleFinding transcodeFallback(String findingName, Severity severity, String rationale) {
        return new RuleFinding(findingName, Opinion.NO_OPINION, Opinion.NO_OPINION, Opinion.ALLOW,
            null, severity, rationale);
    }

    public static RuleFinding bitrateCap(String findingName, long cap, String rationale) {
        return new RuleFinding(findingName, Opinion.NO_OPINION, Opinion.NO_OPINION, Opinion.ALLOW,
            cap, Severity.SUGGEST, rationale);
    }
}
