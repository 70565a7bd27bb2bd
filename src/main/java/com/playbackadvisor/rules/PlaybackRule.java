package com.playbackadvisor.rules;

import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.model.MediaCharacteristics;

import java.util.Optional;

/**
 * A single static compatibility rule. Rules encode hand-curated facts, never statistics:
 * they must not read or write confidence, must not mutate their inputs, and must return
 * the same finding for the same inputs.
 */
public interface PlaybackRule {

    /** Unique rule identifier, e.g. "bitrate-cap". */
    String ruleId();

    /** Version of the rule's fact table, e.g. "v1". */
    String ruleVersion();

    /**
     * @return a finding when the rule applies to this client and media, empty otherwise
     */
    Optional<RuleFinding> evaluate(ClientProfile client, MediaCharacteristics media);
}
