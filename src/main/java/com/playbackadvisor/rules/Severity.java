package com.playbackadvisor.rules;

/**
 * How certain a rule is. Higher severity wins when findings disagree on a dimension.
 * Declaration order is significant.
 */
public enum Severity {
    /** Soft hint, other signals may override it. */
    SUGGEST,
    RECOMMEND,
    /** Known incompatibility: ignoring it makes playback fail. */
    REQUIRE
}
