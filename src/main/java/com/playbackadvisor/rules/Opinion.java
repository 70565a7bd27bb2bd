package com.playbackadvisor.rules;

/**
 * Three-valued flag for a policy dimension. NO_OPINION is distinct from DENY so that
 * a silent finding never overrides a lower-severity one that did speak.
 */
public enum Opinion {
    ALLOW,
    DENY,
    NO_OPINION;

    public boolean isExpressed() {
        return this != NO_OPINION;
    }

    public boolean allows() {
        if (this == NO_OPINION) {
            throw new IllegalStateException("NO_OPINION has no boolean value");
        }
        return this == ALLOW;
    }
}
