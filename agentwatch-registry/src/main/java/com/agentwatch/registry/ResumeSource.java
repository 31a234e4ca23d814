package com.agentwatch.registry;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which resolution step produced a resume target.
 */
public enum ResumeSource {
    EXPLICIT("explicit"),
    THREAD("thread"),
    RECENT("recent");

    private final String wire;

    ResumeSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
