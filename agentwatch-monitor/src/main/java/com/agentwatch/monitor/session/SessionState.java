package com.agentwatch.monitor.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a session snapshot, in display priority order.
 */
public enum SessionState {
    ACTIVE("active", 0),
    IDLE("idle", 1),
    COMPLETED("completed", 2),
    STALE("stale", 3);

    private final String wire;
    private final int priority;

    SessionState(String wire, int priority) {
        this.wire = wire;
        this.priority = priority;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Lower sorts first. */
    public int priority() {
        return priority;
    }

    public boolean isLive() {
        return this == ACTIVE || this == IDLE;
    }
}
