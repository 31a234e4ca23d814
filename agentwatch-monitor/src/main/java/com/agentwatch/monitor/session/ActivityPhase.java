package com.agentwatch.monitor.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained interaction state of an active session.
 */
public enum ActivityPhase {
    /** Waiting for the user to answer a question. */
    WAITING_QUESTION("waiting_question"),
    /** Waiting for a tool approval. */
    WAITING_PERMISSION("waiting_permission"),
    /** Turn finished, ready for input. */
    INTERACTABLE("interactable"),
    /** Generating a response or running tools. */
    BUSY("busy");

    private final String wire;

    ActivityPhase(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
