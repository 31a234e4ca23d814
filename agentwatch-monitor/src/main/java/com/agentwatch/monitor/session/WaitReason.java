package com.agentwatch.monitor.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a session is blocked on a pending tool invocation.
 */
public enum WaitReason {
    /** The pending tool is the interactive question tool. */
    USER_QUESTION("user_question"),
    /** Some other tool is waiting for approval. */
    PERMISSION("permission");

    /** Name of the tool that asks the user a question. */
    public static final String ASK_USER_QUESTION_TOOL = "AskUserQuestion";

    private final String wire;

    WaitReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
