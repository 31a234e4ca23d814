package com.agentwatch.hooks;

/**
 * Outcome of {@link HookEventDispatcher#dispatch}. Rejected events had no
 * side effects.
 */
public record HookDispatchResult(Status status, String message) {

    public enum Status {
        ACCEPTED,
        INVALID_JSON,
        MISSING_FIELDS,
        UNKNOWN_PROVIDER
    }

    public static HookDispatchResult accepted() {
        return new HookDispatchResult(Status.ACCEPTED, null);
    }

    public static HookDispatchResult rejected(Status status, String message) {
        return new HookDispatchResult(status, message);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
