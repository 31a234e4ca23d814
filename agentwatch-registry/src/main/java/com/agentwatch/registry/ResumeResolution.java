package com.agentwatch.registry;

/**
 * Outcome of {@link SessionRegistry#resolveResumeTarget}. Either {@code ok}
 * with a source and record, or not found with a message for the user.
 */
public record ResumeResolution(boolean ok, ResumeSource source, SessionRegistryRecord record,
        String reason, String message) {

    public static final String NOT_FOUND = "not_found";

    public static ResumeResolution found(ResumeSource source, SessionRegistryRecord record) {
        return new ResumeResolution(true, source, record, null, null);
    }

    public static ResumeResolution notFound(String message) {
        return new ResumeResolution(false, null, null, NOT_FOUND, message);
    }
}
