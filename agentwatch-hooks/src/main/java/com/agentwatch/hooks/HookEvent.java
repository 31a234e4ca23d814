package com.agentwatch.hooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Hook payload posted by an agent CLI. Unknown fields are ignored and a
 * missing provider means {@value #DEFAULT_PROVIDER}.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookEvent(
        @JsonProperty("hook_event_name") String hookEventName,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("cwd") String cwd,
        @JsonProperty("transcript_path") String transcriptPath,
        @JsonProperty("provider") String provider,
        @JsonProperty("permission_mode") String permissionMode,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("source") String source,
        @JsonProperty("model") String model,
        @JsonProperty("reason") String reason,
        @JsonProperty("notification_type") String notificationType,
        @JsonProperty("message") String message,
        @JsonProperty("title") String title) {

    public static final String DEFAULT_PROVIDER = "claude";

    public static final String STOP = "Stop";
    public static final String USER_PROMPT_SUBMIT = "UserPromptSubmit";
    public static final String SESSION_START = "SessionStart";
    public static final String SESSION_END = "SessionEnd";
    public static final String NOTIFICATION = "Notification";

    public static final String PERMISSION_PROMPT = "permission_prompt";
    public static final String IDLE_PROMPT = "idle_prompt";
    public static final String ELICITATION_DIALOG = "elicitation_dialog";

    public HookEvent {
        if (provider == null || provider.isBlank()) {
            provider = DEFAULT_PROVIDER;
        }
    }
}
