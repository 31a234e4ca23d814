package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code message} payload of a transcript entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        String role,
        String model,
        @JsonProperty("stop_reason") String stopReason,
        MessageContent content,
        TokenUsage usage) {
}
