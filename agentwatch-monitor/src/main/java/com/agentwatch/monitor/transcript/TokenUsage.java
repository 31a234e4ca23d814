package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-message token counters reported by the provider. Missing counters read
 * as zero.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenUsage(
        @JsonProperty("input_tokens") long inputTokens,
        @JsonProperty("output_tokens") long outputTokens,
        @JsonProperty("cache_read_input_tokens") long cacheReadInputTokens,
        @JsonProperty("cache_creation_input_tokens") long cacheCreationInputTokens) {
}
