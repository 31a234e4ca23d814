package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One typed block of structured message content.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentBlock(
        String type,
        String text,
        String id,
        String name,
        @JsonProperty("tool_use_id") String toolUseId,
        @JsonProperty("is_error") Boolean isError) {

    public static final String TEXT = "text";
    public static final String TOOL_USE = "tool_use";
    public static final String TOOL_RESULT = "tool_result";

    public static ContentBlock textBlock(String text) {
        return new ContentBlock(TEXT, text, null, null, null, null);
    }

    public static ContentBlock toolUseBlock(String id, String name) {
        return new ContentBlock(TOOL_USE, null, id, name, null, null);
    }

    public static ContentBlock toolResultBlock(String toolUseId) {
        return new ContentBlock(TOOL_RESULT, null, null, null, toolUseId, null);
    }

    public boolean isText() {
        return TEXT.equals(type);
    }

    public boolean isToolUse() {
        return TOOL_USE.equals(type);
    }

    public boolean isToolResult() {
        return TOOL_RESULT.equals(type);
    }
}
