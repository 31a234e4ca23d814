package com.agentwatch.monitor.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * One parsed transcript line, discriminated by its {@code type} field.
 * <p>
 * {@code system}, {@code user} and {@code assistant} lines get their own
 * variant; every other type (summaries, file snapshots, ...) lands in
 * {@link OtherEntry}, which still contributes identity fields and timestamps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", visible = true,
        defaultImpl = LogEntry.OtherEntry.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogEntry.SystemEntry.class, name = "system"),
        @JsonSubTypes.Type(value = LogEntry.UserEntry.class, name = "user"),
        @JsonSubTypes.Type(value = LogEntry.AssistantEntry.class, name = "assistant")
})
public sealed interface LogEntry {

    String sessionId();

    String slug();

    String cwd();

    String gitBranch();

    String version();

    Instant timestamp();

    Message message();

    /**
     * Blocks of the message content; empty for plain-text or missing content.
     */
    default List<ContentBlock> blocks() {
        Message message = message();
        if (message == null || message.content() == null) {
            return List.of();
        }
        return message.content().blocks();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SystemEntry(
            String sessionId,
            String slug,
            String cwd,
            String gitBranch,
            String version,
            Instant timestamp,
            Message message) implements LogEntry {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UserEntry(
            String sessionId,
            String slug,
            String cwd,
            String gitBranch,
            String version,
            Instant timestamp,
            Message message) implements LogEntry {

        /**
         * The user's visible text: the plain-string content, or the first
         * non-empty text block. Tool-result-only entries have none.
         */
        public String text() {
            if (message == null || message.content() == null) {
                return null;
            }
            MessageContent content = message.content();
            if (content.text() != null) {
                return content.text().isEmpty() ? null : content.text();
            }
            return content.blocks().stream()
                    .filter(ContentBlock::isText)
                    .map(ContentBlock::text)
                    .filter(t -> t != null && !t.isEmpty())
                    .findFirst()
                    .orElse(null);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AssistantEntry(
            String sessionId,
            String slug,
            String cwd,
            String gitBranch,
            String version,
            Instant timestamp,
            Message message) implements LogEntry {

        /**
         * Tool invocations carried by this entry, in block order.
         */
        public List<ContentBlock> toolUses() {
            return blocks().stream().filter(ContentBlock::isToolUse).toList();
        }

        public String model() {
            return message != null ? message.model() : null;
        }

        public String stopReason() {
            return message != null ? message.stopReason() : null;
        }

        public TokenUsage usage() {
            return message != null ? message.usage() : null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OtherEntry(
            String type,
            String sessionId,
            String slug,
            String cwd,
            String gitBranch,
            String version,
            Instant timestamp,
            Message message) implements LogEntry {
    }
}
