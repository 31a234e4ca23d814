package com.agentwatch.monitor.session;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One line of a {@link TokenUsageReport}.
 */
public record TokenUsageSession(
        String provider,
        String sessionId,
        String projectName,
        String slug,
        SessionState state,
        String model,
        TokenCounts tokens,
        double estimatedCostUsd,
        Instant lastActivity,
        String lastUserMessage,
        List<String> currentTools) {

    static final int SUMMARY_LENGTH = 60;
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    public TokenUsageSession {
        currentTools = currentTools == null ? List.of() : List.copyOf(currentTools);
    }

    public static TokenUsageSession from(SessionSnapshot snapshot, TokenPricing pricing) {
        return new TokenUsageSession(
                snapshot.provider(),
                snapshot.sessionId(),
                snapshot.projectName(),
                snapshot.slug(),
                snapshot.state(),
                snapshot.model(),
                snapshot.tokens(),
                pricing.estimateCost(snapshot.tokens()),
                snapshot.lastActivity(),
                snapshot.lastUserMessage(),
                snapshot.currentTools());
    }

    /**
     * Short human-readable description of what the session is doing: the last
     * user message without markup, else the current tool names. Empty when
     * neither is known.
     */
    public String summary() {
        if (lastUserMessage != null && !lastUserMessage.isBlank()) {
            String text = TAG.matcher(lastUserMessage).replaceAll("");
            text = LINE_BREAKS.matcher(text).replaceAll(" ").trim();
            if (!text.isEmpty()) {
                return text.length() > SUMMARY_LENGTH ? text.substring(0, SUMMARY_LENGTH) + "…" : text;
            }
        }
        if (!currentTools.isEmpty()) {
            return String.join(", ", currentTools);
        }
        return "";
    }
}
