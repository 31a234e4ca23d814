package com.agentwatch.monitor.session;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one transcript tail, produced by {@link SessionInfoReducer}.
 * Identity strings are empty (not null) when never seen.
 */
@Builder
public record SessionInfo(
        String sessionId,
        String slug,
        String cwd,
        String gitBranch,
        String version,
        String model,
        int turnCount,
        String lastUserMessage,
        List<String> currentTools,
        TokenCounts tokens,
        Instant startedAt,
        Instant lastActivity,
        WaitReason waitReason,
        List<String> waitToolNames,
        String lastAssistantStopReason) {

    public SessionInfo {
        currentTools = currentTools == null ? List.of() : List.copyOf(currentTools);
        waitToolNames = waitToolNames == null ? List.of() : List.copyOf(waitToolNames);
        tokens = tokens == null ? TokenCounts.ZERO : tokens;
    }
}
