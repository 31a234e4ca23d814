package com.agentwatch.monitor.session;

import lombok.Builder;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Point-in-time view of one session from one provider. Snapshots are values:
 * a refresh or hook update produces a new instance via {@link #toBuilder()}.
 */
@Builder(toBuilder = true)
public record SessionSnapshot(
        String provider,
        String sessionId,
        String projectPath,
        String projectName,
        String slug,
        SessionState state,
        Integer pid,
        Double cpuPercent,
        Double memMb,
        String model,
        String gitBranch,
        String version,
        int turnCount,
        String lastUserMessage,
        List<String> currentTools,
        TokenCounts tokens,
        WaitReason waitReason,
        List<String> waitToolNames,
        Instant startedAt,
        Instant lastActivity,
        ActivityPhase activityPhase,
        Path transcriptPath) {

    /** State priority ascending, then most recent activity first. */
    public static final Comparator<SessionSnapshot> DISPLAY_ORDER = Comparator
            .comparingInt((SessionSnapshot s) -> s.state().priority())
            .thenComparing(SessionSnapshot::lastActivity,
                    Comparator.nullsLast(Comparator.reverseOrder()));

    public SessionSnapshot {
        currentTools = currentTools == null ? List.of() : List.copyOf(currentTools);
        waitToolNames = waitToolNames == null ? List.of() : List.copyOf(waitToolNames);
        tokens = tokens == null ? TokenCounts.ZERO : tokens;
    }

    public String dedupKey() {
        return dedupKey(provider, sessionId);
    }

    public static String dedupKey(String provider, String sessionId) {
        return provider + ":" + sessionId;
    }

    public boolean hasProcess() {
        return pid != null;
    }
}
