package com.agentwatch.monitor.session;

import java.time.Instant;
import java.util.List;

/**
 * Read-only status of a monitor or aggregator: the current non-stale
 * sessions and when they were last computed.
 *
 * @param activeCount sessions in state active or idle
 * @param lastRefresh null until the first refresh
 */
public record MonitorStatus(List<SessionSnapshot> sessions, int activeCount, int totalCount,
        Instant lastRefresh) {

    public MonitorStatus {
        sessions = List.copyOf(sessions);
    }

    public static MonitorStatus of(List<SessionSnapshot> sessions, Instant lastRefresh) {
        int active = (int) sessions.stream().filter(s -> s.state().isLive()).count();
        return new MonitorStatus(sessions, active, sessions.size(), lastRefresh);
    }
}
