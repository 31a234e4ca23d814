package com.agentwatch.monitor.provider;

import com.agentwatch.monitor.session.MonitorStatus;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.TokenUsageReport;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read API shared by provider monitors and the cross-provider aggregator.
 */
public interface SessionSource {

    /** Provider name, or a fixed label for aggregates. */
    String name();

    /** Subscribe to refresh deliveries. */
    void onRefresh(RefreshListener listener);

    /** Non-stale sessions, state priority first, then most recent activity. */
    List<SessionSnapshot> getAll();

    MonitorStatus getStatus();

    TokenUsageReport getTokenUsageReport();

    /** Sessions in state active or idle. */
    default List<SessionSnapshot> getActive() {
        return getAll().stream().filter(s -> s.state().isLive()).toList();
    }

    /**
     * Look a session up by exact id, slug substring, id prefix or project
     * name substring, in that order. Matching is case-insensitive.
     */
    default Optional<SessionSnapshot> findSession(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String q = query.trim().toLowerCase(Locale.ROOT);
        List<SessionSnapshot> all = getAll();
        List<Predicate<SessionSnapshot>> matchers = List.of(
                s -> lower(s.sessionId()).equals(q),
                s -> lower(s.slug()).contains(q),
                s -> lower(s.sessionId()).startsWith(q),
                s -> lower(s.projectName()).contains(q));
        for (Predicate<SessionSnapshot> matcher : matchers) {
            Optional<SessionSnapshot> hit = all.stream().filter(matcher).findFirst();
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
