package com.agentwatch.monitor.session;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Token usage and estimated cost over the live sessions of one provider, or
 * of all providers when produced by the aggregator.
 */
public record TokenUsageReport(
        Instant timestamp,
        List<TokenUsageSession> sessions,
        TokenTotals totals,
        int activeCount,
        int totalCount) {

    public static final Comparator<TokenUsageSession> DISPLAY_ORDER = Comparator
            .comparingInt((TokenUsageSession s) -> s.state().priority())
            .thenComparing(TokenUsageSession::lastActivity,
                    Comparator.nullsLast(Comparator.reverseOrder()));

    public TokenUsageReport {
        sessions = List.copyOf(sessions);
    }

    /**
     * Builds a report for the given snapshots, pricing each with the
     * provider's own rates.
     */
    public static TokenUsageReport of(List<SessionSnapshot> snapshots, TokenPricing pricing,
            int totalCount, Instant timestamp) {
        TokenTotals totals = TokenTotals.ZERO;
        List<TokenUsageSession> lines = snapshots.stream()
                .map(s -> TokenUsageSession.from(s, pricing))
                .sorted(DISPLAY_ORDER)
                .toList();
        for (TokenUsageSession line : lines) {
            totals = totals.plus(line.tokens(), line.estimatedCostUsd());
        }
        int active = (int) snapshots.stream().filter(s -> s.state() == SessionState.ACTIVE).count();
        return new TokenUsageReport(timestamp, lines, totals, active, totalCount);
    }
}
