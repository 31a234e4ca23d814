package com.agentwatch.monitor.aggregate;

import com.agentwatch.monitor.provider.RefreshListener;
import com.agentwatch.monitor.provider.SessionSource;
import com.agentwatch.monitor.session.MonitorStatus;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;
import com.agentwatch.monitor.session.TokenTotals;
import com.agentwatch.monitor.session.TokenUsageReport;
import com.agentwatch.monitor.session.TokenUsageSession;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges the snapshot lists of several provider monitors into one
 * deduplicated, ordered view.
 * <p>
 * Every provider delivery replaces that provider's slot and requests a merge.
 * Merge passes never overlap: a request that arrives while a pass is running
 * marks one extra pass, and any further requests before that pass starts
 * collapse into it. The extra pass runs on the thread that ran the in-flight
 * pass. Listeners are invoked one after another in registration order, each
 * isolated from the others' failures.
 */
@Slf4j
public class SessionAggregator implements SessionSource {

    public static final String NAME = "all";

    private final Clock clock;
    private final Map<String, SessionSource> sources = new LinkedHashMap<>();
    private final Map<String, List<SessionSnapshot>> slots = new LinkedHashMap<>();
    private final List<RefreshListener> listeners = new CopyOnWriteArrayList<>();

    private final Object mergeLock = new Object();
    private boolean mergeRunning;
    private boolean mergeQueued;

    private volatile List<SessionSnapshot> merged = List.of();
    private volatile Instant lastRefresh;

    public SessionAggregator() {
        this(Clock.systemUTC());
    }

    public SessionAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Subscribe to a provider. Its current sessions seed the slot; the next
     * merge happens on its first delivery.
     */
    public void register(SessionSource source) {
        String name = source.name();
        synchronized (slots) {
            if (sources.containsKey(name)) {
                throw new IllegalStateException("Provider already registered: " + name);
            }
            sources.put(name, source);
            slots.put(name, List.copyOf(source.getAll()));
        }
        source.onRefresh(snapshots -> {
            synchronized (slots) {
                slots.put(name, List.copyOf(snapshots));
            }
            requestMerge();
        });
        log.info("Aggregator registered provider {}", name);
    }

    public List<String> providerNames() {
        synchronized (slots) {
            return List.copyOf(sources.keySet());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onRefresh(RefreshListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // =========================================================================
    // Coalesced merge
    // =========================================================================

    /**
     * Run a merge pass now, or queue one extra pass if a pass is in flight.
     * Returns once this thread has no more passes to run.
     */
    public void requestMerge() {
        synchronized (mergeLock) {
            if (mergeRunning) {
                mergeQueued = true;
                return;
            }
            mergeRunning = true;
        }
        boolean finished = false;
        try {
            do {
                runMergePass();
            } while (takeQueuedPass());
            finished = true;
        } finally {
            if (!finished) {
                synchronized (mergeLock) {
                    mergeRunning = false;
                    mergeQueued = false;
                }
            }
        }
    }

    private boolean takeQueuedPass() {
        synchronized (mergeLock) {
            if (mergeQueued) {
                mergeQueued = false;
                return true;
            }
            mergeRunning = false;
            return false;
        }
    }

    private void runMergePass() {
        lastRefresh = clock.instant();
        List<SessionSnapshot> result = merge(currentSlots());
        merged = result;
        log.debug("Aggregator merged {} sessions", result.size());
        for (RefreshListener listener : listeners) {
            try {
                listener.onRefresh(result);
            } catch (Exception e) {
                log.error("Aggregator listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private List<List<SessionSnapshot>> currentSlots() {
        synchronized (slots) {
            return new ArrayList<>(slots.values());
        }
    }

    /**
     * Dedupe by {@code provider:sessionId} keeping the fresher snapshot, drop
     * stale sessions and sort for display.
     */
    static List<SessionSnapshot> merge(List<List<SessionSnapshot>> lists) {
        Map<String, SessionSnapshot> byKey = new LinkedHashMap<>();
        for (List<SessionSnapshot> list : lists) {
            for (SessionSnapshot snapshot : list) {
                byKey.merge(snapshot.dedupKey(), snapshot, SessionAggregator::fresher);
            }
        }
        return byKey.values().stream()
                .filter(s -> s.state() != SessionState.STALE)
                .sorted(SessionSnapshot.DISPLAY_ORDER)
                .toList();
    }

    private static SessionSnapshot fresher(SessionSnapshot a, SessionSnapshot b) {
        if (a.lastActivity() == null) {
            return b;
        }
        if (b.lastActivity() == null) {
            return a;
        }
        return b.lastActivity().isAfter(a.lastActivity()) ? b : a;
    }

    // =========================================================================
    // Read API
    // =========================================================================

    @Override
    public List<SessionSnapshot> getAll() {
        return merged;
    }

    @Override
    public MonitorStatus getStatus() {
        return MonitorStatus.of(merged, lastRefresh);
    }

    /**
     * Concatenates the providers' own reports. Costs are taken as reported,
     * so each provider's pricing applies to its sessions.
     */
    @Override
    public TokenUsageReport getTokenUsageReport() {
        List<SessionSource> current;
        synchronized (slots) {
            current = new ArrayList<>(sources.values());
        }
        List<TokenUsageSession> lines = new ArrayList<>();
        TokenTotals totals = TokenTotals.ZERO;
        int activeCount = 0;
        int totalCount = 0;
        for (SessionSource source : current) {
            TokenUsageReport report = source.getTokenUsageReport();
            lines.addAll(report.sessions());
            totals = totals.plus(report.totals());
            activeCount += report.activeCount();
            totalCount += report.totalCount();
        }
        lines.sort(TokenUsageReport.DISPLAY_ORDER);
        return new TokenUsageReport(clock.instant(), lines, totals, activeCount, totalCount);
    }

    public Instant getLastRefresh() {
        return lastRefresh;
    }
}
