package com.agentwatch.monitor.provider;

import com.agentwatch.monitor.session.ActivityPhase;
import com.agentwatch.monitor.session.ActivityPhaseClassifier;
import com.agentwatch.monitor.session.MonitorStatus;
import com.agentwatch.monitor.session.SessionInfo;
import com.agentwatch.monitor.session.SessionInfoReducer;
import com.agentwatch.monitor.session.SessionSnapshot;
import com.agentwatch.monitor.session.SessionState;
import com.agentwatch.monitor.session.TokenCounts;
import com.agentwatch.monitor.session.TokenPricing;
import com.agentwatch.monitor.session.TokenUsageReport;
import com.agentwatch.monitor.transcript.LogEntry;
import com.agentwatch.monitor.transcript.TranscriptTailer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks the sessions of one provider.
 * <p>
 * Each {@link #refresh()} asks discovery for processes and transcripts, tails
 * and reduces every transcript whose modification time changed since the
 * previous refresh, derives lifecycle state and activity phase, and delivers
 * the resulting list to every {@link RefreshListener}. Sessions without a
 * live process whose transcript is older than the staleness horizon are
 * dropped from the list.
 * <p>
 * Listeners run outside the state lock. A delivery requested while another
 * is in progress is folded into one follow-up delivery of the latest list,
 * so listeners always see lists in the order the state changed.
 */
@Slf4j
public class ProviderSessionMonitor implements SessionSource, HookAcceptingMonitor {

    private static final int SLUG_LENGTH = 8;

    private final String provider;
    private final SessionDiscovery discovery;
    private final MonitorSettings settings;
    private final TokenPricing pricing;
    private final TranscriptTailer tailer;
    private final SessionInfoReducer reducer;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, SessionSnapshot> sessions = new ConcurrentHashMap<>();
    private final List<RefreshListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private final Map<Path, CachedTranscript> transcriptCache = new HashMap<>();
    private final Set<String> skeletonIds = new HashSet<>();

    private final Object deliveryLock = new Object();
    private boolean delivering;
    private boolean deliveryPending;

    private volatile Instant lastRefresh;

    private record CachedTranscript(long lastModifiedMs, SessionInfo info) {
    }

    public ProviderSessionMonitor(String provider, SessionDiscovery discovery,
            MonitorSettings settings, TokenPricing pricing) {
        this(provider, discovery, settings, pricing, new SessionInfoReducer(), Clock.systemUTC());
    }

    public ProviderSessionMonitor(String provider, SessionDiscovery discovery,
            MonitorSettings settings, TokenPricing pricing, SessionInfoReducer reducer, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pricing = pricing != null ? pricing : TokenPricing.FREE;
        this.tailer = new TranscriptTailer(settings.tailBytes());
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return provider;
    }

    @Override
    public void onRefresh(RefreshListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // =========================================================================
    // Refresh
    // =========================================================================

    /**
     * Run one refresh cycle. A discovery failure aborts the cycle: the
     * previous sessions stay in place and nothing is delivered.
     */
    public void refresh() {
        if (refreshState()) {
            publish();
        }
    }

    private boolean refreshState() {
        synchronized (lock) {
            Instant now = clock.instant();

            List<AgentProcess> processes;
            List<TranscriptFile> transcripts;
            try {
                processes = discovery.listProcesses();
                transcripts = discovery.listTranscripts();
            } catch (IOException | RuntimeException e) {
                log.error("Monitor {} discovery failed: {}", provider, e.getMessage(), e);
                return false;
            }

            Map<String, SessionSnapshot> next = new LinkedHashMap<>();
            Set<Path> seen = new HashSet<>();
            ProcessMatcher matcher = new ProcessMatcher(processes);

            List<TranscriptFile> newestFirst = new ArrayList<>(transcripts);
            newestFirst.sort(Comparator.comparingLong(TranscriptFile::lastModifiedMs).reversed());

            for (TranscriptFile file : newestFirst) {
                if (next.containsKey(file.sessionId())) {
                    continue;
                }
                try {
                    SessionSnapshot snapshot = track(file, matcher, now, seen);
                    if (snapshot != null) {
                        next.put(file.sessionId(), snapshot);
                    }
                } catch (RuntimeException e) {
                    log.warn("Monitor {} skipping transcript {}: {}", provider, file.path(), e.getMessage(), e);
                    seen.remove(file.path());
                    transcriptCache.remove(file.path());
                }
            }

            transcriptCache.keySet().retainAll(seen);
            retainSkeletons(next, now);

            sessions.keySet().retainAll(next.keySet());
            sessions.putAll(next);
            lastRefresh = now;
            log.debug("Monitor {} refreshed: {} sessions from {} transcripts, {} processes",
                    provider, next.size(), transcripts.size(), processes.size());
            return true;
        }
    }

    /**
     * Snapshot for one transcript, or null when it is stale or has no entries.
     */
    private SessionSnapshot track(TranscriptFile file, ProcessMatcher matcher, Instant now, Set<Path> seen) {
        AgentProcess process = matcher.match(file);
        long ageMs = now.toEpochMilli() - file.lastModifiedMs();
        SessionState state = lifecycleState(process != null, ageMs);
        if (state == SessionState.STALE) {
            return null;
        }
        seen.add(file.path());

        CachedTranscript cached = transcriptCache.get(file.path());
        boolean unchanged = cached != null && cached.lastModifiedMs() == file.lastModifiedMs();
        SessionInfo info;
        if (unchanged) {
            log.debug("Monitor {} cache hit: {}", provider, file.path());
            info = cached.info();
        } else {
            info = load(file);
            if (info == null) {
                return null;
            }
        }
        return buildSnapshot(file, info, process, state, unchanged);
    }

    private SessionState lifecycleState(boolean hasProcess, long ageMs) {
        if (hasProcess) {
            return ageMs <= settings.activeWindowMs() ? SessionState.ACTIVE : SessionState.IDLE;
        }
        return ageMs <= settings.staleAfterMs() ? SessionState.COMPLETED : SessionState.STALE;
    }

    /**
     * Tail and reduce a changed transcript and cache the result. Null for
     * transcripts with no parseable entries.
     */
    private SessionInfo load(TranscriptFile file) {
        List<LogEntry> entries = tailer.tail(file.path());
        if (entries.isEmpty()) {
            transcriptCache.remove(file.path());
            return null;
        }
        SessionInfo info = reducer.reduce(entries);
        transcriptCache.put(file.path(), new CachedTranscript(file.lastModifiedMs(), info));
        return info;
    }

    private SessionSnapshot buildSnapshot(TranscriptFile file, SessionInfo info,
            AgentProcess process, SessionState state, boolean unchanged) {
        SessionSnapshot previous = sessions.get(file.sessionId());
        ActivityPhase phase = null;
        if (state == SessionState.ACTIVE) {
            // A hook-reported phase holds until the transcript changes
            boolean keepPhase = unchanged && previous != null && previous.activityPhase() != null;
            phase = keepPhase ? previous.activityPhase() : ActivityPhaseClassifier.classify(info);
        }

        String projectPath = !info.cwd().isEmpty() ? info.cwd() : file.projectPath();
        return SessionSnapshot.builder()
                .provider(provider)
                .sessionId(file.sessionId())
                .projectPath(projectPath)
                .projectName(projectName(projectPath))
                .slug(!info.slug().isEmpty() ? info.slug() : shortId(file.sessionId()))
                .state(state)
                .pid(process != null ? process.pid() : null)
                .cpuPercent(process != null ? process.cpuPercent() : null)
                .memMb(process != null ? process.memMb() : null)
                .model(info.model())
                .gitBranch(info.gitBranch())
                .version(info.version())
                .turnCount(info.turnCount())
                .lastUserMessage(info.lastUserMessage())
                .currentTools(info.currentTools())
                .tokens(info.tokens())
                .waitReason(info.waitReason())
                .waitToolNames(info.waitToolNames())
                .startedAt(info.startedAt())
                .lastActivity(info.lastActivity())
                .activityPhase(phase)
                .transcriptPath(file.path())
                .build();
    }

    /**
     * Hook-registered sessions that discovery has not reported yet survive
     * while they are younger than the active window.
     */
    private void retainSkeletons(Map<String, SessionSnapshot> next, Instant now) {
        skeletonIds.removeIf(next::containsKey);
        skeletonIds.removeIf(id -> {
            SessionSnapshot skeleton = sessions.get(id);
            if (skeleton == null) {
                return true;
            }
            long ageMs = now.toEpochMilli() - skeleton.startedAt().toEpochMilli();
            if (ageMs > settings.activeWindowMs()) {
                log.debug("Monitor {} dropping unconfirmed session {}", provider, id);
                return true;
            }
            next.put(id, skeleton);
            return false;
        });
    }

    /**
     * Deliver the current list to every listener. Called without holding
     * {@code lock}.
     */
    private void publish() {
        synchronized (deliveryLock) {
            if (delivering) {
                deliveryPending = true;
                return;
            }
            delivering = true;
        }
        boolean finished = false;
        try {
            do {
                List<SessionSnapshot> current;
                synchronized (lock) {
                    current = getAll();
                }
                deliver(current);
            } while (takePendingDelivery());
            finished = true;
        } finally {
            if (!finished) {
                synchronized (deliveryLock) {
                    delivering = false;
                    deliveryPending = false;
                }
            }
        }
    }

    private boolean takePendingDelivery() {
        synchronized (deliveryLock) {
            if (deliveryPending) {
                deliveryPending = false;
                return true;
            }
            delivering = false;
            return false;
        }
    }

    private void deliver(List<SessionSnapshot> snapshots) {
        for (RefreshListener listener : listeners) {
            try {
                listener.onRefresh(snapshots);
            } catch (Exception e) {
                log.error("Monitor {} refresh listener failed: {}", provider, e.getMessage(), e);
            }
        }
    }

    // =========================================================================
    // Hook write path
    // =========================================================================

    @Override
    public boolean updateActivityPhase(String sessionId, ActivityPhase phase) {
        synchronized (lock) {
            SessionSnapshot current = sessions.get(sessionId);
            if (current == null) {
                log.debug("Monitor {} phase update for unknown session {}", provider, sessionId);
                return false;
            }
            sessions.put(sessionId, current.toBuilder().activityPhase(phase).build());
        }
        publish();
        return true;
    }

    @Override
    public boolean updateSessionState(String sessionId, SessionState state) {
        synchronized (lock) {
            SessionSnapshot current = sessions.get(sessionId);
            if (current == null) {
                log.debug("Monitor {} state update for unknown session {}", provider, sessionId);
                return false;
            }
            SessionSnapshot.SessionSnapshotBuilder updated = current.toBuilder().state(state);
            if (state != SessionState.ACTIVE) {
                updated.activityPhase(null);
            }
            sessions.put(sessionId, updated.build());
        }
        publish();
        return true;
    }

    @Override
    public SessionSnapshot registerSession(SessionRegistration registration) {
        Objects.requireNonNull(registration.sessionId(), "sessionId");
        SessionSnapshot skeleton;
        synchronized (lock) {
            SessionSnapshot existing = sessions.get(registration.sessionId());
            if (existing != null) {
                return existing;
            }
            Instant now = clock.instant();
            skeleton = SessionSnapshot.builder()
                    .provider(provider)
                    .sessionId(registration.sessionId())
                    .projectPath(registration.cwd())
                    .projectName(projectName(registration.cwd()))
                    .slug(shortId(registration.sessionId()))
                    .state(SessionState.ACTIVE)
                    .model(registration.model())
                    .tokens(TokenCounts.ZERO)
                    .startedAt(now)
                    .lastActivity(now)
                    .activityPhase(ActivityPhase.BUSY)
                    .transcriptPath(registration.transcriptPath())
                    .build();
            sessions.put(skeleton.sessionId(), skeleton);
            skeletonIds.add(skeleton.sessionId());
            log.info("Monitor {} registered session {}", provider, skeleton.sessionId());
        }
        publish();
        return skeleton;
    }

    // =========================================================================
    // Read API
    // =========================================================================

    @Override
    public List<SessionSnapshot> getAll() {
        return sessions.values().stream()
                .filter(s -> s.state() != SessionState.STALE)
                .sorted(SessionSnapshot.DISPLAY_ORDER)
                .toList();
    }

    @Override
    public MonitorStatus getStatus() {
        return MonitorStatus.of(getAll(), lastRefresh);
    }

    @Override
    public TokenUsageReport getTokenUsageReport() {
        List<SessionSnapshot> all = getAll();
        List<SessionSnapshot> live = all.stream().filter(s -> s.state().isLive()).toList();
        return TokenUsageReport.of(live, pricing, all.size(), clock.instant());
    }

    public TokenPricing getPricing() {
        return pricing;
    }

    public Instant getLastRefresh() {
        return lastRefresh;
    }

    /**
     * Last segment of a working directory. Works on the raw string so that
     * paths the local file system cannot represent still get a name.
     */
    static String projectName(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            return "";
        }
        int end = projectPath.length();
        while (end > 1 && (projectPath.charAt(end - 1) == '/' || projectPath.charAt(end - 1) == '\\')) {
            end--;
        }
        int start = Math.max(projectPath.lastIndexOf('/', end - 1), projectPath.lastIndexOf('\\', end - 1)) + 1;
        return projectPath.substring(start, end);
    }

    static String shortId(String sessionId) {
        return sessionId.length() <= SLUG_LENGTH ? sessionId : sessionId.substring(0, SLUG_LENGTH);
    }

    /**
     * Pairs transcripts with live processes: by session id, then resume id,
     * then by working directory for processes that carry neither. Each
     * process is matched at most once; callers offer transcripts newest first.
     */
    static final class ProcessMatcher {

        private final Map<String, AgentProcess> bySessionId = new HashMap<>();
        private final Map<String, AgentProcess> byResumeId = new HashMap<>();
        private final List<AgentProcess> byCwd = new ArrayList<>();
        private final Set<Integer> matched = new HashSet<>();

        ProcessMatcher(List<AgentProcess> processes) {
            for (AgentProcess p : processes) {
                boolean hasSession = p.sessionId() != null && !p.sessionId().isEmpty();
                boolean hasResume = p.resumeId() != null && !p.resumeId().isEmpty();
                if (hasSession) {
                    bySessionId.putIfAbsent(p.sessionId(), p);
                }
                if (hasResume) {
                    byResumeId.putIfAbsent(p.resumeId(), p);
                }
                if (!hasSession && !hasResume && p.cwd() != null) {
                    byCwd.add(p);
                }
            }
        }

        AgentProcess match(TranscriptFile file) {
            AgentProcess p = claim(bySessionId.get(file.sessionId()));
            if (p == null) {
                p = claim(byResumeId.get(file.sessionId()));
            }
            if (p == null && file.projectPath() != null) {
                for (AgentProcess candidate : byCwd) {
                    if (candidate.cwd().equals(file.projectPath())) {
                        p = claim(candidate);
                        if (p != null) {
                            break;
                        }
                    }
                }
            }
            return p;
        }

        private AgentProcess claim(AgentProcess p) {
            if (p == null || !matched.add(p.pid())) {
                return null;
            }
            return p;
        }
    }
}
