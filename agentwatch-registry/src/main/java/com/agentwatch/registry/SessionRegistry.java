package com.agentwatch.registry;

import com.agentwatch.common.infra.JsonFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * Tracks resumable sessions by id and by chat thread.
 * <p>
 * Records expire once {@code lastUsedAt} is older than the TTL. Expiry is
 * applied lazily: every read prunes expired records from both indices first.
 * When a store path is configured, every mutation writes the full record set
 * on a background thread; write failures are logged and never reach the
 * caller. Without a store path the registry is memory-only.
 */
@Slf4j
public class SessionRegistry implements AutoCloseable {

    public static final long DEFAULT_TTL_MS = 24 * 60 * 60 * 1000L;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Comparator<SessionRegistryRecord> MOST_RECENT_FIRST =
            Comparator.comparingLong(SessionRegistryRecord::lastUsedAt).reversed();

    private final long ttlMs;
    private final Path storePath;
    private final String defaultProvider;
    private final LongSupplier clock;
    private final ExecutorService writer;

    private final Map<String, SessionRegistryRecord> sessions = new LinkedHashMap<>();
    private final Map<String, String> sessionIdByThread = new HashMap<>();

    public SessionRegistry(long ttlMs, Path storePath, String defaultProvider) {
        this(ttlMs, storePath, defaultProvider, System::currentTimeMillis);
    }

    /**
     * @param storePath persisted file, or null for a memory-only registry
     * @param clock     epoch-millisecond time source
     */
    public SessionRegistry(long ttlMs, Path storePath, String defaultProvider, LongSupplier clock) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive: " + ttlMs);
        }
        this.ttlMs = ttlMs;
        this.storePath = storePath;
        this.defaultProvider = Objects.requireNonNull(defaultProvider, "defaultProvider");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.writer = storePath == null ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "registry-writer");
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    /**
     * Create or update a record. {@code createdAt} and {@code archivedAt}
     * survive updates of a live record; an expired record is pruned first and
     * replaced by a fresh one. The thread index is re-pointed to this session.
     */
    public synchronized SessionRegistryRecord upsert(SessionRegistryUpsert input) {
        String sessionId = input.sessionId();
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        long timestamp = input.timestamp() != null ? input.timestamp() : clock.getAsLong();
        prune(timestamp);
        SessionRegistryRecord existing = sessions.get(sessionId);

        SessionRegistryRecord record = SessionRegistryRecord.builder()
                .sessionId(sessionId)
                .provider(input.provider() != null ? input.provider() : defaultProvider)
                .ownerUserId(input.ownerUserId())
                .mappingKey(input.mappingKey())
                .cwd(input.cwd())
                .threadChannelId(input.threadChannelId())
                .parentChannelId(input.parentChannelId())
                .createdAt(existing != null ? existing.createdAt() : timestamp)
                .lastUsedAt(timestamp)
                .archivedAt(existing != null ? existing.archivedAt() : null)
                .build();

        if (existing != null && existing.threadChannelId() != null
                && !existing.threadChannelId().equals(record.threadChannelId())) {
            sessionIdByThread.remove(existing.threadChannelId(), sessionId);
        }
        sessions.put(sessionId, record);
        if (record.threadChannelId() != null) {
            sessionIdByThread.put(record.threadChannelId(), sessionId);
        }
        log.debug("Registry upsert {} (thread: {})", sessionId, record.threadChannelId());
        schedulePersist();
        return record;
    }

    public boolean archive(String sessionId) {
        return archive(sessionId, null);
    }

    /**
     * Mark a session archived. Idempotent: an existing archive time is kept.
     *
     * @return false when the session is unknown or expired
     */
    public synchronized boolean archive(String sessionId, Long timestamp) {
        long now = timestamp != null ? timestamp : clock.getAsLong();
        prune(now);
        SessionRegistryRecord existing = sessions.get(sessionId);
        if (existing == null) {
            return false;
        }
        if (existing.isArchived()) {
            return true;
        }
        sessions.put(sessionId, existing.toBuilder().archivedAt(now).build());
        log.info("Registry archived session {}", sessionId);
        schedulePersist();
        return true;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public synchronized SessionRegistryRecord get(String sessionId) {
        prune(clock.getAsLong());
        return sessions.get(sessionId);
    }

    public synchronized SessionRegistryRecord getByThread(String threadChannelId) {
        prune(clock.getAsLong());
        String sessionId = sessionIdByThread.get(threadChannelId);
        return sessionId != null ? sessions.get(sessionId) : null;
    }

    /**
     * Matching records, most recently used first.
     */
    public synchronized List<SessionRegistryRecord> list(ListFilter filter) {
        prune(filter.now() != null ? filter.now() : clock.getAsLong());
        return sessions.values().stream()
                .filter(r -> filter.includeArchived() || !r.isArchived())
                .filter(r -> filter.ownerUserId() == null || filter.ownerUserId().equals(r.ownerUserId()))
                .filter(r -> filter.mappingKey() == null || filter.mappingKey().equals(r.mappingKey()))
                .sorted(MOST_RECENT_FIRST)
                .toList();
    }

    /**
     * Pick the session a new interaction should attach to: the explicit id,
     * else the thread's session, else the caller's most recent session in the
     * mapping. Explicit and thread lookups do not check the owner.
     */
    public synchronized ResumeResolution resolveResumeTarget(ResumeRequest request) {
        prune(request.now() != null ? request.now() : clock.getAsLong());

        String explicitId = request.explicitSessionId();
        if (explicitId != null && !explicitId.isBlank()) {
            SessionRegistryRecord record = sessions.get(explicitId);
            if (record == null) {
                return ResumeResolution.notFound("Session not found: " + explicitId);
            }
            if (record.isArchived()) {
                return ResumeResolution.notFound("Session is archived.");
            }
            return ResumeResolution.found(ResumeSource.EXPLICIT, record);
        }

        String threadId = request.threadChannelId();
        if (threadId != null) {
            String sessionId = sessionIdByThread.get(threadId);
            SessionRegistryRecord record = sessionId != null ? sessions.get(sessionId) : null;
            if (record != null && !record.isArchived()) {
                return ResumeResolution.found(ResumeSource.THREAD, record);
            }
        }

        return sessions.values().stream()
                .filter(r -> !r.isArchived())
                .filter(r -> Objects.equals(request.ownerUserId(), r.ownerUserId()))
                .filter(r -> Objects.equals(request.mappingKey(), r.mappingKey()))
                .max(Comparator.comparingLong(SessionRegistryRecord::lastUsedAt))
                .map(r -> ResumeResolution.found(ResumeSource.RECENT, r))
                .orElseGet(() -> ResumeResolution.notFound("No recent session to resume."));
    }

    public synchronized int size() {
        return sessions.size();
    }

    private void prune(long now) {
        boolean removed = false;
        Iterator<SessionRegistryRecord> it = sessions.values().iterator();
        while (it.hasNext()) {
            SessionRegistryRecord record = it.next();
            if (now - record.lastUsedAt() > ttlMs) {
                it.remove();
                if (record.threadChannelId() != null) {
                    sessionIdByThread.remove(record.threadChannelId(), record.sessionId());
                }
                log.debug("Registry expired session {}", record.sessionId());
                removed = true;
            }
        }
        if (removed) {
            schedulePersist();
        }
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    /**
     * Replace the in-memory state with the persisted file. A missing file
     * leaves the registry empty; an unreadable file or a payload with the
     * wrong version or shape is discarded with a warning and the current
     * state is kept.
     *
     * @return number of records loaded
     */
    public synchronized int load() {
        if (storePath == null) {
            return 0;
        }
        JsonNode root;
        try {
            root = JsonFile.readTree(storePath);
        } catch (IOException e) {
            log.warn("Registry file {} unreadable, ignoring: {}", storePath, e.getMessage());
            return 0;
        }
        if (root == null) {
            log.debug("Registry file {} not found", storePath);
            return 0;
        }
        if (!root.isObject() || root.path("version").asInt(-1) != RegistryPayload.CURRENT_VERSION
                || !root.path("sessions").isArray()) {
            log.warn("Registry file {} has an unsupported payload, ignoring", storePath);
            return 0;
        }

        Map<String, SessionRegistryRecord> loaded = new LinkedHashMap<>();
        for (JsonNode node : root.get("sessions")) {
            SessionRegistryRecord record;
            try {
                record = MAPPER.treeToValue(node, SessionRegistryRecord.class);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Registry skipping malformed record: {}", e.getMessage());
                continue;
            }
            if (record == null || isBlank(record.sessionId()) || isBlank(record.ownerUserId())) {
                continue;
            }
            loaded.put(record.sessionId(), record);
        }

        sessions.clear();
        sessionIdByThread.clear();
        sessions.putAll(loaded);
        List<SessionRegistryRecord> oldestFirst = new ArrayList<>(loaded.values());
        oldestFirst.sort(Comparator.comparingLong(SessionRegistryRecord::lastUsedAt));
        for (SessionRegistryRecord record : oldestFirst) {
            if (record.threadChannelId() != null) {
                sessionIdByThread.put(record.threadChannelId(), record.sessionId());
            }
        }
        prune(clock.getAsLong());
        log.info("Registry loaded {} sessions from {}", sessions.size(), storePath);
        return sessions.size();
    }

    /**
     * Wait for queued writes to finish.
     */
    public void flush() {
        if (writer == null) {
            return;
        }
        try {
            writer.submit(() -> { }).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Registry flush did not complete: {}", e.getMessage());
        } catch (RejectedExecutionException e) {
            log.debug("Registry writer already stopped");
        }
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        flush();
        writer.shutdown();
    }

    public Path getStorePath() {
        return storePath;
    }

    private void schedulePersist() {
        if (writer == null) {
            return;
        }
        RegistryPayload payload = new RegistryPayload(RegistryPayload.CURRENT_VERSION,
                List.copyOf(sessions.values()));
        try {
            writer.execute(() -> write(payload));
        } catch (RejectedExecutionException e) {
            log.warn("Registry writer stopped, change to {} not persisted", storePath);
        }
    }

    private void write(RegistryPayload payload) {
        try {
            JsonFile.save(storePath, payload);
        } catch (IOException | RuntimeException e) {
            log.warn("Registry failed to persist {}: {}", storePath, e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
