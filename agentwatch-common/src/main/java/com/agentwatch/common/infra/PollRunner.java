package com.agentwatch.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one provider monitor's refresh on a dedicated daemon thread.
 * <p>
 * Polls use a fixed delay, so a slow refresh pushes the next one back
 * instead of piling up. A failing poll is logged and counted; the loop keeps
 * going.
 */
@Slf4j
public class PollRunner implements AutoCloseable {

    public static final long MIN_INTERVAL_MS = 1000;

    private final String name;
    private final long intervalMs;
    private final Runnable poll;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong completedPolls = new AtomicLong();
    private final AtomicLong failedPolls = new AtomicLong();

    private ScheduledFuture<?> loop;
    private boolean closed;

    /**
     * @param name       provider name, used for the thread and in logs
     * @param intervalMs delay between the end of one poll and the start of the next
     * @param poll       the refresh to run
     */
    public PollRunner(String name, long intervalMs, Runnable poll) {
        this.name = name;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
        this.poll = poll;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "poll-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Begin polling. The first poll runs one interval from now; callers that
     * want an immediate refresh run it themselves before starting.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Poll runner " + name + " is closed");
        }
        if (loop != null) {
            return;
        }
        loop = scheduler.scheduleWithFixedDelay(this::pollOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Polling {} every {}ms", name, intervalMs);
    }

    public synchronized boolean isPolling() {
        return loop != null && !closed;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getCompletedPolls() {
        return completedPolls.get();
    }

    public long getFailedPolls() {
        return failedPolls.get();
    }

    void pollOnce() {
        try {
            poll.run();
            completedPolls.incrementAndGet();
        } catch (RuntimeException e) {
            failedPolls.incrementAndGet();
            log.error("Polling {} failed: {}", name, e.getMessage(), e);
        }
    }

    /**
     * Stop polling and wait briefly for an in-flight poll to finish.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (loop != null) {
                loop.cancel(false);
            }
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Polling {} did not stop within 5s", name);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Polling {} stopped after {} polls", name, completedPolls.get());
    }
}
