package com.calendarreg.api.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, deduplicating work queue for course refresh jobs.
 *
 * <p>At most one job per {@link RefreshKey} is in flight at a time: a key is marked when its job is
 * admitted and cleared by the handler through {@link #markDone(RefreshKey)}. Admission never
 * blocks; a duplicate key or a full buffer is reported as {@code false}.
 *
 * <p>A capacity of zero or less means there is no buffer at all, so a job is only admitted when a
 * worker is idle and polling.
 */
public class RefreshQueue {

    private static final Logger log = LoggerFactory.getLogger(RefreshQueue.class);
    private static final long POLL_MILLIS = 200;

    private final BlockingQueue<RefreshJob> jobs;
    private final int workers;
    private final Clock clock;

    private final Object lock = new Object();
    private final Set<RefreshKey> inFlight = new HashSet<>();
    private final AtomicLong processed = new AtomicLong();

    private volatile boolean started;
    private volatile boolean stopped;
    private ThreadPoolTaskExecutor executor;
    private CountDownLatch drained;

    public RefreshQueue(int capacity, int workers, Clock clock) {
        this.jobs = capacity > 0 ? new ArrayBlockingQueue<>(capacity) : new SynchronousQueue<>();
        this.workers = Math.max(1, workers);
        this.clock = clock;
    }

    /**
     * Tries to admit a job. Returns {@code true} only when the job was handed to the buffer (or
     * directly to an idle worker); the key stays in flight until {@link #markDone} is called.
     */
    public boolean enqueue(RefreshJob job) {
        if (job == null) throw new IllegalArgumentException("job is required");
        RefreshKey key = job.getKey();
        synchronized (lock) {
            if (inFlight.contains(key)) {
                log.debug("[RefreshQueue] {} already in progress, skipping", key);
                return false;
            }
            if (stopped) {
                log.debug("[RefreshQueue] queue stopped, rejecting {}", key);
                return false;
            }
            inFlight.add(key);
            job.markEnqueued(clock.instant());
            if (!jobs.offer(job)) {
                inFlight.remove(key);
                log.warn("[RefreshQueue] queue full, dropping {}", key);
                return false;
            }
        }
        log.debug("[RefreshQueue] enqueued {}", job);
        return true;
    }

    /** Releases the key for new admissions and counts the job as processed. */
    public void markDone(RefreshKey key) {
        boolean removed;
        synchronized (lock) {
            removed = inFlight.remove(key);
        }
        if (removed) {
            processed.incrementAndGet();
        } else {
            log.debug("[RefreshQueue] markDone for {} which was not in flight", key);
        }
    }

    /**
     * Spawns the worker pool. Each worker takes jobs until the queue is stopped and the buffer
     * is empty; an exception from the handler is logged and the worker moves on.
     */
    public void start(RefreshJobHandler handler) {
        if (handler == null) throw new IllegalArgumentException("handler is required");
        synchronized (lock) {
            if (started) throw new IllegalStateException("RefreshQueue already started");
            started = true;
        }
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("refresh-worker-");
        executor.initialize();
        drained = new CountDownLatch(workers);
        for (int i = 0; i < workers; i++) {
            executor.execute(() -> runWorker(handler));
        }
        log.info("[RefreshQueue] started {} workers", workers);
    }

    private void runWorker(RefreshJobHandler handler) {
        try {
            while (true) {
                RefreshJob job;
                try {
                    job = jobs.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[RefreshQueue] worker interrupted, exiting");
                    return;
                }
                if (job == null) {
                    if (stopped) return;
                    continue;
                }
                try {
                    handler.handle(job);
                } catch (RuntimeException e) {
                    log.error("[RefreshQueue] handler failed for {}: {}", job.getKey(), e.getMessage(), e);
                }
            }
        } finally {
            drained.countDown();
        }
    }

    /**
     * Refuses further admissions and blocks until every worker has drained the buffer and exited.
     * Calling it on a queue that was never started only closes admission.
     */
    public void stop() {
        synchronized (lock) {
            if (stopped) return;
            stopped = true;
        }
        if (!started) return;
        try {
            drained.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RefreshQueue] interrupted while waiting for workers to drain");
        }
        executor.shutdown();
        log.info("[RefreshQueue] stopped, processed={}", processed.get());
    }

    public QueueStatus status() {
        List<String> codes;
        int processing;
        synchronized (lock) {
            processing = inFlight.size();
            codes = new ArrayList<>(processing);
            for (RefreshKey key : inFlight) {
                codes.add(key.toString());
            }
        }
        return new QueueStatus(workers, jobs.size(), processing, processed.get(), codes);
    }

    public boolean isRunning() {
        return started && !stopped;
    }
}
