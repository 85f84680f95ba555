package com.calendarreg.api.queue;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A single background fetch for one {@link RefreshKey}.
 *
 * <p>{@code isNew} selects the persistence path on success: create a new record, or update the
 * existing one keeping its id and creation time. The optional result future is only present when a
 * reader is blocked waiting for this job; scheduler and stale-refresh jobs carry none.
 */
public final class RefreshJob {

    private final RefreshKey key;
    private final boolean isNew;
    private final CompletableFuture<JobResult> result;
    private volatile Instant enqueuedAt;

    private RefreshJob(RefreshKey key, boolean isNew, CompletableFuture<JobResult> result) {
        if (key == null) throw new IllegalArgumentException("key is required");
        this.key = key;
        this.isNew = isNew;
        this.result = result;
    }

    /** First fetch of a course that is not stored yet; the reader waits on {@code result}. */
    public static RefreshJob create(RefreshKey key, CompletableFuture<JobResult> result) {
        return new RefreshJob(key, true, result);
    }

    /** Fire-and-forget refresh of an existing record. */
    public static RefreshJob refresh(RefreshKey key) {
        return new RefreshJob(key, false, null);
    }

    public RefreshKey getKey() { return key; }

    public boolean isNew() { return isNew; }

    public Optional<CompletableFuture<JobResult>> getResult() { return Optional.ofNullable(result); }

    /** Admission time, stamped by {@link RefreshQueue#enqueue}; null until admitted. */
    public Instant getEnqueuedAt() { return enqueuedAt; }

    void markEnqueued(Instant at) { this.enqueuedAt = at; }

    /** Completes the waiting reader's future, if any. Later calls are ignored. */
    public void complete(JobResult outcome) {
        if (result != null) {
            result.complete(outcome);
        }
    }

    @Override
    public String toString() {
        return "RefreshJob{" + key + (isNew ? ", new" : ", update") + (result != null ? ", awaited" : "") + "}";
    }
}
