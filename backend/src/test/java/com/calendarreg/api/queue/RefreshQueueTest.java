package com.calendarreg.api.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefreshQueueTest {

    private static final Instant NOW = Instant.parse("2025-06-01T03:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private RefreshQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) queue.stop();
    }

    private static RefreshKey key(String code) {
        return new RefreshKey(code, 2568, 1);
    }

    @Test
    void secondAdmissionOfSameKeyIsRejected() {
        queue = new RefreshQueue(10, 2, clock);

        assertThat(queue.enqueue(RefreshJob.refresh(key("CS101")))).isTrue();
        assertThat(queue.enqueue(RefreshJob.refresh(key("CS101")))).isFalse();

        QueueStatus status = queue.status();
        assertThat(status.processing()).isEqualTo(1);
        assertThat(status.pending()).isEqualTo(1);
        assertThat(status.codes()).containsExactly("CS101:2568:1");
    }

    @Test
    void sameCodeInAnotherTermIsADifferentKey() {
        queue = new RefreshQueue(10, 1, clock);

        assertThat(queue.enqueue(RefreshJob.refresh(new RefreshKey("CS101", 2568, 1)))).isTrue();
        assertThat(queue.enqueue(RefreshJob.refresh(new RefreshKey("CS101", 2568, 2)))).isTrue();
        assertThat(queue.status().codes()).containsExactlyInAnyOrder("CS101:2568:1", "CS101:2568:2");
    }

    @Test
    void fullBufferRejectsAndDoesNotLeaveKeyInFlight() {
        queue = new RefreshQueue(1, 1, clock);

        assertThat(queue.enqueue(RefreshJob.refresh(key("A")))).isTrue();
        assertThat(queue.enqueue(RefreshJob.refresh(key("B")))).isFalse();

        QueueStatus status = queue.status();
        assertThat(status.processing()).isEqualTo(1);
        assertThat(status.codes()).containsExactly("A:2568:1");

        assertThat(queue.enqueue(RefreshJob.refresh(key("B")))).isFalse();
    }

    @Test
    void zeroCapacityWithoutIdleWorkerRejects() {
        queue = new RefreshQueue(0, 1, clock);

        assertThat(queue.enqueue(RefreshJob.refresh(key("A")))).isFalse();
        assertThat(queue.status().processing()).isZero();
    }

    @Test
    void zeroCapacityHandsJobToIdleWorker() throws Exception {
        queue = new RefreshQueue(0, 1, clock);
        CountDownLatch handled = new CountDownLatch(1);
        queue.start(job -> {
            queue.markDone(job.getKey());
            handled.countDown();
        });

        boolean admitted = false;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!admitted && System.nanoTime() < deadline) {
            admitted = queue.enqueue(RefreshJob.refresh(key("A")));
            if (!admitted) Thread.sleep(20);
        }

        assertThat(admitted).isTrue();
        assertThat(handled.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void enqueueStampsAdmissionTime() {
        queue = new RefreshQueue(5, 1, clock);
        RefreshJob job = RefreshJob.refresh(key("A"));
        assertThat(job.getEnqueuedAt()).isNull();

        queue.enqueue(job);

        assertThat(job.getEnqueuedAt()).isEqualTo(NOW);
    }

    @Test
    void everyAdmittedJobIsCountedOnceAfterDrain() {
        queue = new RefreshQueue(100, 4, clock);
        AtomicInteger handled = new AtomicInteger();
        queue.start(job -> {
            try {
                handled.incrementAndGet();
            } finally {
                queue.markDone(job.getKey());
            }
        });

        int admitted = 0;
        for (int i = 0; i < 50; i++) {
            if (queue.enqueue(RefreshJob.refresh(key("C" + i)))) admitted++;
        }
        queue.stop();

        assertThat(admitted).isEqualTo(50);
        assertThat(handled.get()).isEqualTo(50);
        QueueStatus status = queue.status();
        assertThat(status.processed()).isEqualTo(50);
        assertThat(status.processing()).isZero();
        assertThat(status.pending()).isZero();
        assertThat(status.codes()).isEmpty();
    }

    @Test
    void failingHandlerDoesNotKillWorker() {
        queue = new RefreshQueue(10, 1, clock);
        List<String> seen = new ArrayList<>();
        queue.start(job -> {
            try {
                seen.add(job.getKey().code());
                if (job.getKey().code().equals("BOOM")) {
                    throw new IllegalStateException("catalog exploded");
                }
            } finally {
                queue.markDone(job.getKey());
            }
        });

        queue.enqueue(RefreshJob.refresh(key("BOOM")));
        queue.enqueue(RefreshJob.refresh(key("OK")));
        queue.stop();

        assertThat(seen).containsExactly("BOOM", "OK");
        assertThat(queue.status().processed()).isEqualTo(2);
    }

    @Test
    void markDoneForUnknownKeyIsNoOp() {
        queue = new RefreshQueue(10, 1, clock);

        queue.markDone(key("GHOST"));

        assertThat(queue.status().processed()).isZero();
        assertThat(queue.status().processing()).isZero();
    }

    @Test
    void keyCanBeReadmittedAfterMarkDone() {
        queue = new RefreshQueue(10, 1, clock);
        assertThat(queue.enqueue(RefreshJob.refresh(key("A")))).isTrue();

        queue.markDone(key("A"));

        assertThat(queue.enqueue(RefreshJob.refresh(key("A")))).isTrue();
        assertThat(queue.status().processed()).isEqualTo(1);
    }

    @Test
    void startingTwiceFails() {
        queue = new RefreshQueue(10, 1, clock);
        queue.start(job -> queue.markDone(job.getKey()));

        assertThatThrownBy(() -> queue.start(job -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stoppedQueueRejectsAdmissions() {
        queue = new RefreshQueue(10, 1, clock);
        queue.start(job -> queue.markDone(job.getKey()));
        queue.stop();

        assertThat(queue.enqueue(RefreshJob.refresh(key("A")))).isFalse();
        assertThat(queue.status().processing()).isZero();
        assertThat(queue.isRunning()).isFalse();
    }

    @Test
    void nonPositiveWorkerCountClampsToOne() {
        queue = new RefreshQueue(10, 0, clock);
        assertThat(queue.status().workers()).isEqualTo(1);
    }

    @Test
    void concurrentAdmissionsOfOneKeyAdmitExactlyOne() throws Exception {
        queue = new RefreshQueue(100, 1, clock);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    gate.await();
                    return queue.enqueue(RefreshJob.refresh(key("HOT")));
                }));
            }
            gate.countDown();
            int admitted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) admitted++;
            }
            assertThat(admitted).isEqualTo(1);
            assertThat(queue.status().processing()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeDeliversResultOnlyToAwaitedJobs() throws Exception {
        java.util.concurrent.CompletableFuture<JobResult> future = new java.util.concurrent.CompletableFuture<>();
        RefreshJob awaited = RefreshJob.create(key("A"), future);
        RefreshJob fireAndForget = RefreshJob.refresh(key("B"));

        awaited.complete(JobResult.failure(new IllegalStateException("nope")));
        fireAndForget.complete(JobResult.failure(new IllegalStateException("ignored")));

        assertThat(awaited.isNew()).isTrue();
        assertThat(fireAndForget.isNew()).isFalse();
        assertThat(fireAndForget.getResult()).isEmpty();
        assertThat(future.get(1, TimeUnit.SECONDS).isSuccess()).isFalse();
    }
}
