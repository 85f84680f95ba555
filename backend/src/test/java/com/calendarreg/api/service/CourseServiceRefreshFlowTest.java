package com.calendarreg.api.service;

import com.calendarreg.api.config.RefreshSettings;
import com.calendarreg.api.integration.CourseCatalogClient;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.queue.QueueStatus;
import com.calendarreg.api.queue.RefreshKey;
import com.calendarreg.api.queue.RefreshQueue;
import com.calendarreg.api.repository.CourseRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

/**
 * Drives the read path against a running queue. The repository is an in-memory map behind a mock,
 * the catalog a lambda that can be held back with a latch.
 */
class CourseServiceRefreshFlowTest {

    private static final Instant NOW = Instant.parse("2025-06-01T05:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Map<RefreshKey, Course> store = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger fetches = new AtomicInteger();
    private final CountDownLatch release = new CountDownLatch(1);
    private volatile boolean holdFetches;

    private RefreshQueue queue;
    private CourseService service;

    @BeforeEach
    void setup() {
        CourseRepository repo = Mockito.mock(CourseRepository.class);
        given(repo.findActive(anyString(), anyInt(), anyInt())).willAnswer(inv ->
                Optional.ofNullable(store.get(new RefreshKey(inv.<String>getArgument(0), inv.<Integer>getArgument(1), inv.<Integer>getArgument(2)))));
        given(repo.save(any(Course.class))).willAnswer(inv -> {
            Course c = inv.getArgument(0);
            if (c.getId() == null) c.setId(ids.incrementAndGet());
            store.put(new RefreshKey(c.getCode(), c.getAcadyear(), c.getSemester()), c);
            return c;
        });

        CourseCatalogClient catalog = (code, acadyear, semester, timeout) -> {
            fetches.incrementAndGet();
            if (holdFetches) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            Course c = new Course(code, acadyear, semester);
            c.setNameEn("Computer Programming");
            c.setCredits("3");
            return c;
        };

        RefreshSettings settings = new RefreshSettings(100, 2, Duration.ofMillis(500), Duration.ofMinutes(5), 3, "UTC");
        queue = new RefreshQueue(settings.getQueueCapacity(), settings.getWorkers(), clock);
        service = new CourseService(repo, catalog, queue, settings, clock);
        queue.start(service::processRefreshJob);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        queue.stop();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met within 5s");
            Thread.sleep(10);
        }
    }

    @Test
    void firstReadOfUnknownCourseFetchesAndPersistsIt() throws Exception {
        CourseLookup lookup = service.getCourse("CS101", 2568, 1);

        assertThat(lookup.status()).isEqualTo(CourseLookup.Status.FOUND);
        Course course = lookup.course();
        assertThat(course.getId()).isNotNull();
        assertThat(course.getCode()).isEqualTo("CS101");
        assertThat(course.getAcadyear()).isEqualTo(2568);
        assertThat(course.getSemester()).isEqualTo(1);
        assertThat(course.getCreatedAt()).isEqualTo(NOW);
        assertThat(course.getUpdatedAt()).isEqualTo(NOW);
        assertThat(store).containsKey(new RefreshKey("CS101", 2568, 1));

        await(() -> queue.status().processed() == 1);
        assertThat(queue.status().processing()).isZero();
    }

    @Test
    void staleReadReturnsImmediatelyWhileRefreshRunsInBackground() throws Exception {
        Course old = new Course("CS101", 2568, 1);
        old.setId(ids.incrementAndGet());
        old.setNameEn("Old name");
        old.setCreatedAt(NOW.minus(Duration.ofDays(30)));
        old.setUpdatedAt(NOW.minus(Duration.ofDays(2)));
        store.put(new RefreshKey("CS101", 2568, 1), old);
        holdFetches = true;

        CourseLookup lookup = service.getCourse("CS101", 2568, 1);

        assertThat(lookup.status()).isEqualTo(CourseLookup.Status.FOUND);
        assertThat(lookup.course().getNameEn()).isEqualTo("Old name");
        QueueStatus status = queue.status();
        assertThat(status.codes()).containsExactly("CS101:2568:1");

        // a second stale read does not start another fetch
        service.getCourse("CS101", 2568, 1);

        release.countDown();
        await(() -> queue.status().processed() == 1);

        Course refreshed = store.get(new RefreshKey("CS101", 2568, 1));
        assertThat(refreshed.getId()).isEqualTo(old.getId());
        assertThat(refreshed.getNameEn()).isEqualTo("Computer Programming");
        assertThat(refreshed.getCreatedAt()).isEqualTo(NOW.minus(Duration.ofDays(30)));
        assertThat(refreshed.getUpdatedAt()).isEqualTo(NOW);
        assertThat(fetches.get()).isEqualTo(1);
    }

    @Test
    void slowFirstFetchIsPendingThenPersistedInBackground() throws Exception {
        holdFetches = true;

        assertThat(service.getCourse("CS101", 2568, 1).status()).isEqualTo(CourseLookup.Status.PENDING);
        // still in flight: the duplicate is rejected and reported as pending without waiting
        assertThat(service.getCourse("CS101", 2568, 1).status()).isEqualTo(CourseLookup.Status.PENDING);
        assertThat(queue.status().codes()).containsExactly("CS101:2568:1");

        release.countDown();
        await(() -> queue.status().processed() == 1);

        CourseLookup later = service.getCourse("CS101", 2568, 1);
        assertThat(later.status()).isEqualTo(CourseLookup.Status.FOUND);
        assertThat(later.course().getUpdatedAt()).isEqualTo(NOW);
        assertThat(fetches.get()).isEqualTo(1);
    }
}
