package com.calendarreg.api.service;

import com.calendarreg.api.config.RefreshSettings;
import com.calendarreg.api.exception.CourseFetchException;
import com.calendarreg.api.exception.DuplicateResourceException;
import com.calendarreg.api.exception.ResourceNotFoundException;
import com.calendarreg.api.integration.CourseCatalogClient;
import com.calendarreg.api.model.Course;
import com.calendarreg.api.queue.JobResult;
import com.calendarreg.api.queue.RefreshJob;
import com.calendarreg.api.queue.RefreshKey;
import com.calendarreg.api.queue.RefreshQueue;
import com.calendarreg.api.repository.CourseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Course reads with stale-while-revalidate semantics, plus the worker-side handler that performs
 * the catalog fetch and persistence for each {@link RefreshJob}.
 *
 * <p>Without a catalog client (or a queue) the service only serves what is stored.
 */
@Service
public class CourseService {
    private static final Logger log = LoggerFactory.getLogger(CourseService.class);
    static final int MAX_TRACKED_FAILURES = 10_000;

    private final CourseRepository courseRepository;
    private final CourseCatalogClient catalogClient;
    private final RefreshQueue refreshQueue;
    private final RefreshSettings settings;
    private final Clock clock;
    private final Map<RefreshKey, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

    @Autowired
    public CourseService(CourseRepository courseRepository,
                         ObjectProvider<CourseCatalogClient> catalogClient,
                         ObjectProvider<RefreshQueue> refreshQueue,
                         RefreshSettings settings,
                         Clock clock) {
        this(courseRepository, catalogClient.getIfAvailable(), refreshQueue.getIfAvailable(), settings, clock);
    }

    public CourseService(CourseRepository courseRepository,
                         CourseCatalogClient catalogClient,
                         RefreshQueue refreshQueue,
                         RefreshSettings settings,
                         Clock clock) {
        this.courseRepository = courseRepository;
        this.catalogClient = catalogClient;
        this.refreshQueue = refreshQueue;
        this.settings = settings;
        this.clock = clock;
        if (catalogClient == null) {
            log.info("[CourseRefresh] no catalog client configured, serving stored courses only");
        }
    }

    /**
     * Reads a course, fetching or refreshing it through the queue when needed.
     * <ul>
     *   <li>stored and updated today: returned as is</li>
     *   <li>stored but stale: returned as is, a background refresh is enqueued</li>
     *   <li>not stored: a fetch is enqueued and awaited for up to the sync wait; a timeout or a
     *   rejected admission yields PENDING, a failed fetch NOT_FOUND</li>
     * </ul>
     */
    public CourseLookup getCourse(String code, int acadyear, int semester) {
        RefreshKey key = new RefreshKey(code, acadyear, semester);
        Optional<Course> stored = courseRepository.findActive(code, acadyear, semester);

        if (stored.isEmpty()) {
            if (!canRefresh()) {
                return CourseLookup.notFound();
            }
            return fetchAndWait(key);
        }

        Course course = stored.get();
        if (!isFresh(course) && canRefresh()) {
            if (refreshQueue.enqueue(RefreshJob.refresh(key))) {
                log.info("[CourseRefresh] {} is stale (updatedAt={}), refresh enqueued", key, course.getUpdatedAt());
            } else {
                log.debug("[CourseRefresh] {} is stale, refresh not admitted", key);
            }
        }
        return CourseLookup.found(course);
    }

    private CourseLookup fetchAndWait(RefreshKey key) {
        CompletableFuture<JobResult> result = new CompletableFuture<>();
        if (!refreshQueue.enqueue(RefreshJob.create(key, result))) {
            log.debug("[CourseRefresh] {} not admitted, reporting pending", key);
            return CourseLookup.pending();
        }
        try {
            JobResult outcome = result.get(settings.getSyncWait().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome.isSuccess()) {
                return CourseLookup.found(outcome.getCourse());
            }
            log.warn("[CourseRefresh] fetch of {} failed: {}", key, outcome.getError().getMessage());
            return CourseLookup.notFound();
        } catch (TimeoutException e) {
            log.info("[CourseRefresh] {} still fetching after {}, continuing in background", key, settings.getSyncWait());
            return CourseLookup.pending();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CourseLookup.pending();
        } catch (ExecutionException e) {
            log.error("[CourseRefresh] unexpected failure waiting for {}", key, e.getCause());
            return CourseLookup.notFound();
        }
    }

    /**
     * Worker-side handler. Fetches from the catalog and persists, creating or updating depending
     * on {@link RefreshJob#isNew()}, then completes the waiting reader if there is one. The key is
     * always released from the queue.
     */
    public void processRefreshJob(RefreshJob job) {
        RefreshKey key = job.getKey();
        try {
            if (catalogClient == null) {
                throw new CourseFetchException("no catalog client configured");
            }
            Course fetched = catalogClient.fetchByCode(key.code(), key.acadyear(), key.semester(), settings.getFetchTimeout());
            Course saved = job.isNew() ? persistNew(key, fetched) : persistUpdate(key, fetched);
            if (saved == null) {
                job.complete(JobResult.failure(new ResourceNotFoundException("course " + key + " disappeared during refresh")));
                return;
            }
            consecutiveFailures.remove(key);
            job.complete(JobResult.success(saved));
        } catch (CourseFetchException | RuntimeException e) {
            recordFailure(key, job.isNew(), e);
            job.complete(JobResult.failure(e));
        } finally {
            if (refreshQueue != null) {
                refreshQueue.markDone(key);
            }
        }
    }

    private Course persistNew(RefreshKey key, Course fetched) {
        Instant now = clock.instant();
        fetched.setId(null);
        fetched.setCode(key.code());
        fetched.setAcadyear(key.acadyear());
        fetched.setSemester(key.semester());
        fetched.setCreatedAt(now);
        fetched.setUpdatedAt(now);
        fetched.setDeletedAt(null);
        Course saved = courseRepository.save(fetched);
        log.info("[CourseRefresh] created {} (id={})", key, saved.getId());
        return saved;
    }

    private Course persistUpdate(RefreshKey key, Course fetched) {
        Optional<Course> existing = courseRepository.findActive(key.code(), key.acadyear(), key.semester());
        if (existing.isEmpty()) {
            log.warn("[CourseRefresh] {} no longer stored, dropping refreshed data", key);
            return null;
        }
        Course current = existing.get();
        fetched.setId(current.getId());
        fetched.setCode(current.getCode());
        fetched.setAcadyear(current.getAcadyear());
        fetched.setSemester(current.getSemester());
        fetched.setCreatedAt(current.getCreatedAt());
        fetched.setUpdatedAt(clock.instant());
        fetched.setDeletedAt(null);
        Course saved = courseRepository.save(fetched);
        log.info("[CourseRefresh] refreshed {} (id={})", key, saved.getId());
        return saved;
    }

    private void recordFailure(RefreshKey key, boolean isNew, Exception e) {
        if (isNew) {
            // unknown codes are not stored, so their misses are not tracked either
            log.error("[CourseRefresh] {} create failed: {}", key, e.getMessage());
            return;
        }
        AtomicInteger counter = consecutiveFailures.get(key);
        if (counter == null) {
            if (consecutiveFailures.size() >= MAX_TRACKED_FAILURES) {
                log.error("[CourseRefresh] {} update failed (streak not tracked): {}", key, e.getMessage());
                return;
            }
            counter = consecutiveFailures.computeIfAbsent(key, k -> new AtomicInteger());
        }
        int streak = counter.incrementAndGet();
        if (streak >= settings.getFailureWarnThreshold()) {
            log.warn("[CourseRefresh] {} update failed {} time(s) in a row: {}", key, streak, e.getMessage());
        } else {
            log.error("[CourseRefresh] {} update failed: {}", key, e.getMessage());
        }
    }

    /** Failures since the last successful refresh of {@code key}. */
    public int consecutiveFailures(RefreshKey key) {
        AtomicInteger n = consecutiveFailures.get(key);
        return n == null ? 0 : n.get();
    }

    int trackedFailureCount() {
        return consecutiveFailures.size();
    }

    boolean isFresh(Course course) {
        Instant updatedAt = course.getUpdatedAt();
        if (updatedAt == null) return false;
        return LocalDate.ofInstant(updatedAt, clock.getZone()).equals(LocalDate.now(clock));
    }

    private boolean canRefresh() {
        return catalogClient != null && refreshQueue != null;
    }

    @Transactional
    public Course createCourse(Course course) {
        if (courseRepository.findActive(course.getCode(), course.getAcadyear(), course.getSemester()).isPresent()) {
            throw new DuplicateResourceException("course " + course.getCode() + " already exists for "
                    + course.getAcadyear() + "/" + course.getSemester());
        }
        Instant now = clock.instant();
        course.setId(null);
        course.setCreatedAt(now);
        course.setUpdatedAt(now);
        course.setDeletedAt(null);
        Course saved = courseRepository.save(course);
        log.info("Created course {} {}/{} (id={})", saved.getCode(), saved.getAcadyear(), saved.getSemester(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public PagedResult<Course> listCourses(int page, int limit) {
        int p = PagedResult.normalizePage(page);
        int l = PagedResult.normalizeLimit(limit);
        if (l == 0) {
            List<Course> all = courseRepository.findByDeletedAtIsNullOrderByCodeAscAcadyearDescSemesterDesc();
            return PagedResult.of(all, p, 0, all.size());
        }
        Page<Course> slice = courseRepository.findByDeletedAtIsNullOrderByCodeAscAcadyearDescSemesterDesc(PageRequest.of(p - 1, l));
        return PagedResult.of(slice.getContent(), p, l, slice.getTotalElements());
    }

    @Transactional
    public void deleteCourse(String code, int acadyear, int semester) {
        Course course = courseRepository.findActive(code, acadyear, semester)
                .orElseThrow(() -> new ResourceNotFoundException("course " + code + " not found for " + acadyear + "/" + semester));
        course.setDeletedAt(clock.instant());
        courseRepository.save(course);
        log.info("Soft-deleted course {} {}/{}", code, acadyear, semester);
    }
}
