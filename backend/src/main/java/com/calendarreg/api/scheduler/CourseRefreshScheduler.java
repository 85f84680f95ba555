package com.calendarreg.api.scheduler;

import com.calendarreg.api.exception.InvalidCronExpressionException;
import com.calendarreg.api.model.CronJob;
import com.calendarreg.api.queue.RefreshJob;
import com.calendarreg.api.queue.RefreshKey;
import com.calendarreg.api.queue.RefreshQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Fires batches of course refreshes on five-field cron schedules (minute hour day-of-month month
 * day-of-week). Registrations mirror enabled {@link CronJob} rows; the database stays the source of
 * truth and the registrations are rebuilt from it on every start.
 *
 * <p>Jobs registered before {@link #start()} are kept and scheduled once the timer is running.
 */
public class CourseRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(CourseRefreshScheduler.class);

    private final RefreshQueue queue;
    private final ZoneId zone;
    private final Object lock = new Object();
    private final Map<Long, Registration> registrations = new LinkedHashMap<>();
    private final Supplier<ThreadPoolTaskScheduler> schedulerFactory;
    private ThreadPoolTaskScheduler taskScheduler;

    public CourseRefreshScheduler(RefreshQueue queue, ZoneId zone) {
        this(queue, zone, CourseRefreshScheduler::newTaskScheduler);
    }

    CourseRefreshScheduler(RefreshQueue queue, ZoneId zone, Supplier<ThreadPoolTaskScheduler> schedulerFactory) {
        this.queue = queue;
        this.zone = zone;
        this.schedulerFactory = schedulerFactory;
    }

    private static ThreadPoolTaskScheduler newTaskScheduler() {
        ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(1);
        ts.setThreadNamePrefix("course-cron-");
        ts.setWaitForTasksToCompleteOnShutdown(true);
        ts.setAwaitTerminationSeconds(30);
        ts.initialize();
        return ts;
    }

    public void start() {
        synchronized (lock) {
            if (taskScheduler != null) {
                log.debug("[Scheduler] already started");
                return;
            }
            taskScheduler = schedulerFactory.get();
            for (Registration r : registrations.values()) {
                r.future = schedule(r);
            }
            log.info("[Scheduler] started with {} job(s), zone={}", registrations.size(), zone);
        }
    }

    /** Cancels every live entry and waits for a trigger that is already running to finish. */
    public void stop() {
        ThreadPoolTaskScheduler ts;
        synchronized (lock) {
            ts = taskScheduler;
            if (ts == null) return;
            taskScheduler = null;
            for (Registration r : registrations.values()) {
                cancel(r);
            }
        }
        ts.shutdown();
        log.info("[Scheduler] stopped");
    }

    /**
     * Registers or replaces the entry for {@code job.getId()}. A disabled job is only removed.
     *
     * @throws InvalidCronExpressionException when an enabled job carries a bad expression; any
     *                                        previous entry for the id is already gone by then
     */
    public void addJob(CronJob job) {
        if (job == null || job.getId() == null) throw new IllegalArgumentException("cron job with an id is required");
        synchronized (lock) {
            Registration previous = registrations.remove(job.getId());
            if (previous != null) cancel(previous);
            if (!job.isEnabled()) {
                log.info("[Scheduler] job {} ({}) disabled, not scheduled", job.getId(), job.getName());
                return;
            }
            validateCronExpression(job.getCronExpr());
            Registration r = new Registration(job);
            if (taskScheduler != null) {
                r.future = schedule(r);
            }
            registrations.put(job.getId(), r);
        }
        log.info("[Scheduler] registered job {} ({}) cron='{}' courses={}",
                job.getId(), job.getName(), job.getCronExpr(), job.getCourseCodes());
    }

    public void removeJob(Long id) {
        Registration removed;
        synchronized (lock) {
            removed = registrations.remove(id);
            if (removed != null) cancel(removed);
        }
        if (removed != null) {
            log.info("[Scheduler] removed job {}", id);
        }
    }

    /** Registers each job; a failing one is logged and skipped. */
    public void loadJobs(List<CronJob> jobs) {
        int loaded = 0;
        for (CronJob job : jobs) {
            try {
                addJob(job);
                if (job.isEnabled()) loaded++;
            } catch (RuntimeException e) {
                log.error("[Scheduler] failed to load job {} ({}): {}", job.getId(), job.getName(), e.getMessage());
            }
        }
        log.info("[Scheduler] loaded {} of {} job(s)", loaded, jobs.size());
    }

    /** Runs the fan-out right now, leaving any registration for the job untouched. */
    public void triggerJob(CronJob job) {
        log.info("[Scheduler] manual trigger of job {} ({})", job.getId(), job.getName());
        fanOut(job.getId(), job.getName(), copyCodes(job), job.getAcadyear(), job.getSemester());
    }

    public Set<Long> registeredJobIds() {
        synchronized (lock) {
            return new TreeSet<>(registrations.keySet());
        }
    }

    /**
     * Parses a five-field cron expression. Spring's {@link CronExpression} expects a leading
     * seconds field, which is pinned to zero.
     */
    public static CronExpression validateCronExpression(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new InvalidCronExpressionException("cron expression is required");
        }
        String trimmed = expr.trim();
        int fields = trimmed.split("\\s+").length;
        if (fields != 5) {
            throw new InvalidCronExpressionException(
                    "cron expression must have 5 fields (minute hour day month weekday), got " + fields + ": '" + expr + "'");
        }
        try {
            return CronExpression.parse("0 " + trimmed);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private ScheduledFuture<?> schedule(Registration r) {
        CronTrigger trigger = new CronTrigger("0 " + r.cronExpr.trim(), zone);
        return taskScheduler.schedule(
                () -> fanOut(r.id, r.name, r.courseCodes, r.acadyear, r.semester), trigger);
    }

    private static void cancel(Registration r) {
        if (r.future != null) {
            r.future.cancel(false);
            r.future = null;
        }
    }

    private static List<String> copyCodes(CronJob job) {
        return job.getCourseCodes() == null ? new ArrayList<>() : new ArrayList<>(job.getCourseCodes());
    }

    private void fanOut(Long id, String name, List<String> codes, int acadyear, int semester) {
        int admitted = 0;
        for (String code : codes) {
            if (code == null || code.isBlank()) {
                log.warn("[Scheduler] job {} ({}) has a blank course code, skipped", id, name);
                continue;
            }
            RefreshKey key = new RefreshKey(code, acadyear, semester);
            if (queue.enqueue(RefreshJob.refresh(key))) {
                admitted++;
            } else {
                log.debug("[Scheduler] job {} skipped {} (in progress or queue full)", id, key);
            }
        }
        log.info("[Scheduler] job {} ({}) fired: {}/{} course(s) enqueued", id, name, admitted, codes.size());
    }

    private static final class Registration {
        final Long id;
        final String name;
        final List<String> courseCodes;
        final int acadyear;
        final int semester;
        final String cronExpr;
        ScheduledFuture<?> future;

        Registration(CronJob job) {
            this.id = job.getId();
            this.name = job.getName();
            this.courseCodes = copyCodes(job);
            this.acadyear = job.getAcadyear();
            this.semester = job.getSemester();
            this.cronExpr = job.getCronExpr();
        }
    }
}
