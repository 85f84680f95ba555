package com.calendarreg.api.config;

import com.calendarreg.api.queue.RefreshQueue;
import com.calendarreg.api.scheduler.CourseRefreshScheduler;
import com.calendarreg.api.service.CourseService;
import com.calendarreg.api.service.CronJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the refresh workers, loads enabled schedules and starts the cron timer once the context
 * is up. Shutdown runs in reverse: the timer stops producing first, then the queue drains.
 */
@Component
public class RefreshLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RefreshLifecycle.class);

    private final RefreshQueue refreshQueue;
    private final CourseRefreshScheduler scheduler;
    private final CourseService courseService;
    private final CronJobService cronJobService;
    private volatile boolean running;

    public RefreshLifecycle(RefreshQueue refreshQueue, CourseRefreshScheduler scheduler,
                            CourseService courseService, CronJobService cronJobService) {
        this.refreshQueue = refreshQueue;
        this.scheduler = scheduler;
        this.courseService = courseService;
        this.cronJobService = cronJobService;
    }

    @Override
    public void start() {
        refreshQueue.start(courseService::processRefreshJob);
        cronJobService.loadEnabledJobs();
        scheduler.start();
        running = true;
        log.info("Course refresh started: {}", refreshQueue.status());
    }

    @Override
    public void stop() {
        try {
            scheduler.stop();
        } finally {
            refreshQueue.stop();
            running = false;
        }
        log.info("Course refresh stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
