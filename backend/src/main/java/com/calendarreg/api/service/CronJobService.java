package com.calendarreg.api.service;

import com.calendarreg.api.exception.ResourceNotFoundException;
import com.calendarreg.api.model.CronJob;
import com.calendarreg.api.repository.CronJobRepository;
import com.calendarreg.api.scheduler.CourseRefreshScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * CRUD for refresh schedules. Every write is mirrored into the {@link CourseRefreshScheduler}
 * once its transaction commits; a rolled-back write leaves the scheduler untouched.
 */
@Service
public class CronJobService {
    private static final Logger log = LoggerFactory.getLogger(CronJobService.class);

    private final CronJobRepository cronJobRepository;
    private final CourseRefreshScheduler scheduler;
    private final Clock clock;

    public CronJobService(CronJobRepository cronJobRepository, CourseRefreshScheduler scheduler, Clock clock) {
        this.cronJobRepository = cronJobRepository;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Transactional
    public CronJob create(CronJob job) {
        CourseRefreshScheduler.validateCronExpression(job.getCronExpr());
        Instant now = clock.instant();
        job.setId(null);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setDeletedAt(null);
        CronJob saved = cronJobRepository.save(job);
        log.info("[CronJob] created {} ({}) enabled={}", saved.getId(), saved.getName(), saved.isEnabled());
        if (saved.isEnabled()) {
            afterCommit(() -> register(saved));
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<CronJob> list() {
        return cronJobRepository.findByDeletedAtIsNullOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public CronJob get(Long id) {
        return cronJobRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new ResourceNotFoundException("cron job " + id + " not found"));
    }

    /** Replaces name, courses, term, expression and enabled flag; re-registers or unregisters. */
    @Transactional
    public CronJob update(Long id, CronJob changes) {
        CourseRefreshScheduler.validateCronExpression(changes.getCronExpr());
        CronJob job = get(id);
        job.setName(changes.getName());
        job.setCourseCodes(changes.getCourseCodes());
        job.setAcadyear(changes.getAcadyear());
        job.setSemester(changes.getSemester());
        job.setCronExpr(changes.getCronExpr());
        job.setEnabled(changes.isEnabled());
        job.setUpdatedAt(clock.instant());
        CronJob saved = cronJobRepository.save(job);
        log.info("[CronJob] updated {} ({}) enabled={}", saved.getId(), saved.getName(), saved.isEnabled());
        afterCommit(() -> register(saved));
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        CronJob job = get(id);
        job.setDeletedAt(clock.instant());
        cronJobRepository.save(job);
        afterCommit(() -> scheduler.removeJob(id));
        log.info("[CronJob] deleted {} ({})", id, job.getName());
    }

    /** Runs the job's refresh batch now, whether or not it is enabled. */
    @Transactional(readOnly = true)
    public void trigger(Long id) {
        CronJob job = get(id);
        scheduler.triggerJob(job);
    }

    /** Mirrors every enabled schedule into the scheduler. Called once at startup. */
    public void loadEnabledJobs() {
        List<CronJob> enabled;
        try {
            enabled = cronJobRepository.findByEnabledTrueAndDeletedAtIsNull();
        } catch (RuntimeException e) {
            log.error("[CronJob] could not load schedules, starting with none: {}", e.getMessage(), e);
            return;
        }
        scheduler.loadJobs(enabled);
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void register(CronJob job) {
        try {
            scheduler.addJob(job);
        } catch (RuntimeException e) {
            log.error("[CronJob] failed to register {} in scheduler: {}", job.getId(), e.getMessage());
        }
    }
}
