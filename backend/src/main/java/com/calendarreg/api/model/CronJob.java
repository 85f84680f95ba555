package com.calendarreg.api.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A user-managed refresh campaign: on every fire of {@link #getCronExpr()} each listed course code is
 * refreshed for the given academic year and semester. Only enabled, non-deleted rows are mirrored
 * into the in-memory scheduler.
 */
@Entity
@Table(name = "cron_jobs", indexes = {
        @Index(name = "idx_cronjobs_enabled", columnList = "enabled, deleted_at")
})
public class CronJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name; // e.g., "Refresh CP courses"

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cron_job_course_codes", joinColumns = @JoinColumn(name = "cron_job_id"))
    @OrderColumn(name = "position")
    @Column(name = "course_code", length = 32)
    private List<String> courseCodes = new ArrayList<>();

    @Column(nullable = false)
    private int acadyear;

    @Column(nullable = false)
    private int semester;

    @Column(name = "cron_expr", nullable = false, length = 128)
    private String cronExpr; // five fields, e.g., "0 */6 * * *"

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public CronJob() {}

    public CronJob(String name, List<String> courseCodes, int acadyear, int semester, String cronExpr, boolean enabled) {
        this.name = name;
        setCourseCodes(courseCodes);
        this.acadyear = acadyear;
        this.semester = semester;
        this.cronExpr = cronExpr;
        this.enabled = enabled;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getCourseCodes() { return courseCodes; }
    public void setCourseCodes(List<String> courseCodes) {
        this.courseCodes = courseCodes != null ? new ArrayList<>(courseCodes) : new ArrayList<>();
    }

    public int getAcadyear() { return acadyear; }
    public void setAcadyear(int acadyear) { this.acadyear = acadyear; }

    public int getSemester() { return semester; }
    public void setSemester(int semester) { this.semester = semester; }

    public String getCronExpr() { return cronExpr; }
    public void setCronExpr(String cronExpr) { this.cronExpr = cronExpr; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
}
