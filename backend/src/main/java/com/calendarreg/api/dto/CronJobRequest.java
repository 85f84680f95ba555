package com.calendarreg.api.dto;

import com.calendarreg.api.model.CronJob;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public class CronJobRequest {
    @NotBlank(message = "name is required")
    private String name;
    @NotEmpty(message = "courseCodes must not be empty")
    private List<@NotBlank(message = "course codes must not be blank") String> courseCodes;
    private int acadyear;
    private int semester;
    @NotBlank(message = "cronExpr is required")
    private String cronExpr; // five fields, e.g. "0 */6 * * *"
    private boolean enabled;

    public CronJob toEntity() {
        return new CronJob(name, courseCodes, acadyear, semester, cronExpr, enabled);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public List<String> getCourseCodes() { return courseCodes; }
    public void setCourseCodes(List<String> courseCodes) { this.courseCodes = courseCodes; }
    public int getAcadyear() { return acadyear; }
    public void setAcadyear(int acadyear) { this.acadyear = acadyear; }
    public int getSemester() { return semester; }
    public void setSemester(int semester) { this.semester = semester; }
    public String getCronExpr() { return cronExpr; }
    public void setCronExpr(String cronExpr) { this.cronExpr = cronExpr; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
