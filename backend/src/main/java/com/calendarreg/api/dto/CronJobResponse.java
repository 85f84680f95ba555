package com.calendarreg.api.dto;

import com.calendarreg.api.model.CronJob;

import java.util.List;

public record CronJobResponse(Long id, String name, List<String> courseCodes, int acadyear, int semester,
                              String cronExpr, boolean enabled, String createdAt, String updatedAt) {

    public static CronJobResponse from(CronJob j) {
        return new CronJobResponse(j.getId(), j.getName(), List.copyOf(j.getCourseCodes()), j.getAcadyear(),
                j.getSemester(), j.getCronExpr(), j.isEnabled(),
                j.getCreatedAt() != null ? j.getCreatedAt().toString() : null,
                j.getUpdatedAt() != null ? j.getUpdatedAt().toString() : null);
    }
}
