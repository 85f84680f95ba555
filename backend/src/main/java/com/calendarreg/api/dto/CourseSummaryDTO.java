package com.calendarreg.api.dto;

import com.calendarreg.api.model.Course;

public record CourseSummaryDTO(Long id, String code, String nameEn, String nameTh, String credits,
                               int acadyear, int semester, int sectionCount, String updatedAt) {

    public static CourseSummaryDTO from(Course c) {
        return new CourseSummaryDTO(c.getId(), c.getCode(), c.getNameEn(), c.getNameTh(), c.getCredits(),
                c.getAcadyear(), c.getSemester(), c.getSections().size(),
                c.getUpdatedAt() != null ? c.getUpdatedAt().toString() : null);
    }
}
