package com.calendarreg.api.integration;

import com.calendarreg.api.exception.CourseFetchException;
import com.calendarreg.api.model.Course;

import java.time.Duration;

/**
 * Source of truth for course offerings. The returned course is detached: it carries no id and no
 * timestamps, the caller decides how it is persisted.
 */
public interface CourseCatalogClient {

    Course fetchByCode(String code, int acadyear, int semester, Duration timeout) throws CourseFetchException;
}
