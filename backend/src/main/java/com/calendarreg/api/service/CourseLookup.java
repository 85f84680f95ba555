package com.calendarreg.api.service;

import com.calendarreg.api.model.Course;

/**
 * Result of a read through {@link CourseService#getCourse}. {@code course} is set only for
 * {@link Status#FOUND}.
 */
public record CourseLookup(Status status, Course course) {

    public enum Status { FOUND, NOT_FOUND, PENDING }

    public static CourseLookup found(Course course) { return new CourseLookup(Status.FOUND, course); }

    public static CourseLookup notFound() { return new CourseLookup(Status.NOT_FOUND, null); }

    public static CourseLookup pending() { return new CourseLookup(Status.PENDING, null); }

    public boolean isFound() { return status == Status.FOUND; }
}
