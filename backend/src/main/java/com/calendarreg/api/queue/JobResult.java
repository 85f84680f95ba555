package com.calendarreg.api.queue;

import com.calendarreg.api.model.Course;

/**
 * Outcome handed to a waiting reader: either the refreshed course or the failure, never both.
 */
public final class JobResult {

    private final Course course;
    private final Throwable error;

    private JobResult(Course course, Throwable error) {
        this.course = course;
        this.error = error;
    }

    public static JobResult success(Course course) {
        if (course == null) throw new IllegalArgumentException("course is required for a successful result");
        return new JobResult(course, null);
    }

    public static JobResult failure(Throwable error) {
        if (error == null) throw new IllegalArgumentException("error is required for a failed result");
        return new JobResult(null, error);
    }

    public boolean isSuccess() { return error == null; }

    public Course getCourse() { return course; }

    public Throwable getError() { return error; }
}
