package com.calendarreg.api.queue;

import java.util.Objects;

/**
 * Composite identity of a refreshable course offering. Two jobs with equal keys are the same unit
 * of work as far as deduplication is concerned.
 */
public record RefreshKey(String code, int acadyear, int semester) {

    public RefreshKey {
        Objects.requireNonNull(code, "code");
    }

    /** Renders as {@code code:acadyear:semester}, e.g. {@code CS101:2568:1}. */
    @Override
    public String toString() {
        return code + ":" + acadyear + ":" + semester;
    }
}
