package com.calendarreg.api.queue;

/**
 * Work performed by a queue worker for each admitted job. Implementations own persistence, result
 * delivery and the call to {@link RefreshQueue#markDone(RefreshKey)}.
 */
@FunctionalInterface
public interface RefreshJobHandler {

    void handle(RefreshJob job);
}
