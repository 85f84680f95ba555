package com.calendarreg.api.queue;

import java.util.List;

/**
 * Point-in-time view of a {@link RefreshQueue}.
 *
 * @param workers    number of worker threads
 * @param pending    jobs buffered but not yet picked up by a worker
 * @param processing keys currently in flight (admitted and not yet marked done)
 * @param processed  lifetime count of jobs marked done
 * @param codes      in-flight keys rendered as {@code code:acadyear:semester}
 */
public record QueueStatus(int workers, int pending, int processing, long processed, List<String> codes) {

    public QueueStatus {
        codes = List.copyOf(codes);
    }
}
