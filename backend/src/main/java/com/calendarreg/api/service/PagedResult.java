package com.calendarreg.api.service;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results. A {@code limit} of 0 means every item in a single page.
 */
public record PagedResult<T>(List<T> items, int page, int limit, long total, int totalPages) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static <T> PagedResult<T> of(List<T> items, int page, int limit, long total) {
        int pages;
        if (limit > 0) {
            pages = (int) ((total + limit - 1) / limit);
        } else {
            pages = total > 0 ? 1 : 0;
        }
        return new PagedResult<>(List.copyOf(items), page, limit, total, pages);
    }

    public static int normalizePage(int page) {
        return page < 1 ? DEFAULT_PAGE : page;
    }

    public static int normalizeLimit(int limit) {
        if (limit < 0) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        return new PagedResult<>(items.stream().<R>map(mapper).toList(), page, limit, total, totalPages);
    }
}
