package com.keacast.assistant.provider;

import java.util.List;

public record PageResult<T>(
        List<T> items,
        int page,
        int limit,
        long total,
        int pages,
        boolean hasNext,
        boolean hasPrev
) {
    public static <T> PageResult<T> of(List<T> items, PageRequest request, long total) {
        int limit = Math.max(1, request.limit());
        int pages = (int) ((total + limit - 1) / limit);
        return new PageResult<>(
                items == null ? List.of() : List.copyOf(items),
                request.page(),
                limit,
                total,
                pages,
                (long) request.page() * limit < total,
                request.page() > 1);
    }
}
