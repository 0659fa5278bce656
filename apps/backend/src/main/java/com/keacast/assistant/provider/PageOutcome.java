package com.keacast.assistant.provider;

/**
 * Either a page, or the count-only fallback taken when the list query ran out of resources.
 */
public record PageOutcome<T>(
        PageResult<T> page,
        boolean resourceExhausted,
        long total,
        String message
) {
    public static <T> PageOutcome<T> ok(PageResult<T> page) {
        return new PageOutcome<>(page, false, page.total(), null);
    }

    public static <T> PageOutcome<T> resourceExhausted(long total, String message) {
        return new PageOutcome<>(null, true, total, message);
    }

    public boolean isOk() {
        return !resourceExhausted;
    }
}
