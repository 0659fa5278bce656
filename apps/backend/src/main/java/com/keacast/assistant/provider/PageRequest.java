package com.keacast.assistant.provider;

/**
 * 1-based page. {@code limit <= 0} means "use the family default".
 */
public record PageRequest(int page, int limit) {

    public static PageRequest first() {
        return new PageRequest(1, 0);
    }

    public static PageRequest of(Integer page, Integer limit) {
        return new PageRequest(page == null ? 1 : page, limit == null ? 0 : limit);
    }

    public PageRequest normalize(int defaultLimit, int maxLimit) {
        int p = Math.max(1, page);
        int l = limit <= 0 ? defaultLimit : limit;
        l = Math.max(1, Math.min(l, maxLimit));
        // offset 必须落在 int 范围内
        p = Math.min(p, Integer.MAX_VALUE / l);
        return new PageRequest(p, l);
    }

    public int offset() {
        long off = (long) (Math.max(1, page) - 1) * Math.max(0, limit);
        return (int) Math.min(off, Integer.MAX_VALUE);
    }
}
