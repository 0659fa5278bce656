package com.keacast.assistant.service.dto;

import java.util.List;

public record CacheStats(
        String userId,
        int totalKeys,
        List<KeyStat> keys,
        long totalSize,
        double totalSizeKB,
        double totalSizeMB
) {
    /**
     * @param ttlSeconds -1 表示没有过期时间
     */
    public record KeyStat(String key, long ttlSeconds, long size, double sizeKB) { }

    public static double kb(long bytes) {
        return Math.round(bytes / 1024.0 * 100) / 100.0;
    }

    public static double mb(long bytes) {
        return Math.round(bytes / (1024.0 * 1024.0) * 100) / 100.0;
    }
}
