package com.keacast.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 上下文缓存配置：各层 TTL 与新鲜度阈值。
 *
 * <p>{@code freshnessMinutes} is evaluated against the separate last-updated marker and is
 * normally much shorter than {@code userContextSeconds}.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai.cache")
public class CacheProperties {

    private boolean enabled = true;
    private long freshnessMinutes = 30;
    private String keyPrefix = "ctx";

    private long userContextSeconds = 3_600;
    private long userDataSeconds = 7_200;
    private long balancesSeconds = 1_800;
    private long transactionsSeconds = 1_800;
    private long quickAccessSeconds = 600;

    /** Forecasted balances outside [now - 6 months, now + 12 months] are dropped from the context. */
    private int balancesMonthsBack = 6;
    private int balancesMonthsForward = 12;
    private int recentMonths = 3;
    private int upcomingDays = 14;
}
