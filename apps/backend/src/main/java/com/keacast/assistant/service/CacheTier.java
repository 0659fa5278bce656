package com.keacast.assistant.service;

import com.keacast.assistant.config.CacheProperties;

import java.time.Duration;

public enum CacheTier {
    USER_CONTEXT,
    USER_DATA,
    BALANCES,
    TRANSACTIONS,
    QUICK_ACCESS;

    public Duration ttl(CacheProperties props) {
        long seconds = switch (this) {
            case USER_CONTEXT -> props.getUserContextSeconds();
            case USER_DATA -> props.getUserDataSeconds();
            case BALANCES -> props.getBalancesSeconds();
            case TRANSACTIONS -> props.getTransactionsSeconds();
            case QUICK_ACCESS -> props.getQuickAccessSeconds();
        };
        return Duration.ofSeconds(seconds);
    }
}
