package com.keacast.assistant.service;

import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Source of the data a context build needs. The cache decides which pieces are memoized.
 */
public interface UserContextLoader {

    Mono<Map<String, Object>> loadUserData(String userId, String token);

    Mono<Map<String, Object>> loadBalances(String userId, String accountId, String token);

    /**
     * Aggregated activity of one selected account: transactions, upcoming items, categories,
     * breakdown and availability.
     *
     * @param recentStart null 时取 ai.cache.recent-months 之前
     * @param recentEnd   null 时取明天
     */
    Mono<List<Map<String, Object>>> loadSelectedAccounts(String userId,
                                                         String accountId,
                                                         String token,
                                                         LocalDate recentStart,
                                                         LocalDate recentEnd,
                                                         Map<String, Object> userData);

    /**
     * Fetches the account activity and composes the context payload.
     *
     * @param userData profile data, possibly served from the USER_DATA tier
     * @param balances raw balances, possibly served from the BALANCES tier
     */
    Mono<Map<String, Object>> buildContext(String userId,
                                           String accountId,
                                           String token,
                                           Map<String, Object> userData,
                                           Map<String, Object> balances);
}
