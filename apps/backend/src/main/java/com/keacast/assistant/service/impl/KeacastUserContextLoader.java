package com.keacast.assistant.service.impl;

import com.keacast.assistant.client.KeacastApiClient;
import com.keacast.assistant.config.CacheProperties;
import com.keacast.assistant.service.UserContextLoader;
import com.keacast.assistant.util.BalanceWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class KeacastUserContextLoader implements UserContextLoader {

    private final KeacastApiClient api;
    private final CacheProperties cacheProps;
    private final Clock clock;

    @Override
    public Mono<Map<String, Object>> loadUserData(String userId, String token) {
        return api.getUserData(userId, token);
    }

    @Override
    public Mono<Map<String, Object>> loadBalances(String userId, String accountId, String token) {
        return api.getBalances(userId, accountId, token);
    }

    @Override
    public Mono<Map<String, Object>> buildContext(String userId,
                                                  String accountId,
                                                  String token,
                                                  Map<String, Object> userData,
                                                  Map<String, Object> balances) {
        LocalDate today = LocalDate.now(clock);
        return loadSelectedAccounts(userId, accountId, token, null, null, userData)
                .map(selected -> compose(accountId, today, userData, balances, selected));
    }

    @Override
    public Mono<List<Map<String, Object>>> loadSelectedAccounts(String userId,
                                                                String accountId,
                                                                String token,
                                                                LocalDate recentStart,
                                                                LocalDate recentEnd,
                                                                Map<String, Object> userData) {
        LocalDate today = LocalDate.now(clock);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("currentDate", today.toString());
        body.put("forecastType", "F");
        body.put("recentStart", (recentStart == null ? today.minusMonths(cacheProps.getRecentMonths()) : recentStart).toString());
        body.put("recentEnd", (recentEnd == null ? today.plusDays(1) : recentEnd).toString());
        body.put("upcomingEnd", today.plusDays(cacheProps.getUpcomingDays()).toString());
        body.put("page", "layout");
        body.put("position", 0);
        body.put("selectedAccounts", List.of(accountId));
        body.put("user", userData == null ? Map.of() : userData);

        return api.getSelectedAccounts(userId, token, body);
    }

    private Map<String, Object> compose(String accountId,
                                        LocalDate today,
                                        Map<String, Object> userData,
                                        Map<String, Object> balances,
                                        List<Map<String, Object>> selected) {
        Map<String, Object> first = selected.isEmpty() ? Map.of() : selected.get(0);
        List<Object> filteredBalances = BalanceWindow.forecasted(balances, today,
                cacheProps.getBalancesMonthsBack(), cacheProps.getBalancesMonthsForward());

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("userData", userData == null ? Map.of() : userData);
        ctx.put("selectedAccounts", selected);
        ctx.put("categories", first.getOrDefault("categories", List.of()));
        ctx.put("cfTransactions", first.getOrDefault("cfTransactions", List.of()));
        ctx.put("upcomingTransactions", first.getOrDefault("upcoming", List.of()));
        ctx.put("possibleRecurringTransactions", first.getOrDefault("plaidRecurrings", List.of()));
        ctx.put("recentTransactions", first.getOrDefault("recents", List.of()));
        ctx.put("breakdown", first.getOrDefault("breakdown", List.of()));
        ctx.put("available", first.getOrDefault("available", List.of()));
        ctx.put("balances", filteredBalances);
        ctx.put("currentDate", today.toString());
        ctx.put("accountId", accountId);

        log.debug("[CTX-BUILD] accountId={} selected={} balances={}", accountId, selected.size(), filteredBalances.size());
        return ctx;
    }
}
