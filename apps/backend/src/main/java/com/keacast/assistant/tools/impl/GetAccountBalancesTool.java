package com.keacast.assistant.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.config.CacheProperties;
import com.keacast.assistant.service.CacheTier;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.service.UserContextLoader;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolComponent;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.support.ToolArgs;
import com.keacast.assistant.util.BalanceWindow;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@AiToolComponent
@RequiredArgsConstructor
public class GetAccountBalancesTool implements AiTool {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final UserContextLoader loader;
    private final ContextCacheService cache;
    private final CacheProperties cacheProps;
    private final Clock clock;

    @Override
    public String name() {
        return "get_account_balances";
    }

    @Override
    public String description() {
        return "Forecasted daily balances of the current account, from 6 months back to 12 months ahead.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        String accountId = ToolArgs.required(args, "accountId");
        String token = ctx == null ? null : ctx.authToken();

        return cache.cached(CacheTier.BALANCES, cache.keys().balances(userId, accountId), MAP,
                        () -> loader.loadBalances(userId, accountId, token))
                .map(raw -> {
                    List<Object> window = BalanceWindow.forecasted(raw, LocalDate.now(clock),
                            cacheProps.getBalancesMonthsBack(), cacheProps.getBalancesMonthsForward());
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("balances", window);
                    data.put("message", "Found " + window.size() + " forecasted balance records.");
                    return ToolResult.success(null, name(), data);
                });
    }
}
