package com.keacast.assistant.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.service.CacheTier;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.service.UserContextLoader;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolComponent;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live account activity from the Keacast API, bypassing the context cache. Useful when the
 * user asks about a recent window other than the default one.
 */
@AiToolComponent
@RequiredArgsConstructor
public class GetSelectedAccountsTool implements AiTool {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final UserContextLoader loader;
    private final ContextCacheService cache;

    @Override
    public String name() {
        return "get_selected_accounts";
    }

    @Override
    public String description() {
        return "Activity of the current account straight from Keacast: recent and upcoming transactions, "
                + "categories, breakdown and available balance. startDate/endDate bound the recent window.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("startDate", Map.of("type", "string", "description", "Start of the recent window, yyyy-MM-dd"));
        props.put("endDate", Map.of("type", "string", "description", "End of the recent window, yyyy-MM-dd"));
        return Map.of("type", "object", "properties", props, "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        String accountId = ToolArgs.required(args, "accountId");
        LocalDate start = ToolArgs.date(args, "startDate");
        LocalDate end = ToolArgs.date(args, "endDate");
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        String token = ctx == null ? null : ctx.authToken();

        return cache.cached(CacheTier.USER_DATA, cache.keys().userData(userId), MAP,
                        () -> loader.loadUserData(userId, token))
                .flatMap(user -> loader.loadSelectedAccounts(userId, accountId, token, start, end, user))
                .map(selected -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("accounts", selected);
                    data.put("message", "Retrieved activity for " + selected.size()
                            + (selected.size() == 1 ? " account" : " accounts")
                            + (start == null && end == null ? "." : " (" + window(start, end) + ")."));
                    return ToolResult.success(null, name(), data);
                });
    }

    private static String window(LocalDate start, LocalDate end) {
        return (start == null ? "default start" : start.toString()) + " to " + (end == null ? "tomorrow" : end.toString());
    }
}
