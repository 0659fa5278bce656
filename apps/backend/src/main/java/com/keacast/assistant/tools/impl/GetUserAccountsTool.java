package com.keacast.assistant.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.provider.AccountProvider;
import com.keacast.assistant.provider.DataFilter;
import com.keacast.assistant.provider.PageRequest;
import com.keacast.assistant.service.CacheTier;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolComponent;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.support.PagedToolResponses;
import com.keacast.assistant.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@AiToolComponent
@RequiredArgsConstructor
public class GetUserAccountsTool implements AiTool {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final AccountProvider accounts;
    private final ContextCacheService cache;

    @Override
    public String name() {
        return "get_user_accounts";
    }

    @Override
    public String description() {
        return "List the user's financial accounts (paginated, 20 per page by default).";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", new LinkedHashMap<>(PagedToolResponses.PAGE_PROPERTIES),
                "required", List.of()
        );
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        PageRequest page = PageRequest.of(ToolArgs.integer(args, "page"), ToolArgs.integer(args, "limit"));

        Mono<Map<String, Object>> load = Mono.fromCallable(() -> PagedToolResponses.render(
                        accounts.list(DataFilter.owner(userId), page), "accounts", "accounts"))
                .subscribeOn(Schedulers.boundedElastic());

        // 只缓存默认首页，且不缓存降级结果
        Mono<Map<String, Object>> data = isDefaultFirstPage(page)
                ? cache.cached(CacheTier.QUICK_ACCESS, cache.keys().quickAccess(userId, "accounts"), MAP,
                        () -> load, m -> !m.containsKey("error"))
                : load;
        return data.map(m -> ToolResult.success(null, name(), m));
    }

    private static boolean isDefaultFirstPage(PageRequest page) {
        return page.page() <= 1 && page.limit() <= 0;
    }
}
