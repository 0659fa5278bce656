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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@AiToolComponent
@RequiredArgsConstructor
public class GetUserDataTool implements AiTool {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final UserContextLoader loader;
    private final ContextCacheService cache;

    @Override
    public String name() {
        return "get_user_data";
    }

    @Override
    public String description() {
        return "The current user's Keacast profile and settings.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        String token = ctx == null ? null : ctx.authToken();

        // 与上下文重建共用 USER_DATA 层
        return cache.cached(CacheTier.USER_DATA, cache.keys().userData(userId), MAP,
                        () -> loader.loadUserData(userId, token))
                .map(user -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("user", user);
                    data.put("message", user.isEmpty()
                            ? "No profile data found for this user."
                            : "Retrieved profile data (" + user.size() + " fields).");
                    return ToolResult.success(null, name(), data);
                });
    }
}
