package com.keacast.assistant.tools.impl;

import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.client.KeacastApiClient;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolComponent;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Records a transaction on the current account. The account's cached context, balances and
 * transaction pages are invalidated afterwards so the next turn sees the new entry.
 */
@Slf4j
@AiToolComponent
@RequiredArgsConstructor
public class CreateTransactionTool implements AiTool {

    static final List<String> TYPES = List.of("income", "expense");
    static final List<String> FREQUENCIES = List.of("once", "weekly", "biweekly", "monthly", "yearly");

    private final KeacastApiClient api;
    private final ContextCacheService cache;

    @Override
    public String name() {
        return "create_transaction";
    }

    @Override
    public String description() {
        return "Create a transaction on the current account. Only call this when the user explicitly asks "
                + "to add a transaction; amount is always positive, type decides the sign.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("title", Map.of("type", "string", "description", "Short description, e.g. merchant name"));
        props.put("amount", Map.of("type", "number", "description", "Positive amount"));
        props.put("type", Map.of("type", "string", "enum", TYPES));
        props.put("date", Map.of("type", "string", "description", "Transaction date, yyyy-MM-dd"));
        props.put("category", Map.of("type", "string", "description", "Category name"));
        props.put("frequency", Map.of("type", "string", "enum", FREQUENCIES, "description", "Defaults to once"));
        props.put("notes", Map.of("type", "string"));
        return Map.of("type", "object", "properties", props, "required", List.of("title", "amount", "type", "date"));
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        String accountId = ToolArgs.required(args, "accountId");
        String title = ToolArgs.required(args, "title");
        BigDecimal amount = ToolArgs.number(args, "amount");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be a positive number");
        }
        String type = oneOf(args, "type", TYPES, null);
        LocalDate date = ToolArgs.date(args, "date");
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        String frequency = oneOf(args, "frequency", FREQUENCIES, "once");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("accountId", accountId);
        body.put("title", title);
        body.put("amount", "expense".equals(type) ? amount.negate() : amount);
        body.put("type", type);
        body.put("date", date.toString());
        body.put("frequency", frequency);
        putIfPresent(body, "category", ToolArgs.string(args, "category"));
        putIfPresent(body, "notes", ToolArgs.string(args, "notes"));

        String token = ctx == null ? null : ctx.authToken();
        return api.createTransaction(userId, accountId, token, body)
                .flatMap(saved -> cache.invalidate(userId, accountId).thenReturn(saved))
                .map(saved -> {
                    log.info("[TOOL] created transaction user={} account={} type={} date={}", userId, accountId, type, date);
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("transaction", saved);
                    data.put("message", "Created " + type + " '" + title + "' of " + amount.toPlainString()
                            + " on " + date + ("once".equals(frequency) ? "." : ", repeating " + frequency + "."));
                    return ToolResult.success(null, name(), data);
                });
    }

    private static String oneOf(Map<String, Object> args, String key, List<String> allowed, String fallback) {
        String v = ToolArgs.string(args, key);
        if (v == null) {
            if (fallback == null) {
                throw new IllegalArgumentException(key + " is required");
            }
            return fallback;
        }
        String lower = v.toLowerCase(Locale.ROOT);
        if (!allowed.contains(lower)) {
            throw new IllegalArgumentException(key + " must be one of " + allowed + ", got '" + v + "'");
        }
        return lower;
    }

    private static void putIfPresent(Map<String, Object> body, String key, String value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
