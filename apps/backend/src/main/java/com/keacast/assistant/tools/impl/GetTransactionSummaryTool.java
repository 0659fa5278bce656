package com.keacast.assistant.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.mapper.model.TransactionSummary;
import com.keacast.assistant.provider.DataFilter;
import com.keacast.assistant.provider.TransactionProvider;
import com.keacast.assistant.service.CacheTier;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolComponent;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates (count, income, expenses, net) without loading rows; the cheap answer to
 * "how much did I spend" questions.
 */
@AiToolComponent
@RequiredArgsConstructor
public class GetTransactionSummaryTool implements AiTool {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final TransactionProvider transactions;
    private final ContextCacheService cache;

    @Override
    public String name() {
        return "get_transaction_summary";
    }

    @Override
    public String description() {
        return "Summarize transactions of the current account in a date range: count, income, expenses, net.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("startDate", Map.of("type", "string", "description", "Start date, yyyy-MM-dd"));
        props.put("endDate", Map.of("type", "string", "description", "End date, yyyy-MM-dd"));
        return Map.of("type", "object", "properties", props, "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        String userId = ToolArgs.required(args, "userId");
        String accountId = ToolArgs.required(args, "accountId");
        DataFilter filter = DataFilter.account(userId, accountId)
                .withRange(ToolArgs.date(args, "startDate"), ToolArgs.date(args, "endDate"));
        String range = filter.startDate() + "_" + filter.endDate();

        Mono<Map<String, Object>> load = Mono.fromCallable(() -> render(transactions.summarize(filter)))
                .subscribeOn(Schedulers.boundedElastic());

        return cache.cached(CacheTier.TRANSACTIONS, cache.keys().transactions(userId, accountId, range), MAP, () -> load)
                .map(data -> ToolResult.success(null, name(), data));
    }

    private static Map<String, Object> render(TransactionSummary s) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("totalCount", s.getTotalCount());
        data.put("income", s.getIncome());
        data.put("expenses", s.getExpenses());
        data.put("net", s.getNet());
        data.put("firstDate", s.getFirstDate() == null ? null : s.getFirstDate().toString());
        data.put("lastDate", s.getLastDate() == null ? null : s.getLastDate().toString());
        data.put("message", String.format("%d transactions: income %s, expenses %s, net %s.",
                s.getTotalCount(), s.getIncome(), s.getExpenses(), s.getNet()));
        return data;
    }
}
