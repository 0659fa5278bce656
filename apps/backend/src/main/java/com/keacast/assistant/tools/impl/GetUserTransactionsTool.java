package com.keacast.assistant.tools.impl;

import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.provider.DataFilter;
import com.keacast.assistant.provider.PageRequest;
import com.keacast.assistant.provider.TransactionProvider;
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
public class GetUserTransactionsTool implements AiTool {

    private final TransactionProvider transactions;

    @Override
    public String name() {
        return "get_user_transactions";
    }

    @Override
    public String description() {
        return "List transactions of the current account, newest first. "
                + "Defaults to one year back and two years forward; narrow with startDate/endDate (yyyy-MM-dd).";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("startDate", Map.of("type", "string", "description", "Start date, yyyy-MM-dd"));
        props.put("endDate", Map.of("type", "string", "description", "End date, yyyy-MM-dd"));
        props.putAll(PagedToolResponses.PAGE_PROPERTIES);
        return Map.of("type", "object", "properties", props, "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        DataFilter filter = DataFilter.account(ToolArgs.required(args, "userId"), ToolArgs.required(args, "accountId"))
                .withRange(ToolArgs.date(args, "startDate"), ToolArgs.date(args, "endDate"));
        PageRequest page = PageRequest.of(ToolArgs.integer(args, "page"), ToolArgs.integer(args, "limit"));

        return Mono.fromCallable(() -> PagedToolResponses.render(
                        transactions.list(filter, page), "transactions", "transactions"))
                .subscribeOn(Schedulers.boundedElastic())
                .map(data -> ToolResult.success(null, name(), data));
    }
}
