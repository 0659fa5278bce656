package com.keacast.assistant.tools.impl;

import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.provider.DataFilter;
import com.keacast.assistant.provider.PageRequest;
import com.keacast.assistant.provider.UpcomingTransactionProvider;
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
public class GetUpcomingTransactionsTool implements AiTool {

    private final UpcomingTransactionProvider upcoming;

    @Override
    public String name() {
        return "get_upcoming_transactions";
    }

    @Override
    public String description() {
        return "List upcoming (forecasted) transactions of the current account in a date range. "
                + "Defaults to the next 30 days and forecastType F.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("startDate", Map.of("type", "string", "description", "Start date, yyyy-MM-dd"));
        props.put("endDate", Map.of("type", "string", "description", "End date, yyyy-MM-dd"));
        props.put("forecastType", Map.of("type", "string", "description", "F (forecast) or RF (recurring forecast)"));
        props.putAll(PagedToolResponses.PAGE_PROPERTIES);
        return Map.of("type", "object", "properties", props, "required", List.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
        DataFilter filter = DataFilter.account(ToolArgs.string(args, "userId"), ToolArgs.required(args, "accountId"))
                .withRange(ToolArgs.date(args, "startDate"), ToolArgs.date(args, "endDate"))
                .withForecastType(ToolArgs.string(args, "forecastType"));
        PageRequest page = PageRequest.of(ToolArgs.integer(args, "page"), ToolArgs.integer(args, "limit"));

        return Mono.fromCallable(() -> PagedToolResponses.render(
                        upcoming.list(filter, page), "upcoming", "upcoming transactions"))
                .subscribeOn(Schedulers.boundedElastic())
                .map(data -> ToolResult.success(null, name(), data));
    }
}
