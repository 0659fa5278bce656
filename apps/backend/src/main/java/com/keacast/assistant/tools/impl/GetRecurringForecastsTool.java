package com.keacast.assistant.tools.impl;

import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.provider.DataFilter;
import com.keacast.assistant.provider.PageRequest;
import com.keacast.assistant.provider.RecurringForecastProvider;
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
public class GetRecurringForecastsTool implements AiTool {

    private final RecurringForecastProvider forecasts;

    @Override
    public String name() {
        return "get_recurring_forecasts";
    }

    @Override
    public String description() {
        return "List recurring and forecasted transactions (bills, paychecks) of the current account.";
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
        DataFilter filter = DataFilter.account(ToolArgs.string(args, "userId"), ToolArgs.required(args, "accountId"));
        PageRequest page = PageRequest.of(ToolArgs.integer(args, "page"), ToolArgs.integer(args, "limit"));

        return Mono.fromCallable(() -> PagedToolResponses.render(
                        forecasts.list(filter, page), "forecasts", "recurring forecasts"))
                .subscribeOn(Schedulers.boundedElastic())
                .map(data -> ToolResult.success(null, name(), data));
    }
}
