package com.keacast.assistant.tools;

import com.keacast.assistant.api.dto.ToolResult;
import reactor.core.publisher.Mono;

import java.util.Map;

public interface AiTool {
    String name();

    String description();

    Map<String, Object> parametersSchema();

    /**
     * Execute the tool with arguments already merged with the caller scope.
     * <p>
     * 返回的 data 顶层请带一个可读的 {@code message}，编排器生成摘要时优先用它；
     * 其余结构化字段照常返回。阻塞调用（数据库）放到 boundedElastic 上。
     * 抛出的异常与错误信号都会被执行器转成 ERROR 结果。
     */
    Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx);
}
