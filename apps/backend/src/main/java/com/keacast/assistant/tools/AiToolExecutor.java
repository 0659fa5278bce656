package com.keacast.assistant.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.api.dto.ToolCall;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.util.ToolPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeoutException;

/**
 * 一轮工具调用：
 * 1) 每个调用独立执行（有界并发 + 单个超时），结果顺序与请求顺序一致；
 * 2) 未知工具、参数解析失败、异常、超时都转成该调用自己的 ERROR 结果，不影响其它调用；
 * 3) 结果 payload 超过 result-max-bytes 时换成截断标记。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiToolExecutor {

    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final ObjectMapper mapper;
    private final AiProperties props;

    public Mono<List<ToolResult>> executeAll(List<ToolCall> calls, ToolCallContext ctx) {
        if (calls == null || calls.isEmpty()) {
            return Mono.just(List.of());
        }
        int concurrency = Math.max(1, props.getTools().getConcurrency());
        log.debug("[TOOL-EXEC] executing {} tool call(s) concurrency={}", calls.size(), concurrency);
        return Flux.fromIterable(calls)
                .flatMapSequential(call -> executeOne(call, ctx), concurrency)
                .collectList()
                .doOnNext(results -> log.debug("[TOOL-EXEC] completed {} tool call(s), errors={}",
                        results.size(), results.stream().filter(r -> !r.isSuccess()).count()));
    }

    Mono<ToolResult> executeOne(ToolCall call, ToolCallContext ctx) {
        Optional<AiTool> found = registry.get(call.name());
        if (found.isEmpty()) {
            log.warn("[EXEC-ERR] unknown tool={} id={}", call.name(), call.id());
            return Mono.just(ToolResult.error(call.id(), call.name(), "Unknown tool: " + call.name()));
        }
        AiTool tool = found.get();

        Map<String, Object> args;
        try {
            args = mergeScope(parseArgs(call.argumentsJson()), ctx);
        } catch (Exception e) {
            log.warn("[EXEC-ERR] tool={} id={} bad arguments: {}", tool.name(), call.id(), e.getMessage());
            return Mono.just(ToolResult.error(call.id(), tool.name(), "Invalid arguments: " + e.getMessage()));
        }

        long timeoutMs = props.getTools().getTimeoutMs();
        return Mono.defer(() -> tool.execute(args, ctx))
                .timeout(Duration.ofMillis(timeoutMs))
                .map(result -> bound(result.withCallId(call.id())))
                .doOnNext(r -> log.debug("[EXEC-OK] tool={} id={} status={} size={} truncated={}",
                        tool.name(), call.id(), r.status(), r.serializedSize(), r.truncated()))
                .onErrorResume(ex -> {
                    String msg = ex instanceof TimeoutException
                            ? "Tool timed out after " + timeoutMs + "ms"
                            : ex.getClass().getSimpleName() + ": " + ex.getMessage();
                    log.error("[EXEC-ERR] tool={} id={} ex={}", tool.name(), call.id(), msg, ex);
                    return Mono.just(ToolResult.error(call.id(), tool.name(), msg));
                })
                .defaultIfEmpty(ToolResult.error(call.id(), tool.name(), "Tool produced no result"));
    }

    private ToolResult bound(ToolResult result) {
        ToolPayloads.Bounded b = ToolPayloads.bound(result.data(), props.getTools().getResultMaxBytes(), mapper);
        if (b.truncated()) {
            log.warn("[TOOL-TRUNCATE] tool={} id={} originalSize={} limit={}",
                    result.name(), result.callId(), b.originalSize(), props.getTools().getResultMaxBytes());
        }
        return result.bounded(b.data(), b.originalSize(), b.truncated());
    }

    private Map<String, Object> parseArgs(String json) throws Exception {
        Map<String, Object> parsed = mapper.readValue(json == null || json.isBlank() ? "{}" : json, ARGS);
        return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
    }

    private static Map<String, Object> mergeScope(Map<String, Object> args, ToolCallContext ctx) {
        if (ctx == null) {
            return args;
        }
        // user_id / account_id 统一成驼峰
        normalizeAlias(args, "user_id", "userId");
        normalizeAlias(args, "account_id", "accountId");

        // 调用方作用域覆盖模型给的同名参数
        if (ctx.userId() != null) {
            args.put("userId", ctx.userId());
        }
        if (ctx.accountId() != null) {
            args.put("accountId", ctx.accountId());
        }
        return args;
    }

    private static void normalizeAlias(Map<String, Object> args, String alias, String canonical) {
        Object v = args.remove(alias);
        if (v != null) {
            args.putIfAbsent(canonical, v);
        }
    }
}
