package com.keacast.assistant.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.api.dto.ToolCall;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.config.AiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AiToolExecutorTests {

    static class CapturingTool implements AiTool {
        Map<String, Object> lastArgs;
        @Override public String name() { return "echo_tool"; }
        @Override public String description() { return "captures args and echoes"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object", "properties", Map.of()); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            lastArgs = args;
            return Mono.just(ToolResult.success(null, name(), Map.of("echo", String.valueOf(args.get("p")))));
        }
    }

    static class ThrowingTool implements AiTool {
        @Override public String name() { return "broken_tool"; }
        @Override public String description() { return "always throws"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object"); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            throw new IllegalStateException("database down");
        }
    }

    static class SlowTool implements AiTool {
        @Override public String name() { return "slow_tool"; }
        @Override public String description() { return "never answers"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object"); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            return Mono.never();
        }
    }

    static class BigTool implements AiTool {
        @Override public String name() { return "big_tool"; }
        @Override public String description() { return "returns a large payload"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object"); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            return Mono.just(ToolResult.success(null, name(), Map.of("rows", "r".repeat(5_000))));
        }
    }

    private final ObjectMapper om = new ObjectMapper();
    private final ToolCallContext ctx = new ToolCallContext("u1", "a1", "tok", "s1");
    private AiProperties props;
    private CapturingTool echo;
    private AiToolExecutor exec;

    @BeforeEach
    void setUp() {
        props = new AiProperties();
        props.getTools().setTimeoutMs(200);
        props.getTools().setResultMaxBytes(1_000);
        echo = new CapturingTool();
        ToolRegistry registry = new ToolRegistry(List.of(echo, new ThrowingTool(), new SlowTool(), new BigTool()));
        exec = new AiToolExecutor(registry, om, props);
    }

    @Test
    void one_failing_call_does_not_affect_the_others_and_order_is_kept() {
        List<ToolCall> calls = List.of(
                ToolCall.of("c1", "echo_tool", "{\"p\":\"one\"}"),
                ToolCall.of("c2", "broken_tool", "{}"),
                ToolCall.of("c3", "echo_tool", "{\"p\":\"three\"}"));

        List<ToolResult> results = exec.executeAll(calls, ctx).block(Duration.ofSeconds(5));

        assertNotNull(results);
        assertEquals(List.of("c1", "c2", "c3"), results.stream().map(ToolResult::callId).toList());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertTrue(results.get(1).errorMessage().contains("database down"));
        assertTrue(results.get(2).isSuccess());
        assertEquals(Map.of("echo", "three"), results.get(2).data());
    }

    @Test
    void unknown_tool_and_bad_arguments_become_error_results() {
        List<ToolCall> calls = List.of(
                ToolCall.of("c1", "no_such_tool", "{}"),
                ToolCall.of("c2", "echo_tool", "{not json"));

        List<ToolResult> results = exec.executeAll(calls, ctx).block(Duration.ofSeconds(5));

        assertNotNull(results);
        assertEquals(ToolResult.ERROR, results.get(0).status());
        assertTrue(results.get(0).errorMessage().startsWith("Unknown tool"));
        assertEquals(ToolResult.ERROR, results.get(1).status());
        assertTrue(results.get(1).errorMessage().startsWith("Invalid arguments"));
        assertEquals("c2", results.get(1).callId());
    }

    @Test
    void timeout_is_reported_per_call() {
        ToolResult r = exec.executeOne(ToolCall.of("c9", "slow_tool", "{}"), ctx).block(Duration.ofSeconds(5));

        assertNotNull(r);
        assertFalse(r.isSuccess());
        assertEquals("Tool timed out after 200ms", r.errorMessage());
    }

    @Test
    void caller_scope_overrides_model_supplied_ids() {
        exec.executeOne(ToolCall.of("c1", "echo_tool",
                "{\"p\":\"v\",\"user_id\":\"attacker\",\"accountId\":\"other\"}"), ctx).block(Duration.ofSeconds(5));

        assertEquals("u1", echo.lastArgs.get("userId"));
        assertEquals("a1", echo.lastArgs.get("accountId"));
        assertFalse(echo.lastArgs.containsKey("user_id"));
        assertEquals("v", echo.lastArgs.get("p"));
    }

    @Test
    void oversized_payload_is_replaced_by_truncation_marker() {
        ToolResult r = exec.executeOne(ToolCall.of("c1", "big_tool", "{}"), ctx).block(Duration.ofSeconds(5));

        assertNotNull(r);
        assertTrue(r.isSuccess());
        assertTrue(r.truncated());
        assertTrue(r.serializedSize() > 5_000);
        Map<?, ?> data = assertInstanceOf(Map.class, r.data());
        assertEquals(Boolean.TRUE, data.get("_truncated"));
        assertEquals(r.serializedSize(), ((Number) data.get("_originalSize")).intValue());
        assertTrue(om.valueToTree(data).toString().getBytes(java.nio.charset.StandardCharsets.UTF_8).length <= 1_000);
    }

    @Test
    void tool_lookup_is_case_insensitive() {
        ToolResult r = exec.executeOne(ToolCall.of("c1", "ECHO_TOOL", "{\"p\":\"x\"}"), ctx).block(Duration.ofSeconds(5));

        assertNotNull(r);
        assertTrue(r.isSuccess());
    }

    @Test
    void empty_call_list_yields_empty_results() {
        assertEquals(List.of(), exec.executeAll(List.of(), ctx).block());
    }
}
