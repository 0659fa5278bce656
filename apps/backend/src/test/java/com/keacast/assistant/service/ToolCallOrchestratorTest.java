package com.keacast.assistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.ai.CompletionGateway;
import com.keacast.assistant.ai.UpstreamException;
import com.keacast.assistant.api.dto.CachedContext;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.ChatReply;
import com.keacast.assistant.api.dto.ChatRequest;
import com.keacast.assistant.api.dto.CompletionRequest;
import com.keacast.assistant.api.dto.CompletionResponse;
import com.keacast.assistant.api.dto.MessageRole;
import com.keacast.assistant.api.dto.SummarizeRequest;
import com.keacast.assistant.api.dto.ToolCall;
import com.keacast.assistant.api.dto.ToolResult;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.service.dto.SessionHistory;
import com.keacast.assistant.service.impl.ContextAssemblerImpl;
import com.keacast.assistant.tools.AiTool;
import com.keacast.assistant.tools.AiToolExecutor;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ToolCallOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    static class AccountsTool implements AiTool {
        @Override public String name() { return "get_user_accounts"; }
        @Override public String description() { return "accounts"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object"); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            return Mono.just(ToolResult.success(null, name(),
                    Map.of("message", "Retrieved 2 accounts for " + args.get("userId"), "total_count", 2)));
        }
    }

    /** 大结果：长说明 + 约 20KB 的明细 */
    static class LedgerTool implements AiTool {
        final AtomicInteger invocations = new AtomicInteger();
        @Override public String name() { return "get_user_transactions"; }
        @Override public String description() { return "transactions"; }
        @Override public Map<String, Object> parametersSchema() { return Map.of("type", "object"); }
        @Override public Mono<ToolResult> execute(Map<String, Object> args, ToolCallContext ctx) {
            invocations.incrementAndGet();
            List<Map<String, Object>> rows = IntStream.range(0, 400)
                    .mapToObj(i -> Map.<String, Object>of("id", i, "title", "Coffee shop purchase #" + i, "amount", -4.5))
                    .toList();
            String message = "Found 400 transactions.\n" + "Most spending goes to coffee shops and groceries. ".repeat(60);
            return Mono.just(ToolResult.success(null, name(), Map.of("message", message, "transactions", rows)));
        }
    }

    private final ObjectMapper om = new ObjectMapper();
    private ConversationMemoryService memory;
    private ContextCacheService contextCache;
    private CompletionGateway gateway;
    private ToolCallOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        AiProperties props = new AiProperties();
        memory = Mockito.mock(ConversationMemoryService.class);
        contextCache = Mockito.mock(ContextCacheService.class);
        gateway = Mockito.mock(CompletionGateway.class);
        when(memory.read(anyString())).thenReturn(Mono.just(SessionHistory.of(List.of(
                ChatMessage.user("hi"), ChatMessage.assistant("hello")))));
        when(memory.append(anyString(), any())).thenReturn(Mono.empty());
        when(contextCache.get(anyString(), anyString(), any())).thenReturn(Mono.just(
                CachedContext.fresh("u1", "a1", Map.of("balance", 120), Instant.parse("2025-06-15T10:00:00Z"))));

        ToolRegistry registry = new ToolRegistry(List.of(new AccountsTool()));
        AiToolExecutor executor = new AiToolExecutor(registry, om, props);
        orchestrator = new ToolCallOrchestrator(memory, contextCache, new ContextAssemblerImpl(props, om),
                gateway, registry, executor, props, om);
    }

    private static ChatRequest request(String message) {
        return new ChatRequest("s1", "u1", "a1", "tok", message, null, null, null);
    }

    private static CompletionResponse text(String content) {
        return new CompletionResponse(content, List.of(), "stop", false);
    }

    @SuppressWarnings("unchecked")
    private List<ChatMessage> appended() {
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(memory).append(eq("s1"), captor.capture());
        return captor.getValue();
    }

    @Test
    void plain_answer_is_returned_and_persisted_as_one_pair() {
        when(gateway.complete(any())).thenReturn(Mono.just(text("You have $120.")));

        ChatReply reply = orchestrator.chat(request("balance?")).block(WAIT);

        assertNotNull(reply);
        assertEquals("You have $120.", reply.response());
        assertEquals(2, reply.memoryUsed());
        assertFalse(reply.degraded());
        List<ChatMessage> pair = appended();
        assertEquals(List.of(ChatMessage.user("balance?"), ChatMessage.assistant("You have $120.")), pair);

        ArgumentCaptor<CompletionRequest> req = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway).complete(req.capture());
        assertEquals(CompletionRequest.TOOL_CHOICE_AUTO, req.getValue().toolChoice());
        assertEquals(1, req.getValue().tools().size());
        List<ChatMessage> sent = req.getValue().messages();
        assertEquals(MessageRole.SYSTEM, sent.get(0).role());
        assertTrue(sent.get(sent.size() - 2).content().contains("\"balance\":120"));
        assertEquals("balance?", sent.get(sent.size() - 1).content());
    }

    @Test
    void tool_round_feeds_summary_turn_into_final_completion() {
        CompletionResponse withTools = new CompletionResponse("", List.of(
                ToolCall.of("call_1", "get_user_accounts", "{\"userId\":\"someone-else\"}")), "tool_calls", false);
        when(gateway.complete(any())).thenReturn(Mono.just(withTools), Mono.just(text("You have 2 accounts.")));

        ChatReply reply = orchestrator.chat(request("how many accounts?")).block(WAIT);

        assertNotNull(reply);
        assertEquals("You have 2 accounts.", reply.response());
        assertEquals(List.of("get_user_accounts: Retrieved 2 accounts for u1"), reply.toolSummaries());

        ArgumentCaptor<CompletionRequest> req = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway, times(2)).complete(req.capture());
        CompletionRequest fin = req.getAllValues().get(1);
        assertEquals(CompletionRequest.TOOL_CHOICE_NONE, fin.toolChoice());
        ChatMessage last = fin.messages().get(fin.messages().size() - 1);
        assertEquals(MessageRole.USER, last.role());
        assertTrue(last.content().startsWith("Tool results:"));
        // 每个工具一行自然语言，没有原始 JSON
        assertEquals(List.of("- get_user_accounts: Retrieved 2 accounts for u1"),
                last.content().lines().filter(l -> l.startsWith("- ")).toList());
        assertFalse(last.content().contains("{"));
        ChatMessage data = fin.messages().get(fin.messages().size() - 2);
        assertTrue(data.content().startsWith(ToolCallOrchestrator.TOOL_DATA_HEADER));
        assertTrue(data.content().contains("\"total_count\":2"));
        assertTrue(fin.messages().stream().noneMatch(m -> m.role() == MessageRole.TOOL));

        List<ChatMessage> pair = appended();
        assertEquals(2, pair.size());
        assertEquals("how many accounts?", pair.get(0).content());
        assertEquals("You have 2 accounts.\n\n[tools: get_user_accounts=ok]", pair.get(1).content());
    }

    @Test
    void oversized_tool_round_is_capped_and_fitted_into_byte_budget() {
        AiProperties props = new AiProperties();
        props.getContext().setMaxBytes(6_000);
        ContextAssemblerImpl assembler = new ContextAssemblerImpl(props, om);
        LedgerTool ledger = new LedgerTool();
        ToolRegistry registry = new ToolRegistry(List.of(ledger));
        ToolCallOrchestrator orch = new ToolCallOrchestrator(memory, contextCache, assembler, gateway, registry,
                new AiToolExecutor(registry, om, props), props, om);
        List<ToolCall> calls = IntStream.range(0, 10)
                .mapToObj(i -> ToolCall.of("call_" + i, "get_user_transactions", "{}"))
                .toList();
        when(gateway.complete(any())).thenReturn(
                Mono.just(new CompletionResponse("", calls, "tool_calls", false)),
                Mono.just(text("Mostly coffee.")));

        ChatReply reply = orch.chat(request("where does my money go?")).block(WAIT);

        assertNotNull(reply);
        assertEquals("Mostly coffee.", reply.response());
        assertEquals(props.getTools().getMaxCallsPerRound(), ledger.invocations.get());
        assertEquals(10, reply.toolSummaries().size());
        assertFalse(reply.degradations().contains(ToolCallOrchestrator.CONTEXT_OVER_BUDGET));

        ArgumentCaptor<CompletionRequest> req = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway, times(2)).complete(req.capture());
        List<ChatMessage> fin = req.getAllValues().get(1).messages();
        assertTrue(assembler.measure(fin) <= 6_000, "final request is " + assembler.measure(fin) + " bytes");

        String toolTurn = fin.get(fin.size() - 1).content();
        List<String> lines = toolTurn.lines().filter(l -> l.startsWith("- ")).toList();
        assertEquals(10, lines.size());
        assertEquals(2, lines.stream().filter(l -> l.contains("Not executed: at most 8 tool calls")).count());
        assertTrue(lines.get(0).startsWith("- get_user_transactions: Found 400 transactions."));
        assertFalse(toolTurn.contains("Coffee shop purchase"));
    }

    @Test
    void prompt_is_reassembled_when_tool_turn_does_not_fit_beside_it() {
        AiProperties props = new AiProperties();
        props.getContext().setMaxBytes(3_000);
        ContextAssemblerImpl assembler = new ContextAssemblerImpl(props, om);
        ToolRegistry registry = new ToolRegistry(List.of(new AccountsTool()));
        ToolCallOrchestrator orch = new ToolCallOrchestrator(memory, contextCache, assembler, gateway, registry,
                new AiToolExecutor(registry, om, props), props, om);
        String oldQuestion = "a".repeat(1_100);
        when(memory.read(anyString())).thenReturn(Mono.just(SessionHistory.of(List.of(
                ChatMessage.user(oldQuestion), ChatMessage.assistant("b".repeat(1_100))))));
        List<ToolCall> calls = IntStream.range(0, 6)
                .mapToObj(i -> ToolCall.of("call_" + i, "get_user_accounts", "{}"))
                .toList();
        when(gateway.complete(any())).thenReturn(
                Mono.just(new CompletionResponse("", calls, "tool_calls", false)),
                Mono.just(text("Two accounts.")));

        ChatReply reply = orch.chat(request("q?")).block(WAIT);

        assertNotNull(reply);
        assertEquals(List.of(), reply.degradations());
        ArgumentCaptor<CompletionRequest> req = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway, times(2)).complete(req.capture());
        List<ChatMessage> first = req.getAllValues().get(0).messages();
        List<ChatMessage> fin = req.getAllValues().get(1).messages();
        assertTrue(first.stream().anyMatch(m -> oldQuestion.equals(m.content())));
        assertTrue(fin.stream().noneMatch(m -> oldQuestion.equals(m.content())));
        assertTrue(assembler.measure(fin) <= 3_000);
        assertEquals(6, fin.get(fin.size() - 1).content().lines().filter(l -> l.startsWith("- ")).count());
    }

    @Test
    void failed_final_completion_is_synthesized_from_tool_results() {
        CompletionResponse withTools = new CompletionResponse("", List.of(
                ToolCall.of("call_1", "get_user_accounts", "{}")), "tool_calls", false);
        when(gateway.complete(any())).thenReturn(Mono.just(withTools),
                Mono.error(UpstreamException.ofStatus(503, "down", null)));

        ChatReply reply = orchestrator.chat(request("accounts?")).block(WAIT);

        assertNotNull(reply);
        assertTrue(reply.response().startsWith("Here is what I found:"));
        assertTrue(reply.response().contains("Retrieved 2 accounts"));
        assertTrue(reply.degradations().contains(ToolCallOrchestrator.FINAL_COMPLETION_FAILED));
        verify(memory).append(eq("s1"), any());
    }

    @Test
    void unknown_tool_is_reported_but_turn_completes() {
        CompletionResponse withTools = new CompletionResponse("", List.of(
                ToolCall.of("call_1", "delete_everything", "{}")), "tool_calls", false);
        when(gateway.complete(any())).thenReturn(Mono.just(withTools), Mono.just(text("I could not do that.")));

        ChatReply reply = orchestrator.chat(request("wipe it")).block(WAIT);

        assertNotNull(reply);
        assertEquals("I could not do that.", reply.response());
        assertEquals(List.of(ToolCallOrchestrator.TOOL_ERRORS), reply.degradations());
        assertTrue(appended().get(1).content().endsWith("[tools: delete_everything=error]"));
    }

    @Test
    void upstream_outage_returns_apology_and_persists_nothing() {
        when(gateway.complete(any())).thenReturn(Mono.error(UpstreamException.ofStatus(429, "", null)));

        ChatReply reply = orchestrator.chat(request("hello?")).block(WAIT);

        assertNotNull(reply);
        assertEquals(ToolCallOrchestrator.APOLOGY, reply.response());
        assertTrue(reply.degradations().contains(ToolCallOrchestrator.UPSTREAM_UNAVAILABLE));
        verify(memory, never()).append(anyString(), any());
    }

    @Test
    void auth_failure_propagates() {
        when(gateway.complete(any())).thenReturn(Mono.error(UpstreamException.ofStatus(401, "", null)));

        StepVerifier.create(orchestrator.chat(request("hello?")))
                .expectErrorSatisfies(e -> assertEquals(UpstreamException.Kind.AUTH,
                        ((UpstreamException) e).getKind()))
                .verify(WAIT);
        verify(memory, never()).append(anyString(), any());
    }

    @Test
    void malformed_answer_is_empty_and_not_persisted() {
        when(gateway.complete(any())).thenReturn(Mono.just(CompletionResponse.empty()));

        ChatReply reply = orchestrator.chat(request("hello?")).block(WAIT);

        assertNotNull(reply);
        assertEquals("", reply.response());
        assertEquals(List.of(ToolCallOrchestrator.UPSTREAM_MALFORMED), reply.degradations());
        verify(memory, never()).append(anyString(), any());
    }

    @Test
    void unavailable_history_still_answers() {
        when(memory.read(anyString())).thenReturn(Mono.just(SessionHistory.unavailable()));
        when(gateway.complete(any())).thenReturn(Mono.just(text("ok")));

        ChatReply reply = orchestrator.chat(request("hello?")).block(WAIT);

        assertNotNull(reply);
        assertEquals("ok", reply.response());
        assertEquals(0, reply.memoryUsed());
        assertEquals(List.of(ToolCallOrchestrator.HISTORY_UNAVAILABLE), reply.degradations());
    }

    @Test
    void explicit_context_wins_over_cache() {
        when(gateway.complete(any())).thenReturn(Mono.just(text("ok")));
        ChatRequest req = new ChatRequest("s1", "u1", "a1", "tok", "q", null, Map.of("explicit", true), null);

        orchestrator.chat(req).block(WAIT);

        verifyNoInteractions(contextCache);
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway).complete(captor.capture());
        List<ChatMessage> sent = captor.getValue().messages();
        assertTrue(sent.get(sent.size() - 2).content().contains("\"explicit\":true"));
    }

    @Test
    void degraded_context_is_tagged_and_omitted() {
        when(contextCache.get(anyString(), anyString(), any()))
                .thenReturn(Mono.just(CachedContext.unavailable("u1", "a1")));
        when(gateway.complete(any())).thenReturn(Mono.just(text("ok")));

        ChatReply reply = orchestrator.chat(request("q")).block(WAIT);

        assertNotNull(reply);
        assertEquals(List.of(ToolCallOrchestrator.CONTEXT_UNAVAILABLE), reply.degradations());
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway).complete(captor.capture());
        // system + 2 history + user
        assertEquals(4, captor.getValue().messages().size());
    }

    @Test
    void summarize_runs_without_tools_and_persists_short_user_line() {
        when(gateway.complete(any())).thenReturn(Mono.just(text("Mostly groceries.")));
        List<Map<String, Object>> txs = List.of(
                Map.of("title", "Grocer", "amount", -54.2),
                Map.of("title", "Salary", "amount", 2500));

        ChatReply reply = orchestrator.summarize(new SummarizeRequest("s1", "u1", txs)).block(WAIT);

        assertNotNull(reply);
        assertEquals("Mostly groceries.", reply.response());
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(gateway).complete(captor.capture());
        assertTrue(captor.getValue().tools().isEmpty());
        assertEquals("Summarize my transactions (2 items).", appended().get(0).content());
        verifyNoInteractions(contextCache);
    }
}
