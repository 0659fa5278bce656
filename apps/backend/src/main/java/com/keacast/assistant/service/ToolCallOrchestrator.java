package com.keacast.assistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.ai.CompletionGateway;
import com.keacast.assistant.ai.UpstreamException;
import com.keacast.assistant.api.dto.*;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.service.dto.SessionHistory;
import com.keacast.assistant.tools.AiToolExecutor;
import com.keacast.assistant.tools.ToolCallContext;
import com.keacast.assistant.tools.ToolRegistry;
import com.keacast.assistant.util.ToolPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One user turn: assemble → completion → (at most one round of tools → final completion) → persist.
 * <pre>
 *   AWAITING_COMPLETION ─┬─────────────────────────────────────────────→ DONE
 *                        └→ EXECUTING_TOOLS → AWAITING_FINAL_COMPLETION → DONE
 * </pre>
 * Tool payloads reach the model only through the synthetic summary turn (one line per tool) and an
 * optional structured-data turn, both fitted into {@code ai.context.max-bytes}. Neither is stored in
 * session history; the stored assistant turn carries a compact note of tool outcomes instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolCallOrchestrator {

    public enum Phase { AWAITING_COMPLETION, EXECUTING_TOOLS, AWAITING_FINAL_COMPLETION, DONE }

    public static final String HISTORY_UNAVAILABLE = "history_unavailable";
    public static final String CONTEXT_UNAVAILABLE = "context_unavailable";
    public static final String UPSTREAM_UNAVAILABLE = "upstream_unavailable";
    public static final String UPSTREAM_MALFORMED = "upstream_malformed";
    public static final String FINAL_COMPLETION_FAILED = "final_completion_failed";
    public static final String TOOL_ERRORS = "tool_errors";
    public static final String CONTEXT_OVER_BUDGET = "context_over_budget";

    static final String APOLOGY =
            "Sorry, I can't reach the assistant service right now. Please try again in a moment.";
    static final String TOOL_DATA_HEADER = "Tool data (JSON):\n";
    static final String TOOL_DATA_CUT_MARK = "\n[tool data truncated]";
    // 单行摘要最短压到这个长度
    static final int MIN_LINE_CHARS = 16;
    // 剩余空间不到这个数就不发结构化数据
    static final int MIN_DATA_BYTES = 256;
    private static final int MAX_DATA_SHRINK_ROUNDS = 8;

    static final String SUMMARIZE_PROMPT =
            "Summarize the transactions in the context: main spending categories, income versus expenses, "
                    + "unusual items and one or two practical suggestions.";

    private final ConversationMemoryService memory;
    private final ContextCacheService contextCache;
    private final ContextAssembler assembler;
    private final CompletionGateway gateway;
    private final ToolRegistry registry;
    private final AiToolExecutor executor;
    private final AiProperties props;
    private final ObjectMapper mapper;

    /** 首轮组装的原始输入；最终轮放不下时按更小的预算重新组装 */
    private record Prompt(String systemPrompt, List<ChatMessage> history, ContextSource context, String userMessage) { }

    /** 最终轮的消息及其是否落在预算内 */
    private record FinalMessages(List<ChatMessage> messages, ChatMessage toolTurn, int bytes, boolean fits) { }

    /** 单轮对话的可变状态 */
    private static final class Turn {
        final String sessionId;
        final List<String> degradations = new CopyOnWriteArrayList<>();
        Phase phase = Phase.AWAITING_COMPLETION;
        int memoryUsed;

        Turn(String sessionId) {
            this.sessionId = sessionId;
        }

        void degrade(String tag) {
            if (!degradations.contains(tag)) {
                degradations.add(tag);
            }
        }

        void moveTo(Phase next) {
            log.debug("[PHASE] session={} {} -> {}", sessionId, phase, next);
            phase = next;
        }
    }

    public Mono<ChatReply> chat(ChatRequest req) {
        Turn turn = new Turn(req.sessionId());
        ToolCallContext ctx = new ToolCallContext(req.userId(), req.accountId(), req.token(), req.sessionId());

        return Mono.zip(memory.read(req.sessionId()), resolveContext(req, turn))
                .flatMap(t -> {
                    SessionHistory history = t.getT1();
                    if (!history.available()) {
                        turn.degrade(HISTORY_UNAVAILABLE);
                    }
                    turn.memoryUsed = history.messages().size();
                    Prompt prompt = new Prompt(req.systemPrompt(), history.messages(), t.getT2(), req.message());
                    return assembler.assemble(prompt.systemPrompt(), prompt.history(), prompt.context(), prompt.userMessage())
                            .flatMap(assembled -> firstCompletion(req, ctx, turn, prompt, assembled));
                });
    }

    private Mono<ChatReply> firstCompletion(ChatRequest req, ToolCallContext ctx, Turn turn,
                                            Prompt prompt, AssembledContext assembled) {
        if (!assembled.withinBudget()) {
            turn.degrade(CONTEXT_OVER_BUDGET);
        }
        CompletionRequest first = new CompletionRequest(assembled.messages(), registry.openAiToolsSchema(),
                CompletionRequest.TOOL_CHOICE_AUTO, null, null);
        return gateway.complete(first)
                .flatMap(resp -> afterFirstCompletion(req, ctx, turn, prompt, assembled, resp))
                .onErrorResume(e -> !isFatal(e), e -> {
                    log.warn("[ORCH] session={} first completion failed: {}", req.sessionId(), e.toString());
                    turn.degrade(UPSTREAM_UNAVAILABLE);
                    turn.moveTo(Phase.DONE);
                    // 不落库：这轮对话没有真正完成
                    return Mono.just(reply(turn, APOLOGY, List.of()));
                });
    }

    private Mono<ChatReply> afterFirstCompletion(ChatRequest req, ToolCallContext ctx, Turn turn, Prompt prompt,
                                                 AssembledContext assembled, CompletionResponse resp) {
        if (!resp.hasToolCalls()) {
            turn.moveTo(Phase.DONE);
            if (resp.malformed() || resp.content().isBlank()) {
                turn.degrade(UPSTREAM_MALFORMED);
                return Mono.just(reply(turn, "", List.of()));
            }
            return persist(req.sessionId(), req.message(), resp.content())
                    .thenReturn(reply(turn, resp.content(), List.of()));
        }

        turn.moveTo(Phase.EXECUTING_TOOLS);
        List<ToolCall> calls = resp.toolCalls();
        int cap = Math.max(1, props.getTools().getMaxCallsPerRound());
        List<ToolCall> runnable = calls.size() > cap ? calls.subList(0, cap) : calls;
        List<ToolResult> skipped = calls.subList(runnable.size(), calls.size()).stream()
                .map(c -> ToolResult.error(c.id(), c.name(), "Not executed: at most " + cap + " tool calls per turn"))
                .toList();
        log.info("[ORCH] session={} tool calls={}", req.sessionId(), calls.stream().map(ToolCall::name).toList());
        if (!skipped.isEmpty()) {
            log.warn("[ORCH] session={} {} tool calls requested, only the first {} run", req.sessionId(), calls.size(), cap);
        }

        return executor.executeAll(runnable, ctx).flatMap(executed -> {
            List<ToolResult> results = new ArrayList<>(executed);
            results.addAll(skipped);
            if (results.stream().anyMatch(r -> !r.isSuccess())) {
                turn.degrade(TOOL_ERRORS);
            }
            List<String> shortLines = results.stream().map(this::shortSummary).toList();

            turn.moveTo(Phase.AWAITING_FINAL_COMPLETION);
            return finalMessages(req.sessionId(), turn, prompt, assembled, resp.content(), results)
                    .flatMap(messages -> finalCompletion(req, turn, messages, results, shortLines));
        });
    }

    private Mono<ChatReply> finalCompletion(ChatRequest req, Turn turn, List<ChatMessage> messages,
                                            List<ToolResult> results, List<String> shortLines) {
        CompletionRequest fin = new CompletionRequest(messages, registry.openAiToolsSchema(),
                CompletionRequest.TOOL_CHOICE_NONE, null, null);

        return gateway.complete(fin)
                .map(CompletionResponse::content)
                .filter(content -> !content.isBlank())
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("[ORCH] session={} final completion empty, synthesizing", req.sessionId());
                    turn.degrade(FINAL_COMPLETION_FAILED);
                    return Mono.just(synthesize(shortLines));
                }))
                .onErrorResume(e -> {
                    log.warn("[ORCH] session={} final completion failed: {}", req.sessionId(), e.toString());
                    turn.degrade(FINAL_COMPLETION_FAILED);
                    return Mono.just(synthesize(shortLines));
                })
                .flatMap(answer -> {
                    turn.moveTo(Phase.DONE);
                    return persist(req.sessionId(), req.message(), answer + toolsNote(results))
                            .thenReturn(reply(turn, answer, shortLines));
                });
    }

    /**
     * 最终轮 = 首轮消息 (+ 模型的中间回复) (+ 结构化数据) + 摘要轮，整体不超过 ai.context.max-bytes。
     * 先丢结构化数据，再把每行摘要压短，最后才给摘要轮腾位置重新组装前面的上下文。
     */
    private Mono<List<ChatMessage>> finalMessages(String sessionId, Turn turn, Prompt prompt,
                                                  AssembledContext assembled, String assistantContent,
                                                  List<ToolResult> results) {
        int budget = props.getContext().getMaxBytes();
        FinalMessages fitted = fitToolTurn(withAssistant(assembled.messages(), assistantContent), results, budget);
        if (fitted.fits()) {
            return Mono.just(fitted.messages());
        }
        List<ChatMessage> tail = withAssistant(List.of(), assistantContent);
        tail.add(fitted.toolTurn());
        int reduced = Math.max(0, budget - assembler.measure(tail));
        log.info("[ORCH-BUDGET] session={} final request {} bytes over budget {}, reassembling prompt within {}",
                sessionId, fitted.bytes(), budget, reduced);
        return assembler.assemble(prompt.systemPrompt(), prompt.history(), prompt.context(), prompt.userMessage(), reduced)
                .map(reassembled -> {
                    FinalMessages again = fitToolTurn(withAssistant(reassembled.messages(), assistantContent),
                            results, budget);
                    if (!again.fits()) {
                        log.warn("[ORCH-BUDGET] session={} final request still {} bytes, budget {}",
                                sessionId, again.bytes(), budget);
                        turn.degrade(CONTEXT_OVER_BUDGET);
                    }
                    return again.messages();
                });
    }

    private List<ChatMessage> withAssistant(List<ChatMessage> base, String assistantContent) {
        List<ChatMessage> out = new ArrayList<>(base);
        if (assistantContent != null && !assistantContent.isBlank()) {
            out.add(ChatMessage.assistant(ToolPayloads.clip(assistantContent, props.getContext().getTurnMaxChars())));
        }
        return out;
    }

    private FinalMessages fitToolTurn(List<ChatMessage> base, List<ToolResult> results, int budget) {
        int perLine = props.getTools().getSummaryMaxChars();
        ChatMessage toolTurn = ChatMessage.user(toolTurnText(summaryLines(results, perLine)));
        int size = assembler.measure(append(base, null, toolTurn));

        if (size > budget) {
            // 剩余空间先平均分给每一行，再逐步收紧
            int room = budget - assembler.measure(append(base, null, ChatMessage.user(toolTurnText(List.of()))));
            perLine = Math.min(perLine, Math.max(MIN_LINE_CHARS, room / Math.max(1, results.size()) / 2));
            while (true) {
                toolTurn = ChatMessage.user(toolTurnText(summaryLines(results, perLine)));
                size = assembler.measure(append(base, null, toolTurn));
                if (size <= budget || perLine <= MIN_LINE_CHARS) {
                    break;
                }
                perLine = Math.max(MIN_LINE_CHARS, perLine * 3 / 4);
            }
            log.debug("[ORCH-BUDGET] summary lines clipped to {} chars, bytes={} budget={}", perLine, size, budget);
        }
        if (size > budget) {
            return new FinalMessages(append(base, null, toolTurn), toolTurn, size, false);
        }

        ChatMessage data = toolData(base, toolTurn, results, budget);
        List<ChatMessage> messages = append(base, data, toolTurn);
        return new FinalMessages(messages, toolTurn, data == null ? size : assembler.measure(messages), true);
    }

    /** 结构化数据单独一条消息，只用摘要之外剩下的空间；放不下就不发 */
    private ChatMessage toolData(List<ChatMessage> base, ChatMessage toolTurn, List<ToolResult> results, int budget) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ToolResult r : results) {
            if (r.isSuccess() && hasStructuredData(r.data())) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("tool", r.name());
                entry.put("data", r.data());
                entries.add(entry);
            }
        }
        if (entries.isEmpty()) {
            return null;
        }
        String content = TOOL_DATA_HEADER + ToolPayloads.toJson(entries, mapper);
        ChatMessage data = ChatMessage.user(content);
        int size = assembler.measure(append(base, data, toolTurn));
        for (int round = 0; round < MAX_DATA_SHRINK_ROUNDS && size > budget; round++) {
            int keep = ToolPayloads.utf8Length(content) - (size - budget) - TOOL_DATA_CUT_MARK.length() * 2;
            if (keep < MIN_DATA_BYTES) {
                return null;
            }
            content = ToolPayloads.utf8Prefix(content, keep);
            data = ChatMessage.user(content + TOOL_DATA_CUT_MARK);
            size = assembler.measure(append(base, data, toolTurn));
        }
        return size <= budget ? data : null;
    }

    private static boolean hasStructuredData(Object data) {
        if (data instanceof Map<?, ?> m) {
            return m.keySet().stream().anyMatch(k -> !List.of("message", "text", "summary").contains(String.valueOf(k)));
        }
        return data instanceof Collection<?> c && !c.isEmpty();
    }

    private static List<ChatMessage> append(List<ChatMessage> base, ChatMessage data, ChatMessage toolTurn) {
        List<ChatMessage> out = new ArrayList<>(base.size() + 2);
        out.addAll(base);
        if (data != null) {
            out.add(data);
        }
        out.add(toolTurn);
        return out;
    }

    /**
     * Transaction insights over a caller-supplied list, through the same assembly and session
     * pipeline with tools disabled.
     */
    public Mono<ChatReply> summarize(SummarizeRequest req) {
        Turn turn = new Turn(req.sessionId());
        List<Map<String, Object>> txs = req.transactions() == null ? List.of() : req.transactions();
        ToolPayloads.Bounded bounded = ToolPayloads.bound(txs, props.getTools().getResultMaxBytes(), mapper);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transactionCount", txs.size());
        payload.put("transactions", bounded.data());
        String userLine = "Summarize my transactions (" + txs.size() + " items).";

        return memory.read(req.sessionId())
                .flatMap(history -> {
                    if (!history.available()) {
                        turn.degrade(HISTORY_UNAVAILABLE);
                    }
                    turn.memoryUsed = history.messages().size();
                    return assembler.assemble(null, history.messages(), ContextSource.explicit(payload), SUMMARIZE_PROMPT);
                })
                .flatMap(assembled -> {
                    if (!assembled.withinBudget()) {
                        turn.degrade(CONTEXT_OVER_BUDGET);
                    }
                    return gateway.complete(new CompletionRequest(assembled.messages(), List.of(), null, null, null));
                })
                .flatMap(resp -> {
                    turn.moveTo(Phase.DONE);
                    if (resp.malformed() || resp.content().isBlank()) {
                        turn.degrade(UPSTREAM_MALFORMED);
                        return Mono.just(reply(turn, "", List.of()));
                    }
                    return persist(req.sessionId(), userLine, resp.content())
                            .thenReturn(reply(turn, resp.content(), List.of()));
                })
                .onErrorResume(e -> !isFatal(e), e -> {
                    log.warn("[ORCH] session={} summarize failed: {}", req.sessionId(), e.toString());
                    turn.degrade(UPSTREAM_UNAVAILABLE);
                    return Mono.just(reply(turn, APOLOGY, List.of()));
                });
    }

    private Mono<ContextSource> resolveContext(ChatRequest req, Turn turn) {
        if (req.context() != null && !req.context().isEmpty()) {
            return Mono.just(ContextSource.explicit(req.context()));
        }
        boolean useCache = !Boolean.FALSE.equals(req.useCache());
        if (!useCache || isBlank(req.userId()) || isBlank(req.accountId())) {
            return Mono.just(ContextSource.none());
        }
        return contextCache.get(req.userId(), req.accountId(), req.token())
                .map(cached -> {
                    if (cached.degraded()) {
                        turn.degrade(CONTEXT_UNAVAILABLE);
                    }
                    return ContextSource.cached(cached);
                })
                .defaultIfEmpty(ContextSource.none());
    }

    private Mono<Void> persist(String sessionId, String userMessage, String assistantMessage) {
        return memory.append(sessionId, List.of(ChatMessage.user(userMessage), ChatMessage.assistant(assistantMessage)));
    }

    private static ChatReply reply(Turn turn, String answer, List<String> toolSummaries) {
        List<String> tags = List.copyOf(turn.degradations);
        return new ChatReply(answer, turn.sessionId, turn.memoryUsed, toolSummaries, !tags.isEmpty(), tags);
    }

    private static List<String> summaryLines(List<ToolResult> results, int maxChars) {
        return results.stream().map(r -> summaryLine(r, maxChars)).toList();
    }

    /** 每个工具一行自然语言，不带原始数据；maxChars 限制的是描述部分 */
    static String summaryLine(ToolResult r, int maxChars) {
        if (!r.isSuccess()) {
            return "- " + r.name() + " failed: " + ToolPayloads.clip(ToolPayloads.singleLine(r.errorMessage()), maxChars);
        }
        return "- " + r.name() + ": " + ToolPayloads.clip(ToolPayloads.describe(r.data()), maxChars)
                + (r.truncated() ? " (result truncated, original " + r.serializedSize() + " bytes)" : "");
    }

    String shortSummary(ToolResult r) {
        if (!r.isSuccess()) {
            return r.name() + " failed: " + ToolPayloads.singleLine(r.errorMessage());
        }
        return ToolPayloads.clip(r.name() + ": " + ToolPayloads.describe(r.data()), 300);
    }

    private static String toolTurnText(List<String> lines) {
        return "Tool results:\n" + String.join("\n", lines)
                + "\n\nAnswer my previous question using these results. "
                + "If a result was truncated or failed, say so.";
    }

    private static String synthesize(List<String> shortLines) {
        if (shortLines.isEmpty()) {
            return APOLOGY;
        }
        return "Here is what I found:\n- " + String.join("\n- ", shortLines);
    }

    private static String toolsNote(List<ToolResult> results) {
        StringJoiner j = new StringJoiner(", ", "\n\n[tools: ", "]");
        for (ToolResult r : results) {
            j.add(r.name() + "=" + (r.isSuccess() ? (r.truncated() ? "ok(truncated)" : "ok") : "error"));
        }
        return j.toString();
    }

    private static boolean isFatal(Throwable e) {
        return e instanceof UpstreamException ue && ue.getKind() == UpstreamException.Kind.AUTH;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
