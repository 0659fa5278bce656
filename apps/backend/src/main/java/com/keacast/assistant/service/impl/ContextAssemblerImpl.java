package com.keacast.assistant.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.ai.ChatWire;
import com.keacast.assistant.api.dto.AssembledContext;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.ContextSource;
import com.keacast.assistant.api.dto.MessageRole;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.service.ContextAssembler;
import com.keacast.assistant.util.HistorySanitizer;
import com.keacast.assistant.util.MsgTrace;
import com.keacast.assistant.util.ToolPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContextAssemblerImpl implements ContextAssembler {

    static final String CONTEXT_HEADER = "Context (JSON):\n";
    static final String CONTEXT_CUT_MARK = "\n[context truncated]";

    // 强制截断 context 的最多轮数
    private static final int MAX_CONTEXT_SHRINK_ROUNDS = 8;

    private final AiProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<AssembledContext> assemble(String systemPrompt,
                                           List<ChatMessage> history,
                                           ContextSource context,
                                           String userMessage) {
        return Mono.fromCallable(() -> build(systemPrompt, history, context, userMessage));
    }

    @Override
    public Mono<AssembledContext> assemble(String systemPrompt,
                                           List<ChatMessage> history,
                                           ContextSource context,
                                           String userMessage,
                                           int maxBytes) {
        return Mono.fromCallable(() -> build(systemPrompt, history, context, userMessage, maxBytes));
    }

    @Override
    public int measure(List<ChatMessage> messages) {
        return ChatWire.byteSize(messages, objectMapper);
    }

    AssembledContext build(String systemPrompt,
                           List<ChatMessage> history,
                           ContextSource context,
                           String userMessage) {
        return build(systemPrompt, history, context, userMessage, props.getContext().getMaxBytes());
    }

    AssembledContext build(String systemPrompt,
                           List<ChatMessage> history,
                           ContextSource context,
                           String userMessage,
                           int maxBytes) {
        AiProperties.Context limits = props.getContext();

        // 1) system
        String sp = systemPrompt == null || systemPrompt.isBlank() ? props.getSystemPrompt() : systemPrompt;
        ChatMessage system = ChatMessage.system(ToolPayloads.clip(sp, limits.getSystemMaxChars()));

        // 2) history：去孤儿 + 每条按角色上限截断；历史里的 system 不再出现
        List<ChatMessage> turns = new ArrayList<>();
        for (ChatMessage m : HistorySanitizer.sanitize(history)) {
            if (m.role() == MessageRole.SYSTEM) {
                continue;
            }
            turns.add(m.withContent(ToolPayloads.clip(m.content(), limits.getTurnMaxChars())));
        }

        // 3) context
        boolean contextTruncated = false;
        ChatMessage contextMsg = null;
        if (context != null && context.isPresent()) {
            String json = ToolPayloads.toJson(context.payload(), objectMapper);
            String body = CONTEXT_HEADER + json;
            if (body.length() > limits.getContextMaxChars()) {
                body = ToolPayloads.clip(body, limits.getContextMaxChars());
                contextTruncated = true;
            }
            contextMsg = ChatMessage.user(body);
        }

        // 4) new user message
        ChatMessage user = ChatMessage.user(userMessage == null ? "" : userMessage);

        // 5) budget
        List<ChatMessage> messages = compose(system, turns, contextMsg, user);
        int size = measure(messages);
        int evicted = 0;
        int attempts = 0;

        while (size > maxBytes && !turns.isEmpty() && attempts < limits.getMaxEvictionAttempts()) {
            int before = turns.size();
            turns.remove(0);
            // 被移除的 assistant 带走它的 tool 回复
            turns = new ArrayList<>(HistorySanitizer.sanitize(turns));
            evicted += before - turns.size();
            attempts++;
            messages = compose(system, turns, contextMsg, user);
            size = measure(messages);
        }

        if (size > maxBytes && contextMsg != null) {
            String content = contextMsg.content();
            for (int round = 0; round < MAX_CONTEXT_SHRINK_ROUNDS && size > maxBytes && !content.isEmpty(); round++) {
                int overshoot = size - maxBytes;
                int keep = Math.max(0, ToolPayloads.utf8Length(content) - overshoot - CONTEXT_CUT_MARK.length() * 2);
                content = ToolPayloads.utf8Prefix(content, keep);
                contextMsg = ChatMessage.user(content + CONTEXT_CUT_MARK);
                contextTruncated = true;
                messages = compose(system, turns, contextMsg, user);
                size = measure(messages);
            }
        }

        boolean withinBudget = size <= maxBytes;
        if (!withinBudget) {
            log.warn("[ASSEMBLE-OVER] bytes={} budget={} evicted={} contextTruncated={}",
                    size, maxBytes, evicted, contextTruncated);
        }
        log.debug("[ASSEMBLE] bytes={} budget={} messages={} evicted={} contextKind={} roles={} last={}",
                size, maxBytes, messages.size(), evicted,
                context == null ? ContextSource.Kind.NONE : context.kind(),
                MsgTrace.roles(messages), MsgTrace.lastLine(messages));

        return new AssembledContext(List.copyOf(messages), size, evicted, contextTruncated, withinBudget);
    }

    private static List<ChatMessage> compose(ChatMessage system,
                                             List<ChatMessage> turns,
                                             ChatMessage contextMsg,
                                             ChatMessage user) {
        List<ChatMessage> out = new ArrayList<>(turns.size() + 3);
        out.add(system);
        out.addAll(turns);
        if (contextMsg != null) {
            out.add(contextMsg);
        }
        out.add(user);
        return out;
    }
}
