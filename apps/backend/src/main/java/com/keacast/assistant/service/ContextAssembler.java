package com.keacast.assistant.service;

import com.keacast.assistant.api.dto.AssembledContext;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.ContextSource;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ContextAssembler {

    /**
     * system → history → context → new user message, fitted into the byte budget.
     *
     * @param systemPrompt null 时用配置里的默认提示词
     */
    Mono<AssembledContext> assemble(String systemPrompt,
                                    List<ChatMessage> history,
                                    ContextSource context,
                                    String userMessage);

    /** Same as above with an explicit byte budget instead of {@code ai.context.max-bytes}. */
    Mono<AssembledContext> assemble(String systemPrompt,
                                    List<ChatMessage> history,
                                    ContextSource context,
                                    String userMessage,
                                    int maxBytes);

    /** Serialized size in UTF-8 bytes, as it is measured against the budget. */
    int measure(List<ChatMessage> messages);
}
