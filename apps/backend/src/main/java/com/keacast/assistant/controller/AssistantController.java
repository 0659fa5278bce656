package com.keacast.assistant.controller;

import com.keacast.assistant.ai.UpstreamException;
import com.keacast.assistant.api.dto.ChatReply;
import com.keacast.assistant.api.dto.ChatRequest;
import com.keacast.assistant.api.dto.SummarizeRequest;
import com.keacast.assistant.service.ConversationMemoryService;
import com.keacast.assistant.service.ToolCallOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AssistantController {

    private final ToolCallOrchestrator orchestrator;
    private final ConversationMemoryService memory;

    @Operation(summary = "对话：一轮用户消息，最多一轮工具调用")
    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatReply> chat(@Valid @RequestBody ChatRequest req) {
        log.debug("[API] chat session={} user={} account={}", req.sessionId(), req.userId(), req.accountId());
        return orchestrator.chat(req).onErrorMap(UpstreamException.class, AssistantController::toStatus);
    }

    @Operation(summary = "交易摘要：对传入的交易列表给出分析，不调用工具")
    @PostMapping(value = "/summarize", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatReply> summarize(@Valid @RequestBody SummarizeRequest req) {
        if (req.transactions() == null || req.transactions().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "transactions must not be empty");
        }
        return orchestrator.summarize(req).onErrorMap(UpstreamException.class, AssistantController::toStatus);
    }

    @Operation(summary = "读取会话历史")
    @GetMapping(value = "/sessions/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> history(@PathVariable("sessionId") String sessionId) {
        return memory.read(sessionId).map(h -> Map.<String, Object>of(
                "sessionId", sessionId,
                "available", h.available(),
                "messages", h.messages()));
    }

    @Operation(summary = "清空会话")
    @DeleteMapping(value = "/sessions/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> clear(@PathVariable("sessionId") String sessionId) {
        return memory.clear(sessionId).map(removed -> Map.<String, Object>of(
                "sessionId", sessionId,
                "cleared", removed));
    }

    private static ResponseStatusException toStatus(UpstreamException e) {
        // 上游鉴权失败等不可恢复错误：对调用方是网关错误
        log.error("[API] upstream failure kind={} status={} msg={}", e.getKind(), e.getStatus(), e.getMessage());
        return new ResponseStatusException(HttpStatus.BAD_GATEWAY,
                "Upstream completion service rejected the request (" + e.getKind() + "): " + e.getMessage(), e);
    }
}
