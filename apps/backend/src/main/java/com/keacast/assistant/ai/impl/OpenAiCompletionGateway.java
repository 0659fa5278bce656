package com.keacast.assistant.ai.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keacast.assistant.ai.ChatWire;
import com.keacast.assistant.ai.CompletionGateway;
import com.keacast.assistant.ai.UpstreamException;
import com.keacast.assistant.api.dto.CompletionRequest;
import com.keacast.assistant.api.dto.CompletionResponse;
import com.keacast.assistant.config.AiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * OpenAI 兼容的 /chat/completions 客户端。
 * <ul>
 *   <li>429：按 Retry-After（秒）等待，缺省用 default-retry-after，上限 max-retry-after；</li>
 *   <li>5xx / 超时 / 连接失败：base-delay × 2^attempt 指数退避；</li>
 *   <li>其它 4xx：直接失败，不重试；</li>
 *   <li>最多 max-retries 次重试。</li>
 * </ul>
 */
@Slf4j
@Component
public class OpenAiCompletionGateway implements CompletionGateway {

    private final WebClient webClient;
    private final AiProperties props;
    private final ObjectMapper mapper;

    public OpenAiCompletionGateway(@Qualifier("aiWebClient") WebClient webClient,
                                   AiProperties props,
                                   ObjectMapper mapper) {
        this.webClient = webClient;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public Mono<CompletionResponse> complete(CompletionRequest request) {
        ObjectNode body = buildBody(request);
        log.debug("[UPSTREAM] model={} messages={} tools={} toolChoice={}",
                props.getModel(), request.messages().size(), request.tools().size(), request.toolChoice());
        return attempt(body, 0);
    }

    private Mono<CompletionResponse> attempt(ObjectNode body, int attempt) {
        int maxRetries = Math.max(0, props.getClient().getRetry().getMaxRetries());
        return send(body)
                .onErrorResume(UpstreamException.class, ex -> {
                    if (!ex.isRetryable() || attempt >= maxRetries) {
                        log.warn("[UPSTREAM-FAIL] kind={} status={} attempts={} msg={}",
                                ex.getKind(), ex.getStatus(), attempt + 1, ex.getMessage());
                        return Mono.error(ex.withAttempts(attempt + 1));
                    }
                    Duration delay = backoff(ex, attempt);
                    log.warn("[UPSTREAM-RETRY] kind={} status={} attempt={}/{} delay={}ms",
                            ex.getKind(), ex.getStatus(), attempt + 1, maxRetries + 1, delay.toMillis());
                    return Mono.delay(delay).then(Mono.defer(() -> attempt(body, attempt + 1)));
                });
    }

    private Mono<CompletionResponse> send(ObjectNode body) {
        long timeoutMs = props.getClient().getTimeoutMs();
        return webClient.post()
                .uri(props.getPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(resp -> {
                    int status = resp.statusCode().value();
                    if (resp.statusCode().is2xxSuccessful()) {
                        return resp.bodyToMono(String.class).defaultIfEmpty("").map(this::parse);
                    }
                    Duration retryAfter = status == 429
                            ? parseRetryAfter(resp.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                            : null;
                    return resp.bodyToMono(String.class).defaultIfEmpty("")
                            .flatMap(text -> Mono.<CompletionResponse>error(
                                    UpstreamException.ofStatus(status, text, retryAfter)));
                })
                .timeout(Duration.ofMillis(timeoutMs))
                .onErrorMap(TimeoutException.class, e -> new UpstreamException(
                        UpstreamException.Kind.TIMEOUT, 0, "upstream timeout after " + timeoutMs + "ms", null, 1, e))
                .onErrorMap(WebClientRequestException.class, e -> new UpstreamException(
                        UpstreamException.Kind.TRANSPORT, 0, "upstream unreachable: " + e.getMessage(), null, 1, e));
    }

    Duration backoff(UpstreamException ex, int attempt) {
        AiProperties.Retry retry = props.getClient().getRetry();
        long cap = Math.max(0, retry.getMaxRetryAfterMs());
        if (ex.getKind() == UpstreamException.Kind.RATE_LIMITED) {
            long wait = ex.getRetryAfter() != null ? ex.getRetryAfter().toMillis() : retry.getDefaultRetryAfterMs();
            return Duration.ofMillis(Math.min(Math.max(0, wait), cap));
        }
        long base = Math.max(0, retry.getBaseDelayMs());
        // 防止移位溢出
        long delay = attempt >= 30 ? cap : base * (1L << attempt);
        return Duration.ofMillis(Math.min(delay, cap));
    }

    private Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            log.debug("[UPSTREAM] ignore non-numeric Retry-After '{}'", header);
            return null;
        }
    }

    private ObjectNode buildBody(CompletionRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", props.getModel());
        body.put("temperature", request.temperature() != null ? request.temperature() : props.getTemperature());
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : props.getMaxTokens());
        body.set("messages", ChatWire.toWire(request.messages(), mapper));

        if (!request.tools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (Map<String, Object> tool : request.tools()) {
                tools.add(mapper.valueToTree(tool));
            }
            if (request.toolChoice() != null) {
                body.put("tool_choice", request.toolChoice());
            }
        }
        return body;
    }

    CompletionResponse parse(String raw) {
        JsonNode root;
        try {
            root = mapper.readTree(raw == null ? "" : raw);
        } catch (Exception e) {
            log.warn("[UPSTREAM-MALFORMED] unparseable body: {}", e.getMessage());
            return CompletionResponse.empty();
        }
        if (root == null) {
            log.warn("[UPSTREAM-MALFORMED] empty body");
            return CompletionResponse.empty();
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty() || !choices.get(0).path("message").isObject()) {
            log.warn("[UPSTREAM-MALFORMED] no usable choice");
            return CompletionResponse.empty();
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");
        JsonNode contentNode = message.get("content");
        String content = contentNode == null || contentNode.isNull() ? "" : contentNode.asText();
        String finish = choice.path("finish_reason").asText(null);
        return new CompletionResponse(content, ChatWire.readToolCalls(message), finish, false);
    }
}
