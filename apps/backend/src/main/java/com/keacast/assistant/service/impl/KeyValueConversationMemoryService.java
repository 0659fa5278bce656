package com.keacast.assistant.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.service.ConversationMemoryService;
import com.keacast.assistant.service.dto.SessionHistory;
import com.keacast.assistant.storage.KeyValueStore;
import com.keacast.assistant.util.CacheKeys;
import com.keacast.assistant.util.HistorySanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Session history as one JSON array per session in the {@link KeyValueStore}.
 * <p>
 * There is no per-session lock: concurrent appends to one session are last-writer-wins.
 * {@link #append} re-reads the stored array immediately before writing, so only appends that
 * interleave inside that read-modify-write can lose a pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyValueConversationMemoryService implements ConversationMemoryService {

    private static final TypeReference<List<ChatMessage>> MESSAGES = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final AiProperties props;

    @Override
    public Mono<SessionHistory> read(String sessionKey) {
        String key = key(sessionKey);
        return store.get(key)
                .timeout(storeTimeout())
                .map(this::decode)
                .map(HistorySanitizer::sanitize)
                .map(SessionHistory::of)
                .defaultIfEmpty(SessionHistory.of(List.of()))
                .doOnNext(h -> log.debug("[SESSION] load key={} messages={}", key, h.messages().size()))
                .onErrorResume(e -> {
                    log.warn("[SESSION-DEGRADED] load failed key={} err={}", key, e.toString());
                    return Mono.just(SessionHistory.unavailable());
                });
    }

    @Override
    public Mono<Void> append(String sessionKey, List<ChatMessage> newMessages) {
        if (newMessages == null || newMessages.isEmpty()) {
            return Mono.empty();
        }
        String key = key(sessionKey);
        int window = Math.max(1, props.getMemory().getMaxMessages());
        Duration ttl = Duration.ofSeconds(props.getMemory().getTtlSeconds());

        return store.get(key)
                .timeout(storeTimeout())
                .map(this::decode)
                .defaultIfEmpty(List.of())
                .map(existing -> {
                    List<ChatMessage> all = new ArrayList<>(existing);
                    all.addAll(newMessages);
                    List<ChatMessage> clean = HistorySanitizer.sanitize(all);
                    if (clean.size() > window) {
                        clean = clean.subList(clean.size() - window, clean.size());
                    }
                    // 窗口可能切掉了 assistant.toolCalls，再清一次孤儿
                    return HistorySanitizer.sanitize(clean);
                })
                .flatMap(trimmed -> store.set(key, encode(trimmed), ttl)
                        .timeout(storeTimeout())
                        .doOnSuccess(v -> log.debug("[SESSION] append key={} added={} stored={}",
                                key, newMessages.size(), trimmed.size())))
                .onErrorResume(e -> {
                    log.warn("[SESSION-DEGRADED] append dropped key={} added={} err={}",
                            key, newMessages.size(), e.toString());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Boolean> clear(String sessionKey) {
        String key = key(sessionKey);
        return store.delete(List.of(key))
                .timeout(storeTimeout())
                .map(n -> n > 0)
                .defaultIfEmpty(false)
                .doOnNext(removed -> log.info("[SESSION] clear key={} removed={}", key, removed))
                .onErrorResume(e -> {
                    log.warn("[SESSION-DEGRADED] clear failed key={} err={}", key, e.toString());
                    return Mono.just(false);
                });
    }

    private String key(String sessionKey) {
        return props.getMemory().getKeyPrefix() + CacheKeys.escape(sessionKey);
    }

    private Duration storeTimeout() {
        return Duration.ofMillis(props.getStore().getTimeoutMs());
    }

    private List<ChatMessage> decode(String json) {
        try {
            List<ChatMessage> list = mapper.readValue(json, MESSAGES);
            return list == null ? List.of() : list;
        } catch (Exception e) {
            // 损坏的会话按空历史处理，下次 append 会覆盖掉
            log.warn("[SESSION] discard unreadable history: {}", e.getMessage());
            return List.of();
        }
    }

    private String encode(List<ChatMessage> messages) {
        try {
            return mapper.writeValueAsString(messages);
        } catch (Exception e) {
            throw new IllegalStateException("session history not serializable", e);
        }
    }
}
