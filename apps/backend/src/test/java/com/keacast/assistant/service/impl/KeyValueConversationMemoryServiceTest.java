package com.keacast.assistant.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.MessageRole;
import com.keacast.assistant.api.dto.ToolCall;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.service.dto.SessionHistory;
import com.keacast.assistant.storage.KeyValueStore;
import com.keacast.assistant.storage.impl.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class KeyValueConversationMemoryServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final AtomicLong nanos = new AtomicLong();
    private AiProperties props;
    private InMemoryKeyValueStore store;
    private KeyValueConversationMemoryService memory;

    @BeforeEach
    void setUp() {
        props = new AiProperties();
        props.getMemory().setMaxMessages(4);
        props.getMemory().setTtlSeconds(Duration.ofHours(24).toSeconds());
        store = new InMemoryKeyValueStore(1_000, nanos::get);
        memory = new KeyValueConversationMemoryService(store, new ObjectMapper(), props);
    }

    @Test
    void unknown_session_is_empty_and_available() {
        StepVerifier.create(memory.read("s-new"))
                .assertNext(h -> {
                    assertTrue(h.available());
                    assertTrue(h.messages().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void keeps_only_the_newest_window_of_messages() {
        for (int i = 0; i < 4; i++) {
            memory.append("s1", List.of(ChatMessage.user("q" + i), ChatMessage.assistant("a" + i))).block(WAIT);
        }

        List<ChatMessage> loaded = memory.load("s1").block(WAIT);

        assertNotNull(loaded);
        assertEquals(List.of("q2", "a2", "q3", "a3"), loaded.stream().map(ChatMessage::content).toList());
    }

    @Test
    void round_trips_tool_calls_and_drops_orphans_cut_by_the_window() {
        props.getMemory().setMaxMessages(3);
        memory.append("s1", List.of(
                ChatMessage.user("balance?"),
                ChatMessage.assistantToolCalls("", List.of(ToolCall.of("c1", "get_account_balances", "{}"))),
                ChatMessage.tool("c1", "{\"balance\":10}"),
                ChatMessage.assistant("You have $10."))).block(WAIT);

        List<ChatMessage> loaded = memory.load("s1").block(WAIT);

        // 窗口切掉了 assistant.toolCalls，对应的 tool 消息也不能留下
        assertNotNull(loaded);
        assertEquals(1, loaded.size());
        assertEquals(MessageRole.ASSISTANT, loaded.get(0).role());

        memory.append("s2", List.of(
                ChatMessage.assistantToolCalls("", List.of(ToolCall.of("c2", "get_user_accounts", "{\"page\":1}"))),
                ChatMessage.tool("c2", "ok"))).block(WAIT);
        List<ChatMessage> s2 = memory.load("s2").block(WAIT);
        assertNotNull(s2);
        assertEquals(2, s2.size());
        assertEquals("get_user_accounts", s2.get(0).toolCalls().get(0).name());
        assertEquals("c2", s2.get(1).toolCallId());
    }

    @Test
    void each_append_resets_the_idle_ttl() {
        memory.append("s1", List.of(ChatMessage.user("q1"), ChatMessage.assistant("a1"))).block(WAIT);
        nanos.addAndGet(Duration.ofHours(20).toNanos());
        memory.append("s1", List.of(ChatMessage.user("q2"), ChatMessage.assistant("a2"))).block(WAIT);
        nanos.addAndGet(Duration.ofHours(10).toNanos());

        assertEquals(4, memory.load("s1").block(WAIT).size());

        nanos.addAndGet(Duration.ofHours(15).toNanos());
        assertTrue(memory.load("s1").block(WAIT).isEmpty());
    }

    @Test
    void corrupt_history_reads_as_empty() {
        store.set(props.getMemory().getKeyPrefix() + "s1", "{not-json", Duration.ofMinutes(5)).block(WAIT);

        SessionHistory h = memory.read("s1").block(WAIT);

        assertNotNull(h);
        assertTrue(h.available());
        assertTrue(h.messages().isEmpty());
    }

    @Test
    void clear_reports_whether_anything_was_removed() {
        memory.append("s1", List.of(ChatMessage.user("q"))).block(WAIT);

        assertEquals(Boolean.TRUE, memory.clear("s1").block(WAIT));
        assertEquals(Boolean.FALSE, memory.clear("s1").block(WAIT));
    }

    @Test
    void store_outage_degrades_instead_of_failing() {
        KeyValueStore broken = Mockito.mock(KeyValueStore.class);
        when(broken.get(anyString())).thenReturn(Mono.error(new IllegalStateException("redis down")));
        when(broken.delete(any())).thenReturn(Mono.error(new IllegalStateException("redis down")));
        KeyValueConversationMemoryService degraded =
                new KeyValueConversationMemoryService(broken, new ObjectMapper(), props);

        StepVerifier.create(degraded.read("s1"))
                .assertNext(h -> assertFalse(h.available()))
                .verifyComplete();
        StepVerifier.create(degraded.append("s1", List.of(ChatMessage.user("q"))))
                .verifyComplete();
        StepVerifier.create(degraded.clear("s1"))
                .expectNext(false)
                .verifyComplete();
    }
}
