package com.keacast.assistant.util;

import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.MessageRole;
import com.keacast.assistant.api.dto.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HistorySanitizerTest {

    @Test
    void dropsToolMessageWithoutAnnouncingAssistant() {
        List<ChatMessage> history = List.of(
                ChatMessage.user("hi"),
                ChatMessage.tool("call_x", "{\"orphan\":true}"),
                ChatMessage.assistant("hello"));

        List<ChatMessage> clean = HistorySanitizer.sanitize(history);

        assertThat(clean).extracting(ChatMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
    }

    @Test
    void keepsToolMessageAnsweringEarlierCall() {
        List<ChatMessage> history = List.of(
                ChatMessage.user("balance?"),
                ChatMessage.assistantToolCalls("", List.of(ToolCall.of("c1", "get_account_balances", "{}"))),
                ChatMessage.tool("c1", "{\"balance\":10}"),
                ChatMessage.assistant("10"));

        assertThat(HistorySanitizer.sanitize(history)).hasSize(4);
    }

    @Test
    void toolReplyBeforeItsCallIsAnOrphan() {
        List<ChatMessage> history = List.of(
                ChatMessage.tool("c1", "early"),
                ChatMessage.assistantToolCalls("", List.of(ToolCall.of("c1", "t", "{}"))));

        assertThat(HistorySanitizer.sanitize(history))
                .extracting(ChatMessage::role)
                .containsExactly(MessageRole.ASSISTANT);
    }

    @Test
    void sanitizeIsIdempotent() {
        List<ChatMessage> history = List.of(
                ChatMessage.tool("a", "x"),
                ChatMessage.user("q"),
                ChatMessage.assistantToolCalls("", List.of(ToolCall.of("b", "t", "{}"))),
                ChatMessage.tool("b", "ok"),
                ChatMessage.tool("c", "orphan"),
                ChatMessage.assistant("done"));

        List<ChatMessage> once = HistorySanitizer.sanitize(history);
        List<ChatMessage> twice = HistorySanitizer.sanitize(once);

        assertThat(twice).isEqualTo(once);
        assertThat(HistorySanitizer.orphanCount(history)).isEqualTo(2);
        assertThat(HistorySanitizer.orphanCount(once)).isZero();
    }

    @Test
    void nullAndEmptyAreEmpty() {
        assertThat(HistorySanitizer.sanitize(null)).isEmpty();
        assertThat(HistorySanitizer.sanitize(List.of())).isEmpty();
    }
}
