package com.keacast.assistant.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    SYSTEM, USER, ASSISTANT, TOOL;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER;
        }
        return MessageRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
