package com.keacast.assistant.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.ToolCall;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI chat wire format for {@link ChatMessage}. The assembler measures the same
 * representation that the gateway sends.
 */
public final class ChatWire {

    private ChatWire() {}

    public static ArrayNode toWire(List<ChatMessage> messages, ObjectMapper mapper) {
        ArrayNode arr = mapper.createArrayNode();
        for (ChatMessage m : messages) {
            ObjectNode node = arr.addObject();
            node.put("role", m.role().wire());
            node.put("content", m.content());
            if (m.hasToolCalls()) {
                ArrayNode calls = node.putArray("tool_calls");
                for (ToolCall call : m.toolCalls()) {
                    ObjectNode c = calls.addObject();
                    c.put("id", call.id());
                    c.put("type", "function");
                    ObjectNode fn = c.putObject("function");
                    fn.put("name", call.name());
                    fn.put("arguments", call.argumentsJson());
                }
            }
            if (m.toolCallId() != null) {
                node.put("tool_call_id", m.toolCallId());
            }
        }
        return arr;
    }

    public static int byteSize(List<ChatMessage> messages, ObjectMapper mapper) {
        return toWire(messages, mapper).toString().getBytes(StandardCharsets.UTF_8).length;
    }

    /** choices[0].message.tool_calls → ToolCall；缺 id 的调用补一个稳定 id */
    public static List<ToolCall> readToolCalls(JsonNode message) {
        List<ToolCall> out = new ArrayList<>();
        JsonNode tcs = message.path("tool_calls");
        if (!tcs.isArray()) {
            return out;
        }
        int i = 0;
        for (JsonNode tc : tcs) {
            JsonNode fn = tc.path("function");
            String name = fn.path("name").asText(null);
            if (name == null || name.isBlank()) {
                i++;
                continue;
            }
            String id = tc.path("id").asText("");
            if (id.isBlank()) {
                id = "call_" + i;
            }
            JsonNode args = fn.get("arguments");
            String argsJson;
            if (args == null || args.isNull()) {
                argsJson = "{}";
            } else if (args.isTextual()) {
                argsJson = args.asText();
            } else {
                argsJson = args.toString();
            }
            out.add(ToolCall.of(id, name, argsJson));
            i++;
        }
        return out;
    }
}
