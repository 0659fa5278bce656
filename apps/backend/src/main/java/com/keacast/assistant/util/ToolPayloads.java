package com.keacast.assistant.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class ToolPayloads {
    private ToolPayloads() {}

    private static final List<String> MESSAGE_KEYS = List.of("message", "text", "summary");
    private static final int DESCRIBE_MAX_KEYS = 8;
    private static final int KEPT_MESSAGE_BYTES = 500;

    public record Bounded(Object data, int originalSize, boolean truncated) { }

    /**
     * 超过 maxBytes 的 payload 换成 {_truncated, _originalSize, message?, preview}，
     * preview 是原 JSON 的前缀，整体仍在 maxBytes 之内。
     */
    public static Bounded bound(Object data, int maxBytes, ObjectMapper om) {
        String json = toJson(data, om);
        int size = utf8Length(json);
        if (size <= maxBytes) {
            return new Bounded(data, size, false);
        }
        Map<String, Object> wrapper = new LinkedHashMap<>();
        wrapper.put("_truncated", true);
        wrapper.put("_originalSize", size);
        // 截断后仍保留工具自己的一句话说明
        String msg = data instanceof Map<?, ?> m ? messageOf(m) : null;
        if (msg != null) {
            wrapper.put("message", utf8Prefix(msg, Math.min(KEPT_MESSAGE_BYTES, maxBytes / 4)));
        }
        // wrapper 本身的开销 + 转义膨胀留余量
        int previewBudget = Math.max(0, (maxBytes - 96 - utf8Length(toJson(wrapper, om))) / 2);
        wrapper.put("preview", utf8Prefix(json, previewBudget));
        return new Bounded(wrapper, size, true);
    }

    /**
     * 工具结果的一行自然语言描述：优先 message/text/summary 字段，否则只描述形状，不输出原始数据。
     */
    public static String describe(Object data) {
        String text;
        if (data == null) {
            text = "no data";
        } else if (data instanceof String s) {
            text = s;
        } else if (data instanceof Map<?, ?> m) {
            String msg = messageOf(m);
            if (msg != null) {
                text = msg;
            } else if (Boolean.TRUE.equals(m.get("_truncated"))) {
                text = "returned a large result";
            } else if (m.isEmpty()) {
                text = "returned no data";
            } else {
                text = "returned fields " + m.keySet().stream()
                        .limit(DESCRIBE_MAX_KEYS)
                        .map(String::valueOf)
                        .collect(Collectors.joining(", "))
                        + (m.size() > DESCRIBE_MAX_KEYS ? " and " + (m.size() - DESCRIBE_MAX_KEYS) + " more" : "");
            }
        } else if (data instanceof Collection<?> c) {
            text = "returned " + c.size() + (c.size() == 1 ? " item" : " items");
        } else {
            text = String.valueOf(data);
        }
        return singleLine(text);
    }

    /** message / text / summary 中第一个非空字符串 */
    public static String messageOf(Map<?, ?> m) {
        for (String k : MESSAGE_KEYS) {
            Object v = m.get(k);
            if (v instanceof String sv && !sv.isBlank()) {
                return sv;
            }
        }
        return null;
    }

    public static String singleLine(String s) {
        return s == null ? "" : s.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    public static String toJson(Object o, ObjectMapper om) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            return String.valueOf(o);
        }
    }

    public static int utf8Length(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }

    /** 按 UTF-8 字节截前缀，不拆代理对 */
    public static String utf8Prefix(String s, int maxBytes) {
        if (s == null || maxBytes <= 0) {
            return "";
        }
        int bytes = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int len = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            if (bytes + len > maxBytes) {
                break;
            }
            bytes += len;
            i += Character.charCount(cp);
        }
        return s.substring(0, i);
    }

    public static String clip(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        if (maxChars <= 0) {
            return "";
        }
        if (s.length() <= maxChars) {
            return s;
        }
        // 结果总长不超过 maxChars（含省略号）
        int end = maxChars - 1;
        if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end) + "…";
    }
}
