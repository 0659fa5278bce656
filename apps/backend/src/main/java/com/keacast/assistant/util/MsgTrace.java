package com.keacast.assistant.util;

import com.keacast.assistant.api.dto.ChatMessage;

import java.util.List;

public final class MsgTrace {
    private MsgTrace() {}

    public static String lastLine(List<ChatMessage> msgs) {
        if (msgs == null || msgs.isEmpty()) return "<empty>";
        ChatMessage last = msgs.get(msgs.size() - 1);
        String content = last.content();
        if (content.length() > 120) content = content.substring(0, 120) + "...";
        return last.role().wire() + " :: " + content;
    }

    /** 例如 "system,user,assistant,tool,user" */
    public static String roles(List<ChatMessage> msgs) {
        if (msgs == null || msgs.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (ChatMessage m : msgs) {
            if (sb.length() > 0) sb.append(',');
            sb.append(m.role().wire());
        }
        return sb.toString();
    }
}
