package com.keacast.assistant.tools.support;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

public final class ToolArgs {
    private ToolArgs() {}

    public static String string(Map<String, Object> args, String key) {
        Object v = args == null ? null : args.get(key);
        if (v == null) return null;
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? null : s;
    }

    public static Integer integer(Map<String, Object> args, String key) {
        Object v = args == null ? null : args.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'");
        }
    }

    public static BigDecimal number(Map<String, Object> args, String key) {
        Object v = args == null ? null : args.get(key);
        if (v == null) return null;
        try {
            return new BigDecimal(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + v + "'");
        }
    }

    /** yyyy-MM-dd，也接受 yyyy/MM/dd */
    public static LocalDate date(Map<String, Object> args, String key) {
        String s = string(args, key);
        if (s == null) return null;
        try {
            return LocalDate.parse(s.replace('/', '-'));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be a date (yyyy-MM-dd), got '" + s + "'");
        }
    }

    public static String required(Map<String, Object> args, String key) {
        String s = string(args, key);
        if (s == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return s;
    }
}
