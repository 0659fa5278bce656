package com.keacast.assistant.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Filters the {@code forecasted} series of a Keacast balances response to a window around today.
 */
public final class BalanceWindow {

    private BalanceWindow() {}

    public static List<Object> forecasted(Map<String, Object> balances, LocalDate today, int monthsBack, int monthsForward) {
        if (balances == null || !(balances.get("forecasted") instanceof List<?> forecasted)) {
            return List.of();
        }
        LocalDate from = today.minusMonths(monthsBack);
        LocalDate to = today.plusMonths(monthsForward);
        List<Object> out = new ArrayList<>();
        for (Object o : forecasted) {
            if (!(o instanceof Map<?, ?> row) || row.get("date") == null) {
                continue;
            }
            LocalDate d = parseDate(String.valueOf(row.get("date")));
            // 开区间，两端不含
            if (d != null && d.isAfter(from) && d.isBefore(to)) {
                out.add(row);
            }
        }
        return out;
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
