package com.keacast.assistant.mapper.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@Data
public class TransactionRecord {

    private static final Map<String, String> FREQUENCIES = Map.ofEntries(
            Map.entry("1", "Daily"), Map.entry("2", "Once"), Map.entry("7", "Weekly"),
            Map.entry("14", "Bi-Weekly"), Map.entry("15", "Semi-Monthly"), Map.entry("16", "Semi-Monthly"),
            Map.entry("28", "Monthly"), Map.entry("29", "Monthly"), Map.entry("30", "Monthly"),
            Map.entry("31", "Monthly"), Map.entry("59", "Bi-Monthly"), Map.entry("60", "Bi-Monthly"),
            Map.entry("61", "Bi-Monthly"), Map.entry("62", "Bi-Monthly"), Map.entry("91", "Quarterly"),
            Map.entry("182", "Semi-Annually"), Map.entry("183", "Semi-Annually"),
            Map.entry("365", "Annually"), Map.entry("366", "Annually"));

    private Long transactionId;
    private Long accountId;
    private String title;
    private String category;
    private BigDecimal amount;
    private LocalDate start;
    private LocalDate end;
    private String frequency;     // 天数编码，见 FREQUENCIES
    private String forecastType;  // A 实际 / F 预测 / RF 循环预测
    private Long matchId;
    private String logo;

    /** Posted / Pending / Forecast */
    public String getStatus() {
        if (matchId == null) {
            return "Forecast";
        }
        return "A".equals(forecastType) ? "Posted" : "Pending";
    }

    public String getFrequencyLabel() {
        return frequency == null ? "Unknown" : FREQUENCIES.getOrDefault(frequency, "Unknown");
    }
}
