package com.keacast.assistant.mapper.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class TransactionSummary {
    private long totalCount;
    private BigDecimal income = BigDecimal.ZERO;
    private BigDecimal expenses = BigDecimal.ZERO;
    private LocalDate firstDate;
    private LocalDate lastDate;

    public BigDecimal getNet() {
        BigDecimal in = income == null ? BigDecimal.ZERO : income;
        BigDecimal out = expenses == null ? BigDecimal.ZERO : expenses;
        return in.subtract(out);
    }
}
