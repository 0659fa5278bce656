package com.keacast.assistant.mapper.model;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class AccountRecord {
    private Long accountId;
    private String userId;
    private String name;
    private String type;          // checking / savings / credit ...
    private String institution;
    private BigDecimal balance;
    private BigDecimal availableBalance;
    private Integer accountOrder;
}
