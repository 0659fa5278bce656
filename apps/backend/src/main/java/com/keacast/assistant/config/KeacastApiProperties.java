package com.keacast.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Keacast REST API used to build the per-user context block.
 */
@Data
@ConfigurationProperties(prefix = "keacast.api")
public class KeacastApiProperties {
    private String baseUrl = "https://cashflow-backend-production.herokuapp.com";
    private long timeoutMs = 10_000;
    private int maxInMemoryBytes = 4 * 1024 * 1024;

    private String userPath = "/user/{userId}";
    private String selectedAccountsPath = "/account/getselectedkeacastaccountsnew/{userId}";
    private String balancesPath = "/account/getbalances/{userId}/{accountId}";
    private String createTransactionPath = "/transaction/create/{userId}/{accountId}";
}
