package com.keacast.assistant.client;

import com.keacast.assistant.config.KeacastApiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Keacast 后端 REST 接口。token 只做透传，为空时不带 Authorization。
 */
@Slf4j
@Component
public class KeacastApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Map<String, Object>>> LIST = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final KeacastApiProperties props;

    public KeacastApiClient(@Qualifier("keacastWebClient") WebClient webClient, KeacastApiProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    public Mono<Map<String, Object>> getUserData(String userId, String token) {
        log.debug("[KEACAST] GET user userId={}", userId);
        return webClient.get()
                .uri(props.getUserPath(), Map.of("userId", userId))
                .headers(auth(token))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(MAP)
                .defaultIfEmpty(Map.of())
                .timeout(timeout());
    }

    /** 选中账户的聚合数据（交易、即将发生、分类、余额分解等） */
    public Mono<List<Map<String, Object>>> getSelectedAccounts(String userId, String token, Map<String, Object> body) {
        log.debug("[KEACAST] POST selected accounts userId={}", userId);
        return webClient.post()
                .uri(props.getSelectedAccountsPath(), Map.of("userId", userId))
                .headers(auth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(LIST)
                .defaultIfEmpty(List.of())
                .timeout(timeout());
    }

    public Mono<Map<String, Object>> getBalances(String userId, String accountId, String token) {
        log.debug("[KEACAST] GET balances userId={} accountId={}", userId, accountId);
        return webClient.get()
                .uri(props.getBalancesPath(), Map.of("userId", userId, "accountId", accountId))
                .headers(auth(token))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(MAP)
                .defaultIfEmpty(Map.of())
                .timeout(timeout());
    }

    /** 新建一笔交易，返回后端保存后的记录 */
    public Mono<Map<String, Object>> createTransaction(String userId, String accountId, String token,
                                                       Map<String, Object> transaction) {
        log.info("[KEACAST] POST transaction userId={} accountId={}", userId, accountId);
        return webClient.post()
                .uri(props.getCreateTransactionPath(), Map.of("userId", userId, "accountId", accountId))
                .headers(auth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(transaction)
                .retrieve()
                .bodyToMono(MAP)
                .defaultIfEmpty(Map.of())
                .timeout(timeout());
    }

    private Duration timeout() {
        return Duration.ofMillis(props.getTimeoutMs());
    }

    private static Consumer<HttpHeaders> auth(String token) {
        return h -> {
            if (token != null && !token.isBlank()) {
                h.setBearerAuth(token);
            }
        };
    }
}
