package com.keacast.assistant.controller;

import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.service.dto.CacheHealth;
import com.keacast.assistant.service.dto.CacheStats;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 上下文缓存运维接口：失效、预热、统计、健康检查。
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class ContextCacheController {

    private final ContextCacheService cache;

    @Operation(summary = "失效某用户的全部缓存")
    @DeleteMapping(value = "/users/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> invalidateUser(@PathVariable("userId") String userId) {
        return cache.invalidate(userId)
                .map(n -> Map.<String, Object>of("userId", userId, "removed", n));
    }

    @Operation(summary = "失效某用户某账户的缓存")
    @DeleteMapping(value = "/users/{userId}/accounts/{accountId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> invalidateAccount(@PathVariable("userId") String userId,
                                                       @PathVariable("accountId") String accountId) {
        return cache.invalidate(userId, accountId)
                .map(n -> Map.<String, Object>of("userId", userId, "accountId", accountId, "removed", n));
    }

    @Operation(summary = "预热：强制重建上下文并写入缓存")
    @PostMapping(value = "/users/{userId}/accounts/{accountId}/warmup", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> warmUp(@PathVariable("userId") String userId,
                                            @PathVariable("accountId") String accountId,
                                            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return cache.warmUp(userId, accountId, bearer(authorization))
                .map(ok -> Map.<String, Object>of("userId", userId, "accountId", accountId, "warmed", ok));
    }

    @Operation(summary = "缓存统计：key、TTL、大小")
    @GetMapping(value = "/users/{userId}/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CacheStats> stats(@PathVariable("userId") String userId) {
        return cache.stats(userId)
                .onErrorMap(e -> {
                    log.warn("[API] cache stats failed user={} err={}", userId, e.toString());
                    return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "cache store unavailable", e);
                });
    }

    @Operation(summary = "缓存存储健康检查：写、读、删一个临时 key，失败时 503")
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CacheHealth>> health() {
        return cache.health()
                .map(h -> ResponseEntity.status(h.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(h));
    }

    private static String bearer(String authorization) {
        if (authorization == null) {
            return null;
        }
        String v = authorization.trim();
        return v.regionMatches(true, 0, "Bearer ", 0, 7) ? v.substring(7).trim() : v;
    }
}
