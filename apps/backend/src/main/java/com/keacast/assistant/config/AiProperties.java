package com.keacast.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Central application properties for assistant orchestration.
 *
 * <p>Every size ceiling, TTL and retry bound used by the orchestration core lives here so that
 * tests can construct an instance directly and exercise boundary values.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    /** OpenAI-compatible endpoint, e.g. {@code https://api.openai.com}. */
    private String baseUrl = "https://api.openai.com";
    private String path = "/v1/chat/completions";
    private String apiKey;
    private String model = "gpt-4o-mini";
    private double temperature = 0.7;
    private int maxTokens = 500;

    private String systemPrompt = """
            You are Keacast's financial assistant. Help the user understand their accounts,
            transactions, recurring bills and cash-flow forecasts.
            Use the available tools when the answer depends on the user's data.
            If data was cut (_truncated) or only a count is available, say so plainly.
            Answer concisely in Markdown.""";

    private Client client = new Client();
    private Context context = new Context();
    private Tools tools = new Tools();
    private Memory memory = new Memory();
    private Store store = new Store();
    private Providers providers = new Providers();

    @Data
    public static class Client {
        /** 单次请求超时；超时按可重试错误处理 */
        private long timeoutMs = 60_000;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 500;
        /** 429 没有 Retry-After 头时的等待时间 */
        private long defaultRetryAfterMs = 1_000;
        private long maxRetryAfterMs = 30_000;
    }

    @Data
    public static class Context {
        /** Byte budget of the serialized outbound message list. */
        private int maxBytes = 120_000;
        private int systemMaxChars = 8_000;
        private int turnMaxChars = 2_000;
        private int contextMaxChars = 24_000;
        private int maxEvictionAttempts = 40;
    }

    @Data
    public static class Tools {
        /** Per-tool serialized payload ceiling, independent of {@link Context#maxBytes}. */
        private int resultMaxBytes = 8_000;
        private long timeoutMs = 15_000;
        private int concurrency = 4;
        private int summaryMaxChars = 10_000;
        /** 一轮里最多执行的工具调用数，多出来的直接记为失败 */
        private int maxCallsPerRound = 8;
    }

    @Data
    public static class Memory {
        /** Sliding window size, counted in messages. */
        private int maxMessages = 20;
        private long ttlSeconds = 86_400;
        private String keyPrefix = "session:";
    }

    @Data
    public static class Store {
        /** in-memory | redis */
        private String type = "in-memory";
        private long timeoutMs = 2_000;
        private long maxEntries = 50_000;
    }

    @Data
    public static class Providers {
        /** Vendor error codes that mean "the query ran out of resources" (MySQL: out of sort memory, out of memory). */
        private List<Integer> resourceExhaustedErrorCodes = List.of(1038, 1041);
        private List<String> resourceExhaustedSqlStates = List.of("HY001", "53200");
        private int defaultAccountsLimit = 20;
        private int defaultTransactionsLimit = 50;
        private int defaultForecastsLimit = 25;
        private int defaultUpcomingLimit = 30;
        private int maxLimit = 200;
    }
}
