package com.keacast.assistant.ai;

import lombok.Getter;

import java.time.Duration;

/**
 * Failure of the upstream completion service after classification (and retries, where allowed).
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED(true),
        SERVER_ERROR(true),
        TIMEOUT(true),
        TRANSPORT(true),
        AUTH(false),
        CLIENT_ERROR(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Kind kind;
    private final int status;          // 0 when no HTTP status was received
    private final Duration retryAfter; // only for RATE_LIMITED, null otherwise
    private final int attempts;

    public UpstreamException(Kind kind, int status, String message, Duration retryAfter, int attempts, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.retryAfter = retryAfter;
        this.attempts = attempts;
    }

    public static UpstreamException ofStatus(int status, String body, Duration retryAfter) {
        Kind kind;
        if (status == 429) {
            kind = Kind.RATE_LIMITED;
        } else if (status == 401 || status == 403) {
            kind = Kind.AUTH;
        } else if (status >= 500) {
            kind = Kind.SERVER_ERROR;
        } else {
            kind = Kind.CLIENT_ERROR;
        }
        String msg = "upstream HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        return new UpstreamException(kind, status, msg, retryAfter, 1, null);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /** 记录最终尝试次数后重新抛出 */
    public UpstreamException withAttempts(int attempts) {
        UpstreamException copy = new UpstreamException(kind, status, getMessage(), retryAfter, attempts, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    private static String abbreviate(String s) {
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
