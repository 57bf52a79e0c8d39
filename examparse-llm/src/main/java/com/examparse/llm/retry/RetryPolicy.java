package com.examparse.llm.retry;

import com.examparse.llm.client.LlmCallResult;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Exponential backoff settings. Rate-limit responses get a longer base and a higher ceiling
 * than other transient failures.
 */
@Configuration
@ConfigurationProperties(prefix = "examparse.retry")
@Getter
@Setter
public class RetryPolicy {
    private int maxAttempts = 3;
    private long backoffBaseMs = 1000;
    private int rateLimitMaxAttempts = 5;
    private long rateLimitBackoffBaseMs = 2000;
    private long maxBackoffMs = 30_000;

    public int maxAttemptsFor(LlmCallResult.Status status) {
        return status == LlmCallResult.Status.RATE_LIMITED ? rateLimitMaxAttempts : maxAttempts;
    }

    /**
     * Delay before the attempt that follows {@code attempt} (1-based).
     */
    public long backoffFor(LlmCallResult.Status status, int attempt) {
        long base = status == LlmCallResult.Status.RATE_LIMITED ? rateLimitBackoffBaseMs : backoffBaseMs;
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        return Math.min(base * (1L << exponent), maxBackoffMs);
    }
}
