package com.examparse.llm.client;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of a single model call. Callers branch on {@link #getStatus()} instead of catching exceptions.
 */
@Getter
@ToString(exclude = "content")
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class LlmCallResult {

    public enum Status {
        SUCCESS,
        RATE_LIMITED,
        TRANSIENT,
        FATAL
    }

    private final Status status;
    private final String content;
    private final String error;
    private final int statusCode;

    public static LlmCallResult success(String content) {
        return new LlmCallResult(Status.SUCCESS, content, null, 200);
    }

    public static LlmCallResult rateLimited(String error) {
        return new LlmCallResult(Status.RATE_LIMITED, null, error, 429);
    }

    public static LlmCallResult transientFailure(String error, int statusCode) {
        return new LlmCallResult(Status.TRANSIENT, null, error, statusCode);
    }

    public static LlmCallResult fatal(String error, int statusCode) {
        return new LlmCallResult(Status.FATAL, null, error, statusCode);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RATE_LIMITED || status == Status.TRANSIENT;
    }
}
