package com.examparse.llm.retry;

import com.examparse.llm.client.LlmCallResult;
import lombok.Getter;

/**
 * Per-call bookkeeping for the retry loop. Discarded once the call resolves.
 */
@Getter
public class RetryState {

    private int attempt;
    private int maxAttempts;
    private LlmCallResult lastResult;
    private long nextDelayMs;

    public RetryState(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int nextAttempt() {
        return ++attempt;
    }

    public void record(LlmCallResult result, RetryPolicy policy) {
        this.lastResult = result;
        // the ceiling only ever grows: one rate-limit response lifts it for the rest of the call
        this.maxAttempts = Math.max(maxAttempts, policy.maxAttemptsFor(result.getStatus()));
        this.nextDelayMs = policy.backoffFor(result.getStatus(), attempt);
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public String lastError() {
        return lastResult != null ? lastResult.getError() : null;
    }
}
