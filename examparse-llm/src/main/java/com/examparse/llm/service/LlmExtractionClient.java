package com.examparse.llm.service;

import com.examparse.llm.client.GeminiClient;
import com.examparse.llm.client.GeminiClientProvider;
import com.examparse.llm.client.GeminiPart;
import com.examparse.llm.client.LlmCallResult;
import com.examparse.llm.retry.RetryPolicy;
import com.examparse.llm.retry.RetryState;
import com.examparse.llm.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Model call with retry and exponential backoff.
 *
 * <p>Returns {@link Optional#empty()} once retries are exhausted or on a non-retryable failure,
 * so one failing section never aborts the document. A missing credential is the only exception
 * that escapes, because no section can succeed without one.
 */
@Service
@Slf4j
public class LlmExtractionClient {

    private final GeminiClientProvider clientProvider;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    @Autowired
    public LlmExtractionClient(GeminiClientProvider clientProvider, RetryPolicy retryPolicy) {
        this(clientProvider, retryPolicy, Sleeper.threadSleeper());
    }

    public LlmExtractionClient(GeminiClientProvider clientProvider, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.clientProvider = clientProvider;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public Optional<String> call(String systemInstruction, List<GeminiPart> parts) {
        GeminiClient client = clientProvider.currentClient();
        RetryState state = new RetryState(retryPolicy.getMaxAttempts());

        while (true) {
            int attempt = state.nextAttempt();
            LlmCallResult result = client.generateJson(systemInstruction, parts);

            if (result.isSuccess()) {
                if (attempt > 1) {
                    log.info("[RETRY] Call succeeded after retry | attempt={}", attempt);
                }
                return Optional.of(result.getContent());
            }

            state.record(result, retryPolicy);

            if (!result.isRetryable()) {
                log.error("[RETRY] Non-retryable failure | attempt={} | statusCode={} | error={}",
                    attempt, result.getStatusCode(), result.getError());
                return Optional.empty();
            }

            if (!state.hasAttemptsLeft()) {
                log.error("[RETRY] Retries exhausted | attempts={} | lastStatus={} | lastError={}",
                    attempt, result.getStatus(), state.lastError());
                return Optional.empty();
            }

            log.warn("[RETRY] Retryable failure, backing off | attempt={}/{} | status={} | delayMs={} | error={}",
                attempt, state.getMaxAttempts(), result.getStatus(), state.getNextDelayMs(), result.getError());
            try {
                sleeper.sleep(state.getNextDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[RETRY] Interrupted while backing off | attempt={}", attempt);
                return Optional.empty();
            }
        }
    }
}
