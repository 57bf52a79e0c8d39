package com.examparse.llm.client;

import com.examparse.common.exception.MissingApiKeyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current credential. Changing the key builds a new {@link GeminiClient} and drops the
 * previous one, so calls started afterwards authenticate with the new key.
 */
@Component
@Slf4j
public class GeminiClientProvider {

    private final GeminiConfig config;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final AtomicReference<GeminiClient> current = new AtomicReference<>();

    public GeminiClientProvider(GeminiConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.config = config;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;

        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            current.set(newClient(config.getApiKey().trim()));
            log.info("[GEMINI] Client initialised from configuration | model={}", config.getGenerationModel());
        } else {
            log.warn("[GEMINI] No API key configured; extraction calls fail until one is set");
        }
    }

    public void updateApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        GeminiClient replacement = newClient(apiKey.trim());
        GeminiClient previous = current.getAndSet(replacement);
        log.info("[GEMINI] API key rotated | replacedExisting={} | key={}", previous != null, replacement.maskedKey());
    }

    public GeminiClient currentClient() {
        GeminiClient client = current.get();
        if (client == null) {
            throw new MissingApiKeyException("Gemini API key is not set. Set GEMINI_API_KEY or provide one at runtime.");
        }
        return client;
    }

    public boolean hasApiKey() {
        return current.get() != null;
    }

    private GeminiClient newClient(String apiKey) {
        return new GeminiClient(config, webClientBuilder.build(), objectMapper, apiKey);
    }
}
