package com.examparse.llm.client;

import com.examparse.common.util.TextUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Handle bound to a single API key. Instances are created by {@link GeminiClientProvider}
 * and replaced as a whole when the key changes.
 *
 * <p>{@link #generateJson} never throws; every failure is folded into an {@link LlmCallResult}.
 */
@Slf4j
public class GeminiClient {

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final GeminiConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GeminiClient(GeminiConfig config, WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        this.config = config;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    /**
     * Send one generateContent request asking for a single JSON object.
     */
    public LlmCallResult generateJson(String systemInstruction, List<GeminiPart> parts) {
        long startTime = System.currentTimeMillis();
        String model = config.getGenerationModel();
        long imageCount = parts.stream().filter(GeminiPart::isImage).count();

        log.info("[GEMINI] Starting generation | model={} | parts={} | images={} | key={}",
            model, parts.size(), imageCount, maskedKey());

        Map<String, Object> request = buildRequest(systemInstruction, parts);
        String url = String.format("%s/models/%s:generateContent", config.getBaseUrl(), model);

        try {
            String response = webClient.post()
                .uri(url)
                .header(API_KEY_HEADER, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .block();

            LlmCallResult result = extractContent(response);
            log.info("[GEMINI] Generation finished | model={} | status={} | durationMs={} | responseLength={}",
                model, result.getStatus(), System.currentTimeMillis() - startTime,
                result.getContent() != null ? result.getContent().length() : 0);
            return result;

        } catch (WebClientResponseException e) {
            log.warn("[GEMINI] HTTP error | model={} | statusCode={} | durationMs={} | body={}",
                model, e.getStatusCode().value(), System.currentTimeMillis() - startTime,
                TextUtils.abbreviate(e.getResponseBodyAsString(), 300));
            return mapHttpError(e);
        } catch (WebClientRequestException e) {
            log.warn("[GEMINI] Connection error | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage());
            return LlmCallResult.transientFailure("Connection failed: " + e.getMessage(), 0);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.warn("[GEMINI] Request timed out | model={} | timeoutSeconds={}", model, config.getTimeoutSeconds());
                return LlmCallResult.transientFailure("Request timed out after " + config.getTimeoutSeconds() + "s", 0);
            }
            log.error("[GEMINI] Request failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, cause.getMessage(), cause);
            return LlmCallResult.fatal("Gemini request failed: " + cause.getMessage(), 0);
        }
    }

    private Map<String, Object> buildRequest(String systemInstruction, List<GeminiPart> parts) {
        Map<String, Object> request = new HashMap<>();
        request.put("contents", List.of(Map.of(
            "role", "user",
            "parts", parts.stream().map(GeminiPart::toRequestPart).toList()
        )));
        request.put("systemInstruction", Map.of(
            "parts", List.of(Map.of("text", systemInstruction))
        ));
        request.put("generationConfig", Map.of(
            "temperature", config.getTemperature(),
            "maxOutputTokens", config.getMaxOutputTokens(),
            "responseMimeType", MediaType.APPLICATION_JSON_VALUE
        ));
        return request;
    }

    private LlmCallResult extractContent(String response) {
        if (response == null || response.isBlank()) {
            return LlmCallResult.fatal("Empty response body", 200);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            return LlmCallResult.fatal("Unreadable response envelope: " + e.getMessage(), 200);
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            return LlmCallResult.fatal("No candidates in response" + (blockReason.isEmpty() ? "" : ", blockReason=" + blockReason), 200);
        }

        JsonNode candidate = candidates.get(0);
        String finishReason = candidate.path("finishReason").asText("");
        if ("SAFETY".equals(finishReason) || "RECITATION".equals(finishReason)) {
            return LlmCallResult.fatal("Generation blocked, finishReason=" + finishReason, 200);
        }
        if ("MAX_TOKENS".equals(finishReason)) {
            log.warn("[GEMINI] Response truncated by MAX_TOKENS | maxOutputTokens={}", config.getMaxOutputTokens());
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            return LlmCallResult.fatal("Candidate has no text, finishReason=" + finishReason, 200);
        }
        return LlmCallResult.success(text.toString());
    }

    private LlmCallResult mapHttpError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = String.format("Gemini API error: %d %s", status, e.getStatusText());

        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                message = error.get("error").get("message").asText();
            }
        } catch (Exception parseError) {
            log.debug("[GEMINI] Error body is not JSON | statusCode={}", status);
        }

        if (status == 429) {
            return LlmCallResult.rateLimited(message);
        }
        if (status >= 500 || status == 408) {
            return LlmCallResult.transientFailure(message, status);
        }
        return LlmCallResult.fatal(message, status);
    }

    String maskedKey() {
        if (apiKey == null || apiKey.length() < 8) {
            return "***";
        }
        return "***" + apiKey.substring(apiKey.length() - 4);
    }
}
