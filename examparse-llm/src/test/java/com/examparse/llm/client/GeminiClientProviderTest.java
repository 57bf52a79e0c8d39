package com.examparse.llm.client;

import com.examparse.common.exception.MissingApiKeyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiClientProviderTest {

    @Test
    void currentClient_withoutKey_throwsMissingApiKey() {
        GeminiClientProvider provider = new GeminiClientProvider(new GeminiConfig(), WebClient.builder(), new ObjectMapper());

        assertThat(provider.hasApiKey()).isFalse();
        assertThatThrownBy(provider::currentClient).isInstanceOf(MissingApiKeyException.class);
    }

    @Test
    void updateApiKey_replacesCachedHandle() {
        GeminiConfig config = new GeminiConfig();
        config.setApiKey("initial-key-0001");
        GeminiClientProvider provider = new GeminiClientProvider(config, WebClient.builder(), new ObjectMapper());
        GeminiClient before = provider.currentClient();

        provider.updateApiKey("rotated-key-0002");

        GeminiClient after = provider.currentClient();
        assertThat(after).isNotSameAs(before);
        assertThat(after.maskedKey()).isEqualTo("***0002");
        assertThat(provider.currentClient()).isSameAs(after);
    }

    @Test
    void updateApiKey_rejectsBlank() {
        GeminiClientProvider provider = new GeminiClientProvider(new GeminiConfig(), WebClient.builder(), new ObjectMapper());

        assertThatThrownBy(() -> provider.updateApiKey("  "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(provider.hasApiKey()).isFalse();
    }
}
