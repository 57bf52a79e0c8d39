package com.examparse.llm.config;

import com.examparse.llm.client.GeminiConfig;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient builder for model calls.
 *
 * Vision requests carry several base64 page images and responses can hold a whole
 * section of questions, so the codec buffer is sized well above the default 256KB.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 32 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    @Bean
    public WebClient.Builder webClientBuilder(GeminiConfig geminiConfig) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        // the per-request timeout in GeminiClient is the binding one; this only stops idle sockets
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(geminiConfig.getTimeoutSeconds() + 30L))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
