package com.privatedocs.qa.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

/**
 * HTTP clients for the two model backends. Both speak JSON and authenticate with an optional bearer key.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    @Bean
    public WebClient embeddingsWebClient(WebClient.Builder webClientBuilder,
                                         @Value("${docqa.embeddings.base-url:http://localhost:9000}") String baseUrl,
                                         @Value("${docqa.embeddings.api-key:}") String apiKey,
                                         @Value("${docqa.embeddings.timeout-seconds:30}") long timeoutSeconds) {
        return modelBackend(webClientBuilder.clone(), baseUrl, apiKey, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public WebClient llmWebClient(WebClient.Builder webClientBuilder,
                                  @Value("${docqa.llm.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${docqa.llm.api-key:}") String apiKey,
                                  @Value("${docqa.llm.timeout-seconds:60}") long timeoutSeconds) {
        return modelBackend(webClientBuilder.clone(), baseUrl, apiKey, Duration.ofSeconds(timeoutSeconds));
    }

    static WebClient modelBackend(WebClient.Builder builder, String baseUrl, String apiKey, Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        if (!responseTimeout.isZero() && !responseTimeout.isNegative()) {
            httpClient = httpClient.responseTimeout(responseTimeout);
        }
        builder.baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                    if (apiKey != null && !apiKey.isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                    }
                });
        return builder.build();
    }
}
