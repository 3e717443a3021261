package com.privatedocs.qa.service.synthesis.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;

/**
 * Minimal client for an OpenAI compatible {@code /v1/chat/completions} endpoint. Timeouts and retries are applied by the caller.
 */
@Component
@Profile("!template")
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient llmWebClient;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient llmWebClient) {
        this.llmWebClient = llmWebClient;
    }

    public ChatCompletion complete(ChatCompletionRequest request) {
        ChatCompletion completion;
        try {
            completion = llmWebClient.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatCompletion.class)
                    .block();
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().is4xxClientError() && ex.getStatusCode().value() != 429) {
                log.error("Chat completion rejected with {}: {}", ex.getStatusCode(), ex.getResponseBodyAsString());
            } else {
                log.warn("Chat completion returned {}", ex.getStatusCode());
            }
            throw new DocQaException(ErrorKind.SYNTHESIS_UNAVAILABLE,
                    "Language model returned " + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException ex) {
            log.warn("Chat completion request to {} failed: {}", ex.getUri(), ex.getMessage());
            throw new DocQaException(ErrorKind.SYNTHESIS_UNAVAILABLE, "Language model is unreachable", ex);
        }
        if (completion != null && completion.usage() != null) {
            log.debug("Chat completion used {} prompt and {} completion tokens",
                    completion.usage().promptTokens(), completion.usage().completionTokens());
        }
        return completion;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChatCompletionRequest(String model,
                                        List<ChatMessage> messages,
                                        Double temperature,
                                        @JsonProperty("max_tokens") Integer maxTokens,
                                        boolean stream) {

        public static ChatCompletionRequest of(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
            return new ChatCompletionRequest(model, messages, temperature, maxTokens, false);
        }
    }

    public record ChatMessage(String role, String content) {

        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatCompletion(List<CompletionChoice> choices, TokenUsage usage) {

        public String content() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                return null;
            }
            return choices.get(0).message().content();
        }

        public String finishReason() {
            return choices == null || choices.isEmpty() ? null : choices.get(0).finishReason();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionChoice(ChatMessage message, @JsonProperty("finish_reason") String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenUsage(@JsonProperty("prompt_tokens") int promptTokens,
                             @JsonProperty("completion_tokens") int completionTokens) {
    }
}
