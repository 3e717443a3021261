package com.privatedocs.qa.service.synthesis;

import com.privatedocs.qa.model.RetrievedChunk;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.synthesis.openai.OpenAiChatClient;
import com.privatedocs.qa.service.synthesis.openai.OpenAiChatClient.ChatCompletion;
import com.privatedocs.qa.service.synthesis.openai.OpenAiChatClient.ChatCompletionRequest;
import com.privatedocs.qa.service.synthesis.openai.OpenAiChatClient.ChatMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@Profile("!template")
public class OpenAiLlmClient implements LlmClient {

    private final OpenAiChatClient chatClient;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiLlmClient(OpenAiChatClient chatClient,
                           @Value("${docqa.llm.model:gpt-4o-mini}") String model,
                           @Value("${docqa.llm.temperature:0.1}") double temperature,
                           @Value("${docqa.llm.max-output-tokens:800}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.model = model;
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(64, maxOutputTokens);
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        List<ChatMessage> messages = List.of(
                ChatMessage.system(request.systemPrompt()),
                ChatMessage.user(userPrompt(request)));
        ChatCompletion completion = chatClient.complete(ChatCompletionRequest.of(model, messages, temperature, maxOutputTokens));
        String content = completion == null ? null : completion.content();
        if (content == null || content.isBlank()) {
            throw new DocQaException(ErrorKind.SYNTHESIS_UNAVAILABLE, "Language model returned no content");
        }
        return new LlmResponse(content.trim(), guardrailAction(completion.finishReason()));
    }

    @Override
    public String modelName() {
        return model;
    }

    static String userPrompt(LlmRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Passages:\n");
        List<RetrievedChunk> context = request.context() == null ? List.of() : request.context();
        for (int i = 0; i < context.size(); i++) {
            RetrievedChunk chunk = context.get(i);
            prompt.append('[').append(i + 1).append("] ")
                    .append(chunk.filename()).append(": ")
                    .append(chunk.text() == null ? "" : chunk.text().trim())
                    .append("\n\n");
        }
        if (request.questionType() != null) {
            prompt.append("This is a ").append(request.questionType().name().toLowerCase(Locale.ROOT)).append(" question.\n");
        }
        prompt.append("Question: ").append(request.question());
        return prompt.toString();
    }

    // content_filter means the provider withheld the answer
    static String guardrailAction(String finishReason) {
        if ("content_filter".equals(finishReason)) {
            return "BLOCKED";
        }
        return "length".equals(finishReason) ? "TRUNCATED" : "ALLOW";
    }
}
