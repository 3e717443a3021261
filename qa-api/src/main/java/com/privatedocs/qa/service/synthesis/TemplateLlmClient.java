package com.privatedocs.qa.service.synthesis;

import com.privatedocs.qa.model.RetrievedChunk;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline answerer that quotes the best matching sentence of each passage sharing words with the question.
 */
@Component
@Profile("template")
public class TemplateLlmClient implements LlmClient {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "can", "do", "does", "for", "from", "how", "i", "in",
            "is", "it", "me", "of", "on", "or", "our", "the", "this", "to", "was", "we", "what", "when", "where",
            "which", "who", "why", "with", "you");
    private static final int MAX_SENTENCES = 3;

    @Override
    public LlmResponse generate(LlmRequest request) {
        Set<String> questionWords = words(request.question());
        StringBuilder answer = new StringBuilder();
        int used = 0;
        List<RetrievedChunk> context = request.context() == null ? List.of() : request.context();
        for (int i = 0; i < context.size() && used < MAX_SENTENCES; i++) {
            String sentence = bestSentence(context.get(i).text(), questionWords);
            if (sentence != null) {
                if (answer.length() > 0) {
                    answer.append(' ');
                }
                answer.append(sentence).append(" [").append(i + 1).append(']');
                used++;
            }
        }
        if (used == 0) {
            return LlmResponse.allow(GroundedSynthesizer.INSUFFICIENT_EVIDENCE_SENTINEL);
        }
        return LlmResponse.allow(answer.toString());
    }

    @Override
    public String modelName() {
        return "template-extractive";
    }

    private String bestSentence(String text, Set<String> questionWords) {
        if (text == null || text.isBlank() || questionWords.isEmpty()) {
            return null;
        }
        String best = null;
        int bestOverlap = 0;
        for (String sentence : SENTENCE_END.split(text)) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Set<String> overlap = words(trimmed);
            overlap.retainAll(questionWords);
            if (overlap.size() > bestOverlap) {
                bestOverlap = overlap.size();
                best = trimmed;
            }
        }
        return best;
    }

    private Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }
}
