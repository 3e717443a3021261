package com.privatedocs.qa.service.qa;

import com.privatedocs.qa.model.QuestionType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class QuestionClassifier {

    private static final Map<QuestionType, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(QuestionType.SUMMARY, Pattern.compile("\\b(summary|summarize|summarise|overview|brief)\\b"));
        PATTERNS.put(QuestionType.SPECIFIC, Pattern.compile("\\b(what|how|why|when|where|who)\\b"));
        PATTERNS.put(QuestionType.COMPARISON, Pattern.compile("\\b(compare|difference|similar|versus|vs)\\b"));
        PATTERNS.put(QuestionType.ANALYSIS, Pattern.compile("\\b(analyze|analyse|analysis|examine|study)\\b"));
    }

    public QuestionType classify(String question) {
        if (question == null || question.isBlank()) {
            return QuestionType.GENERAL;
        }
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<QuestionType, Pattern> entry : PATTERNS.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                return entry.getKey();
            }
        }
        return QuestionType.GENERAL;
    }
}
