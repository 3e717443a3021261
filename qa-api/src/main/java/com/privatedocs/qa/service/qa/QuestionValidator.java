package com.privatedocs.qa.service.qa;

import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class QuestionValidator {

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[<>\"'&;]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minLength;
    private final int maxLength;

    public QuestionValidator(@Value("${docqa.question.min-length:3}") int minLength,
                             @Value("${docqa.question.max-length:500}") int maxLength) {
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    /**
     * Returns the question with markup characters removed and whitespace collapsed.
     */
    public String sanitise(String question) {
        if (question == null) {
            throw new DocQaException(ErrorKind.VALIDATION, "Question is required");
        }
        String cleaned = UNSAFE_CHARACTERS.matcher(question).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.length() < minLength) {
            throw new DocQaException(ErrorKind.VALIDATION, String.format(Locale.ROOT,
                    "Question must be at least %d characters long", minLength));
        }
        if (cleaned.length() > maxLength) {
            throw new DocQaException(ErrorKind.VALIDATION, String.format(Locale.ROOT,
                    "Question must be at most %d characters long", maxLength));
        }
        return cleaned;
    }
}
