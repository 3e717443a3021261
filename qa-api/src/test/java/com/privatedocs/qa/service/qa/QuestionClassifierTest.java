package com.privatedocs.qa.service.qa;

import com.privatedocs.qa.model.QuestionType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionClassifierTest {

    private final QuestionClassifier classifier = new QuestionClassifier();

    @Test
    void classifiesByKeyword() {
        assertThat(classifier.classify("Please summarize the handbook")).isEqualTo(QuestionType.SUMMARY);
        assertThat(classifier.classify("How many days of leave do I get?")).isEqualTo(QuestionType.SPECIFIC);
        assertThat(classifier.classify("Compare the travel and expense policies")).isEqualTo(QuestionType.COMPARISON);
        assertThat(classifier.classify("Analyze the incident trends")).isEqualTo(QuestionType.ANALYSIS);
        assertThat(classifier.classify("Leave entitlement")).isEqualTo(QuestionType.GENERAL);
    }

    @Test
    void summaryTakesPrecedenceOverQuestionWords() {
        assertThat(classifier.classify("What is a brief overview of the policy?")).isEqualTo(QuestionType.SUMMARY);
    }
}
