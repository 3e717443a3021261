package com.privatedocs.qa.service.synthesis;

import com.privatedocs.qa.model.QuestionType;
import com.privatedocs.qa.model.RetrievedChunk;

import java.util.List;

public record LlmRequest(String systemPrompt,
                         String question,
                         List<RetrievedChunk> context,
                         QuestionType questionType) {
}
