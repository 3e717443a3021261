package com.privatedocs.qa.service.synthesis;

import com.privatedocs.qa.model.Citation;
import com.privatedocs.qa.model.QueryResult;
import com.privatedocs.qa.model.QuestionType;
import com.privatedocs.qa.model.RetrievedChunk;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class GroundedSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(GroundedSynthesizer.class);

    static final String INSUFFICIENT_EVIDENCE_SENTINEL = "INSUFFICIENT_EVIDENCE";

    private static final String SYSTEM_PROMPT = "You answer questions about an organization's private documents. "
            + "Use only the numbered context passages you are given and cite every statement with its passage marker, for example [1] or [2]. "
            + "If the passages do not contain the answer, reply with exactly " + INSUFFICIENT_EVIDENCE_SENTINEL + " and nothing else. "
            + "Never use outside knowledge and never guess.";

    private static final Pattern CITATION_MARKER = Pattern.compile("\\[(\\d{1,3})]");
    private static final List<String> HEDGES = List.of("unclear", "ambiguous", "i don't know", "i do not know");
    private static final int SNIPPET_LENGTH = 240;

    private final LlmClient llmClient;
    private final RetryPolicy retryPolicy;
    private final ContextBudgetGuard budgetGuard;
    private final Duration timeout;

    public GroundedSynthesizer(LlmClient llmClient,
                               @Qualifier("synthesisRetryPolicy") RetryPolicy retryPolicy,
                               @Value("${docqa.synthesis.max-context-chars:6000}") int maxContextChars,
                               @Value("${docqa.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.llmClient = llmClient;
        this.retryPolicy = retryPolicy;
        this.budgetGuard = new ContextBudgetGuard(maxContextChars);
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public QueryResult synthesize(String question, QuestionType questionType, List<RetrievedChunk> rankedChunks) {
        if (rankedChunks == null || rankedChunks.isEmpty()) {
            return QueryResult.insufficientEvidence(questionType);
        }
        ContextBudgetGuard.GuardedChunks guarded = budgetGuard.enforce(rankedChunks);
        List<RetrievedChunk> context = guarded.chunks();
        if (context.isEmpty()) {
            log.debug("No retrieved chunk fits the context budget");
            return QueryResult.insufficientEvidence(questionType);
        }
        if (guarded.truncated()) {
            log.debug("Context truncated to {} of {} chunks", context.size(), rankedChunks.size());
        }

        LlmResponse response = generate(new LlmRequest(SYSTEM_PROMPT, question, context, questionType));
        String answer = response.answer().trim();
        if (response.blocked() || answer.toUpperCase(Locale.ROOT).startsWith(INSUFFICIENT_EVIDENCE_SENTINEL)) {
            return QueryResult.insufficientEvidence(questionType);
        }

        List<RetrievedChunk> cited = citedChunks(answer, context);
        if (cited.isEmpty()) {
            log.debug("Answer carries no passage markers, treating it as ungrounded");
            return QueryResult.insufficientEvidence(questionType);
        }
        List<Citation> citations = cited.stream().map(GroundedSynthesizer::toCitation).toList();
        double confidence = confidence(answer, context, cited.size());
        return new QueryResult(answer, citations, confidence, false, questionType);
    }

    public String modelName() {
        return llmClient.modelName();
    }

    private LlmResponse generate(LlmRequest request) {
        Mono<LlmResponse> attempt = Mono.fromCallable(() -> {
                    LlmResponse response = llmClient.generate(request);
                    if (response == null || response.answer() == null || response.answer().isBlank()) {
                        throw new DocQaException(ErrorKind.SYNTHESIS_UNAVAILABLE, "Language model returned an empty answer");
                    }
                    return response;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
        return retryPolicy.apply(attempt)
                .onErrorMap(this::unavailable)
                .block();
    }

    private Throwable unavailable(Throwable failure) {
        if (failure instanceof DocQaException docQa && docQa.kind() == ErrorKind.SYNTHESIS_UNAVAILABLE) {
            log.error("Answer synthesis failed after retries: {}", failure.getMessage());
            return failure;
        }
        String reason = failure instanceof TimeoutException ? "Language model call timed out" : "Language model unavailable";
        log.error("{} after retries: {}", reason, failure.getMessage());
        return new DocQaException(ErrorKind.SYNTHESIS_UNAVAILABLE, reason, failure);
    }

    static List<RetrievedChunk> citedChunks(String answer, List<RetrievedChunk> context) {
        Set<Integer> markers = new TreeSet<>();
        Matcher matcher = CITATION_MARKER.matcher(answer);
        while (matcher.find()) {
            int marker = Integer.parseInt(matcher.group(1));
            if (marker >= 1 && marker <= context.size()) {
                markers.add(marker);
            }
        }
        List<RetrievedChunk> cited = new ArrayList<>(markers.size());
        for (int marker : markers) {
            cited.add(context.get(marker - 1));
        }
        return List.copyOf(cited);
    }

    static double confidence(String answer, List<RetrievedChunk> context, int citedCount) {
        double topScore = clamp(context.get(0).score());
        double citedFraction = context.isEmpty() ? 0.0 : (double) citedCount / context.size();
        double heuristic = 1.0;
        if (answer.length() < 50) {
            heuristic -= 0.5;
        }
        String lower = answer.toLowerCase(Locale.ROOT);
        if (HEDGES.stream().anyMatch(lower::contains)) {
            heuristic -= 0.5;
        }
        return clamp(0.6 * topScore + 0.2 * citedFraction + 0.2 * heuristic);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Citation toCitation(RetrievedChunk chunk) {
        String text = chunk.text() == null ? "" : chunk.text().replaceAll("\\s+", " ").trim();
        String snippet = text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH - 3) + "...";
        return new Citation(chunk.documentId(), chunk.chunkId(), chunk.filename(), chunk.start(), chunk.end(), snippet);
    }
}
