package com.privatedocs.qa.service.qa;

import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.QueryOutcome;
import com.privatedocs.qa.model.QueryResult;
import com.privatedocs.qa.model.QuestionType;
import com.privatedocs.qa.model.RetrievedChunk;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.AccessControlFilter;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.catalog.DocumentCatalog;
import com.privatedocs.qa.service.resilience.RequestRateLimiter;
import com.privatedocs.qa.service.retrieval.DenseRetriever;
import com.privatedocs.qa.service.synthesis.GroundedSynthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class DefaultQueryService implements QueryService {

    private static final Logger log = LoggerFactory.getLogger(DefaultQueryService.class);

    private static final List<String> GENERIC_SUGGESTIONS = List.of(
            "What is the main topic of the documents?",
            "Can you summarize the key points?",
            "What are the most important findings?",
            "What are the main conclusions?",
            "Which policies or procedures are described?");

    private final QuestionValidator questionValidator;
    private final QuestionClassifier questionClassifier;
    private final AccessControlFilter accessControlFilter;
    private final DocumentCatalog catalog;
    private final DenseRetriever retriever;
    private final GroundedSynthesizer synthesizer;
    private final RequestRateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final Timer queryTimer;
    private final int maxBatchSize;

    public DefaultQueryService(QuestionValidator questionValidator,
                               QuestionClassifier questionClassifier,
                               AccessControlFilter accessControlFilter,
                               DocumentCatalog catalog,
                               DenseRetriever retriever,
                               GroundedSynthesizer synthesizer,
                               RequestRateLimiter rateLimiter,
                               MeterRegistry meterRegistry,
                               @Value("${docqa.question.max-batch-size:10}") int maxBatchSize) {
        this.questionValidator = questionValidator;
        this.questionClassifier = questionClassifier;
        this.accessControlFilter = accessControlFilter;
        this.catalog = catalog;
        this.retriever = retriever;
        this.synthesizer = synthesizer;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
        this.queryTimer = meterRegistry.timer("docqa.qa.duration");
        this.maxBatchSize = Math.max(1, maxBatchSize);
    }

    @Override
    public QueryOutcome ask(String question, String documentId, CallerIdentity caller) {
        try {
            rateLimiter.acquire(caller.callerId());
        } catch (DocQaException ex) {
            return record(QueryOutcome.failed(ex.kind(), ex.getMessage()));
        }
        return answer(question, documentId, caller);
    }

    @Override
    public List<QueryOutcome> askBatch(List<String> questions, CallerIdentity caller) {
        if (questions == null || questions.isEmpty()) {
            throw new DocQaException(ErrorKind.VALIDATION, "At least one question is required");
        }
        if (questions.size() > maxBatchSize) {
            throw new DocQaException(ErrorKind.VALIDATION, String.format(Locale.ROOT,
                    "At most %d questions may be asked at once", maxBatchSize));
        }
        rateLimiter.acquire(caller.callerId());
        List<QueryOutcome> outcomes = new ArrayList<>(questions.size());
        for (String question : questions) {
            outcomes.add(answer(question, null, caller));
        }
        return List.copyOf(outcomes);
    }

    @Override
    public List<String> suggestions(String topic) {
        if (topic == null || topic.isBlank()) {
            return GENERIC_SUGGESTIONS;
        }
        String cleaned = questionValidator.sanitise(topic);
        List<String> suggestions = new ArrayList<>(GENERIC_SUGGESTIONS);
        suggestions.add("What do the documents say about " + cleaned + "?");
        suggestions.add("How is " + cleaned + " addressed?");
        suggestions.add("What are the implications for " + cleaned + "?");
        return List.copyOf(suggestions);
    }

    private QueryOutcome answer(String rawQuestion, String documentId, CallerIdentity caller) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            String question = questionValidator.sanitise(rawQuestion);
            QuestionType questionType = questionClassifier.classify(question);
            Set<String> scope = resolveScope(documentId, caller);
            if (scope.isEmpty()) {
                log.debug("Caller {} has no readable indexed documents in scope", caller.callerId());
                return record(QueryOutcome.insufficientEvidence(QueryResult.insufficientEvidence(questionType)));
            }
            List<RetrievedChunk> chunks = retriever.search(question, scope);
            QueryResult result = synthesizer.synthesize(question, questionType, chunks);
            log.info("Answered {} question ({} chars) for caller {} with {} citations, insufficient evidence: {}",
                    questionType, question.length(), caller.callerId(), result.citations().size(), result.insufficientEvidence());
            return record(result.insufficientEvidence()
                    ? QueryOutcome.insufficientEvidence(result)
                    : QueryOutcome.answered(result));
        } catch (DocQaException ex) {
            log.warn("Question from caller {} failed with {}: {}", caller.callerId(), ex.kind(), ex.getMessage());
            return record(QueryOutcome.failed(ex.kind(), ex.getMessage()));
        } finally {
            sample.stop(queryTimer);
        }
    }

    private Set<String> resolveScope(String documentId, CallerIdentity caller) {
        Set<String> allowed = accessControlFilter.allowedDocumentIds(caller);
        if (documentId == null || documentId.isBlank()) {
            return allowed;
        }
        if (allowed.contains(documentId)) {
            return Set.of(documentId);
        }
        DocumentSummary document = catalog.findById(documentId).orElse(null);
        if (document == null) {
            throw caller.admin()
                    ? new DocQaException(ErrorKind.NOT_FOUND, "Document " + documentId + " does not exist")
                    : new DocQaException(ErrorKind.PERMISSION_DENIED, "You do not have access to document " + documentId);
        }
        if (accessControlFilter.canManage(caller, document)) {
            // visible to the caller but not INDEXED, so nothing can be retrieved from it
            return Set.of();
        }
        throw new DocQaException(ErrorKind.PERMISSION_DENIED, "You do not have access to document " + documentId);
    }

    private QueryOutcome record(QueryOutcome outcome) {
        meterRegistry.counter("docqa.qa.outcomes", "status", outcome.status().name().toLowerCase(Locale.ROOT)).increment();
        return outcome;
    }
}
