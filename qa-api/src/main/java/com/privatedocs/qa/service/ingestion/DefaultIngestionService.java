package com.privatedocs.qa.service.ingestion;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.SubmitDocumentResponse;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.AccessTags;
import com.privatedocs.qa.service.catalog.DocumentCatalog;
import com.privatedocs.qa.service.embedding.EmbeddingService;
import com.privatedocs.qa.service.embedding.EmbeddingsClient;
import com.privatedocs.qa.service.index.IndexedChunk;
import com.privatedocs.qa.service.index.VectorIndex;
import com.privatedocs.qa.service.resilience.DocumentLockRegistry;
import com.privatedocs.qa.service.resilience.RequestRateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\x0B\\f\\u00A0 ]+");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final UploadValidator uploadValidator;
    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final DocumentCatalog catalog;
    private final DocumentLockRegistry lockRegistry;
    private final RequestRateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final Counter indexedCounter;
    private final Counter dedupCounter;
    private final Counter failedCounter;
    private final Timer ingestionTimer;
    private final Duration extractionTimeout;

    public DefaultIngestionService(UploadValidator uploadValidator,
                                   DocumentTextExtractor textExtractor,
                                   TextChunker textChunker,
                                   EmbeddingService embeddingService,
                                   VectorIndex vectorIndex,
                                   DocumentCatalog catalog,
                                   DocumentLockRegistry lockRegistry,
                                   RequestRateLimiter rateLimiter,
                                   MeterRegistry meterRegistry,
                                   @Value("${docqa.ingest.extraction-timeout-seconds:60}") long extractionTimeoutSeconds) {
        this.uploadValidator = uploadValidator;
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.catalog = catalog;
        this.lockRegistry = lockRegistry;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
        this.indexedCounter = meterRegistry.counter("docqa.ingest.events", "outcome", "indexed");
        this.dedupCounter = meterRegistry.counter("docqa.ingest.events", "outcome", "deduplicated");
        this.failedCounter = meterRegistry.counter("docqa.ingest.events", "outcome", "failed");
        this.ingestionTimer = meterRegistry.timer("docqa.ingest.duration");
        this.extractionTimeout = Duration.ofSeconds(Math.max(1, extractionTimeoutSeconds));
    }

    @Override
    public SubmitDocumentResponse submitDocument(SubmitDocumentCommand command) {
        if (command != null) {
            rateLimiter.acquire(command.ownerId());
        }
        DocumentFormat format = uploadValidator.validate(command);
        String contentHash = sha256(command.bytes());
        Set<String> accessTags = AccessTags.normalise(command.accessTags());

        return lockRegistry.withLock(DocumentLockRegistry.contentKey(command.ownerId(), contentHash), () -> {
            DocumentSummary existing = catalog.findLatestByOwnerAndHash(command.ownerId(), contentHash).orElse(null);
            if (existing != null && existing.status() == DocumentStatus.INDEXED) {
                dedupCounter.increment();
                log.info("Skipped re-indexing of document {} for owner {} due to matching content hash", existing.id(), command.ownerId());
                return new SubmitDocumentResponse(existing.id(), existing.filename(), existing.status(), existing.chunkCount(), existing.version(), true);
            }
            String documentId = existing != null ? existing.id() : UUID.randomUUID().toString();
            DocumentCatalog.NewRun run = new DocumentCatalog.NewRun(documentId, contentHash, command.filename(), format,
                    command.bytes().length, command.ownerId(), accessTags);
            return lockRegistry.withLock(DocumentLockRegistry.documentKey(documentId), () -> index(run, command.bytes()));
        });
    }

    private SubmitDocumentResponse index(DocumentCatalog.NewRun run, byte[] bytes) {
        Timer.Sample sample = Timer.start(meterRegistry);
        DocumentSummary pending = catalog.beginRun(run);
        try {
            String text = normaliseWhitespace(extract(run.filename(), run.format(), bytes));
            if (text.isBlank()) {
                throw new DocQaException(ErrorKind.EXTRACTION, "No text could be extracted from " + run.filename());
            }
            List<TextChunk> chunks = textChunker.chunk(text);
            if (chunks.isEmpty()) {
                throw new DocQaException(ErrorKind.EXTRACTION, "No content chunks were produced for " + run.filename());
            }
            EmbeddingsClient.EmbeddingBatch embeddings = embeddingService.embedAll(chunks.stream().map(TextChunk::text).toList());

            List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                TextChunk chunk = chunks.get(i);
                indexed.add(new IndexedChunk(
                        IndexedChunk.chunkId(run.documentId(), chunk.sequenceIndex()),
                        run.documentId(),
                        run.filename(),
                        chunk.sequenceIndex(),
                        chunk.start(),
                        chunk.end(),
                        chunk.text(),
                        embeddings.vectors().get(i),
                        pending.accessTags()));
            }
            vectorIndex.replaceDocument(run.documentId(), indexed);
            DocumentSummary committed = catalog.markIndexed(run.documentId(), indexed.size());
            indexedCounter.increment();
            log.info("Indexed document {} ({}) for owner {} with {} chunks (version {})",
                    committed.id(), committed.filename(), committed.ownerId(), committed.chunkCount(), committed.version());
            return new SubmitDocumentResponse(committed.id(), committed.filename(), committed.status(), committed.chunkCount(), committed.version(), false);
        } catch (RuntimeException ex) {
            vectorIndex.delete(run.documentId());
            try {
                catalog.markFailed(run.documentId(), ex.getMessage());
            } catch (RuntimeException markError) {
                // the run's own failure is what the uploader needs to see
                ex.addSuppressed(markError);
                log.warn("Could not record failure of document {}: {}", run.documentId(), markError.getMessage());
            }
            failedCounter.increment();
            log.warn("Indexing of document {} ({}) failed: {}", run.documentId(), run.filename(), ex.getMessage());
            throw ex instanceof DocQaException ? ex : new DocQaException(ErrorKind.EXTRACTION, "Failed to index document " + run.filename(), ex);
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    private String extract(String filename, DocumentFormat format, byte[] bytes) {
        return Mono.fromCallable(() -> {
                    try (InputStream inputStream = new ByteArrayInputStream(bytes)) {
                        return textExtractor.extract(filename, format, inputStream);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(extractionTimeout)
                .onErrorMap(TimeoutException.class, ex -> new DocQaException(ErrorKind.EXTRACTION,
                        "Text extraction timed out for " + filename, ex))
                .onErrorMap(IOException.class, ex -> new DocQaException(ErrorKind.EXTRACTION,
                        "Failed to read " + filename, ex))
                .block();
    }

    static String normaliseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        String unified = value.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder builder = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            builder.append(HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").trim()).append('\n');
        }
        return EXCESS_BLANK_LINES.matcher(builder).replaceAll("\n\n").trim();
    }

    private String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(bytes);
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
