package com.privatedocs.qa.controller;

import com.privatedocs.qa.model.AccessTagsRequest;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.SubmitDocumentResponse;
import com.privatedocs.qa.security.CallerIdentityResolver;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.catalog.DocumentService;
import com.privatedocs.qa.service.ingestion.IngestionService;
import com.privatedocs.qa.service.ingestion.SubmitDocumentCommand;
import com.privatedocs.qa.service.ingestion.UploadProperties;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.security.core.Authentication;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final IngestionService ingestionService;
    private final DocumentService documentService;
    private final CallerIdentityResolver identityResolver;
    private final UploadProperties uploadProperties;
    private final Scheduler workerScheduler;

    public DocumentController(IngestionService ingestionService,
                              DocumentService documentService,
                              CallerIdentityResolver identityResolver,
                              UploadProperties uploadProperties,
                              @Qualifier("qaWorkerScheduler") Scheduler workerScheduler) {
        this.ingestionService = ingestionService;
        this.documentService = documentService;
        this.identityResolver = identityResolver;
        this.uploadProperties = uploadProperties;
        this.workerScheduler = workerScheduler;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<SubmitDocumentResponse>> upload(ServerWebExchange exchange, Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return exchange.getMultipartData()
                .flatMap(parts -> {
                    Part part = parts.getFirst("file");
                    if (!(part instanceof FilePart file)) {
                        return Mono.error(new DocQaException(ErrorKind.VALIDATION, "File payload is required"));
                    }
                    String format = formValue(parts, "format");
                    Set<String> accessTags = formValues(parts, "accessTags");
                    return readBytes(file).flatMap(bytes -> Mono.fromCallable(() -> ingestionService.submitDocument(
                                    new SubmitDocumentCommand(bytes, file.filename(), format, caller.callerId(), accessTags)))
                            .subscribeOn(workerScheduler));
                })
                .map(response -> ResponseEntity.status(response.deduplicated() ? HttpStatus.OK : HttpStatus.CREATED).body(response));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentSummary>> list(Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromCallable(() -> documentService.listDocuments(caller))
                .subscribeOn(workerScheduler);
    }

    @DeleteMapping("/{documentId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String documentId, Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromRunnable(() -> documentService.deleteDocument(documentId, caller))
                .subscribeOn(workerScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PutMapping(path = "/{documentId}/tags", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentSummary> updateTags(@PathVariable String documentId,
                                            @Valid @RequestBody AccessTagsRequest request,
                                            Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromCallable(() -> documentService.updateAccessTags(documentId, request.accessTags(), caller))
                .subscribeOn(workerScheduler);
    }

    private Mono<byte[]> readBytes(FilePart file) {
        long limit = uploadProperties.getMaxFileSizeBytes();
        int maxBytes = (int) Math.min(Integer.MAX_VALUE - 1L, limit);
        return DataBufferUtils.join(file.content(), maxBytes)
                .map(buffer -> {
                    try {
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty(new byte[0])
                .onErrorMap(DataBufferLimitException.class, ex -> new DocQaException(ErrorKind.VALIDATION, String.format(Locale.ROOT,
                        "File exceeds the maximum size of %d bytes", limit), ex));
    }

    private static String formValue(MultiValueMap<String, Part> parts, String name) {
        Part part = parts.getFirst(name);
        return part instanceof FormFieldPart field && !field.value().isBlank() ? field.value().trim() : null;
    }

    private static Set<String> formValues(MultiValueMap<String, Part> parts, String name) {
        List<Part> values = parts.getOrDefault(name, List.of());
        Set<String> result = new LinkedHashSet<>();
        for (Part part : values) {
            if (part instanceof FormFieldPart field) {
                Arrays.stream(field.value().split(","))
                        .map(String::trim)
                        .filter(value -> !value.isEmpty())
                        .forEach(result::add);
            }
        }
        return result;
    }
}
