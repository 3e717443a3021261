package com.privatedocs.qa.controller;

import com.privatedocs.qa.model.BatchQueryRequest;
import com.privatedocs.qa.model.QueryOutcome;
import com.privatedocs.qa.model.QueryRequest;
import com.privatedocs.qa.security.CallerIdentityResolver;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.qa.QueryService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/qa")
public class QaController {

    private final QueryService queryService;
    private final CallerIdentityResolver identityResolver;
    private final Scheduler workerScheduler;

    public QaController(QueryService queryService,
                        CallerIdentityResolver identityResolver,
                        @Qualifier("qaWorkerScheduler") Scheduler workerScheduler) {
        this.queryService = queryService;
        this.identityResolver = identityResolver;
        this.workerScheduler = workerScheduler;
    }

    @PostMapping(path = "/ask", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<QueryOutcome>> ask(@Valid @RequestBody QueryRequest request, Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromCallable(() -> queryService.ask(request.question(), request.documentId(), caller))
                .subscribeOn(workerScheduler)
                .map(QaController::toResponse);
    }

    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<QueryOutcome>> batch(@Valid @RequestBody BatchQueryRequest request, Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromCallable(() -> queryService.askBatch(request.questions(), caller))
                .subscribeOn(workerScheduler);
    }

    @GetMapping(path = "/suggestions", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> suggestions(@RequestParam(value = "topic", required = false) String topic) {
        return queryService.suggestions(topic);
    }

    static ResponseEntity<QueryOutcome> toResponse(QueryOutcome outcome) {
        HttpStatus status = outcome.failed() ? outcome.errorKind().status() : HttpStatus.OK;
        return ResponseEntity.status(status).body(outcome);
    }
}
