package com.privatedocs.qa.controller;

import com.privatedocs.qa.model.IndexStats;
import com.privatedocs.qa.security.CallerIdentityResolver;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.catalog.DocumentService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Map;

@RestController
@RequestMapping("/api/index")
public class IndexController {

    private final DocumentService documentService;
    private final CallerIdentityResolver identityResolver;
    private final Scheduler workerScheduler;

    public IndexController(DocumentService documentService,
                           CallerIdentityResolver identityResolver,
                           @Qualifier("qaWorkerScheduler") Scheduler workerScheduler) {
        this.documentService = documentService;
        this.identityResolver = identityResolver;
        this.workerScheduler = workerScheduler;
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IndexStats> stats() {
        return Mono.fromCallable(documentService::getStats)
                .subscribeOn(workerScheduler);
    }

    @PostMapping(path = "/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Long>> clear(Authentication authentication) {
        CallerIdentity caller = identityResolver.resolve(authentication);
        return Mono.fromCallable(() -> Map.of("removed", documentService.clearIndex(caller)))
                .subscribeOn(workerScheduler);
    }
}
