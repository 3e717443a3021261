package com.privatedocs.qa.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class WorkerPoolConfig {

    // Blocking pipeline work runs here; a full queue rejects the task instead of waiting.
    @Bean(destroyMethod = "dispose")
    public Scheduler qaWorkerScheduler(@Value("${docqa.workers.threads:8}") int threads,
                                       @Value("${docqa.workers.queue-capacity:100}") int queueCapacity) {
        return Schedulers.newBoundedElastic(Math.max(1, threads), Math.max(1, queueCapacity), "qa-worker");
    }
}
