package com.privatedocs.qa.security;

import com.privatedocs.qa.config.WorkerPoolConfig;
import com.privatedocs.qa.controller.QaController;
import com.privatedocs.qa.model.QueryOutcome;
import com.privatedocs.qa.model.QueryRequest;
import com.privatedocs.qa.model.QueryResult;
import com.privatedocs.qa.model.QuestionType;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.qa.QueryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;

@WebFluxTest(controllers = QaController.class)
@Import({SecurityConfig.class, JwtRoleConverter.class, CallerIdentityResolver.class, WorkerPoolConfig.class})
@TestPropertySource(properties = {
        "docqa.security.static-token=test-token",
        "docqa.security.static-caller-id=carol",
        "docqa.security.static-tags=HR,finance",
        "docqa.security.static-roles=auditor"
})
class StaticTokenSecurityIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private QueryService queryService;

    @Test
    void rejectsQuestionWithoutToken() {
        webTestClient.post()
                .uri("/api/qa/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many leave days?", null))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("UNAUTHENTICATED");
    }

    @Test
    void rejectsQuestionWithWrongToken() {
        webTestClient.post()
                .uri("/api/qa/ask")
                .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many leave days?", null))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void configuredTokenResolvesCallerIdentity() {
        Mockito.when(queryService.ask(anyString(), isNull(), any()))
                .thenReturn(QueryOutcome.insufficientEvidence(QueryResult.insufficientEvidence(QuestionType.SPECIFIC)));

        webTestClient.post()
                .uri("/api/qa/ask")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many leave days?", null))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("INSUFFICIENT_EVIDENCE")
                .jsonPath("$.result.insufficientEvidence").isEqualTo(true);

        ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
        Mockito.verify(queryService).ask(Mockito.eq("How many leave days?"), isNull(), caller.capture());
        assertThat(caller.getValue().callerId()).isEqualTo("carol");
        assertThat(caller.getValue().grantedTags()).containsExactly("auditor", "finance", "hr");
        assertThat(caller.getValue().admin()).isFalse();
    }
}
