package com.privatedocs.qa.controller;

import com.privatedocs.qa.config.WorkerPoolConfig;
import com.privatedocs.qa.model.AccessTagsRequest;
import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.IndexStats;
import com.privatedocs.qa.model.SubmitDocumentResponse;
import com.privatedocs.qa.security.CallerIdentityResolver;
import com.privatedocs.qa.security.JwtRoleConverter;
import com.privatedocs.qa.security.SecurityConfig;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.catalog.DocumentService;
import com.privatedocs.qa.service.ingestion.IngestionService;
import com.privatedocs.qa.service.ingestion.SubmitDocumentCommand;
import com.privatedocs.qa.service.ingestion.UploadProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.http.MediaType.MULTIPART_FORM_DATA;

@WebFluxTest(controllers = {DocumentController.class, IndexController.class})
@Import({SecurityConfig.class, JwtRoleConverter.class, CallerIdentityResolver.class, WorkerPoolConfig.class})
@TestPropertySource(properties = {
        "docqa.security.static-token=test-token",
        "docqa.security.static-caller-id=alice",
        "docqa.security.static-tags=hr",
        "docqa.upload.max-file-size-bytes=64"
})
class DocumentControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private IngestionService ingestionService;

    @MockBean
    private DocumentService documentService;

    @Test
    void uploadPassesFileFormatAndTagsToIngestion() {
        Mockito.when(ingestionService.submitDocument(any()))
                .thenReturn(new SubmitDocumentResponse("doc-1", "Policy.txt", DocumentStatus.INDEXED, 1, 1, false));

        webTestClient.post()
                .uri("/api/documents")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("Policy.txt", "Employees receive 25 days.")))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.documentId").isEqualTo("doc-1")
                .jsonPath("$.status").isEqualTo("INDEXED");

        ArgumentCaptor<SubmitDocumentCommand> command = ArgumentCaptor.forClass(SubmitDocumentCommand.class);
        Mockito.verify(ingestionService).submitDocument(command.capture());
        assertThat(command.getValue().ownerId()).isEqualTo("alice");
        assertThat(command.getValue().filename()).isEqualTo("Policy.txt");
        assertThat(command.getValue().declaredFormat()).isEqualTo("txt");
        assertThat(command.getValue().accessTags()).containsExactly("hr", "finance");
        assertThat(new String(command.getValue().bytes(), StandardCharsets.UTF_8)).isEqualTo("Employees receive 25 days.");
    }

    @Test
    void deduplicatedUploadReturnsOk() {
        Mockito.when(ingestionService.submitDocument(any()))
                .thenReturn(new SubmitDocumentResponse("doc-1", "Policy.txt", DocumentStatus.INDEXED, 1, 1, true));

        webTestClient.post()
                .uri("/api/documents")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("Policy.txt", "Employees receive 25 days.")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deduplicated").isEqualTo(true);
    }

    @Test
    void oversizedUploadIsRejected() {
        webTestClient.post()
                .uri("/api/documents")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("Big.txt", "x".repeat(200))))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION");

        Mockito.verifyNoInteractions(ingestionService);
    }

    @Test
    void extractionFailureMapsToUnprocessableEntity() {
        Mockito.when(ingestionService.submitDocument(any()))
                .thenThrow(new DocQaException(ErrorKind.EXTRACTION, "No text could be extracted from Policy.txt"));

        webTestClient.post()
                .uri("/api/documents")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("Policy.txt", "Employees receive 25 days.")))
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("EXTRACTION");
    }

    @Test
    void listReturnsVisibleDocuments() {
        Mockito.when(documentService.listDocuments(any())).thenReturn(List.of(new DocumentSummary("doc-1", "Policy.txt",
                DocumentFormat.TXT, 26L, "alice", Set.of("hr"), DocumentStatus.INDEXED, null, 1, 1, null)));

        webTestClient.get()
                .uri("/api/documents")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].filename").isEqualTo("Policy.txt")
                .jsonPath("$[0].accessTags[0]").isEqualTo("hr");
    }

    @Test
    void deleteReturnsNoContentAndDeniedDeleteReturnsForbidden() {
        webTestClient.delete()
                .uri("/api/documents/doc-1")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isNoContent();

        Mockito.doThrow(new DocQaException(ErrorKind.PERMISSION_DENIED, "You do not have access to document doc-2"))
                .when(documentService).deleteDocument(eq("doc-2"), any());

        webTestClient.delete()
                .uri("/api/documents/doc-2")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void updateTagsDelegatesToService() {
        Mockito.when(documentService.updateAccessTags(eq("doc-1"), anySet(), any())).thenReturn(new DocumentSummary("doc-1",
                "Policy.txt", DocumentFormat.TXT, 26L, "alice", Set.of("finance"), DocumentStatus.INDEXED, null, 1, 1, null));

        webTestClient.put()
                .uri("/api/documents/doc-1/tags")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new AccessTagsRequest(Set.of("finance")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.accessTags[0]").isEqualTo("finance");
    }

    @Test
    void statsAndClearUseDocumentService() {
        Mockito.when(documentService.getStats()).thenReturn(new IndexStats(2, 1, 5, "hashing-256", "template-extractive"));
        Mockito.when(documentService.clearIndex(any()))
                .thenThrow(new DocQaException(ErrorKind.PERMISSION_DENIED, "Only administrators may clear the index"));

        webTestClient.get()
                .uri("/api/index/stats")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalChunks").isEqualTo(5)
                .jsonPath("$.embeddingModel").isEqualTo("hashing-256");

        webTestClient.post()
                .uri("/api/index/clear")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isForbidden();
    }

    private MultiValueMap<String, Object> multipart(String filename, String content) {
        ByteArrayResource file = new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return filename;
            }
        };

        LinkedMultiValueMap<String, Object> data = new LinkedMultiValueMap<>();
        data.add("file", file);
        data.add("format", "txt");
        data.add("accessTags", "hr, finance");
        return data;
    }

    @TestConfiguration
    @EnableConfigurationProperties(UploadProperties.class)
    static class UploadPropertiesConfig {
    }
}
