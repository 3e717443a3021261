package com.privatedocs.qa.model;

public record SubmitDocumentResponse(String documentId,
                                     String filename,
                                     DocumentStatus status,
                                     int chunks,
                                     int version,
                                     boolean deduplicated) {
}
