package com.privatedocs.qa.service.ingestion;

import java.util.Set;

public record SubmitDocumentCommand(byte[] bytes,
                                   String filename,
                                   String declaredFormat,
                                   String ownerId,
                                   Set<String> accessTags) {
}
