package com.privatedocs.qa.model;

import java.time.OffsetDateTime;
import java.util.Set;

public record DocumentSummary(String id,
                              String filename,
                              DocumentFormat format,
                              long sizeBytes,
                              String ownerId,
                              Set<String> accessTags,
                              DocumentStatus status,
                              OffsetDateTime indexedAt,
                              int version,
                              int chunkCount,
                              String failureReason) {
}
