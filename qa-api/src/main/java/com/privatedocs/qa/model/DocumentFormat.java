package com.privatedocs.qa.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
    PDF("pdf", "application/pdf"),
    DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    TXT("txt", "text/plain"),
    MD("md", "text/markdown");

    private final String extension;
    private final String mediaType;

    DocumentFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public static Optional<DocumentFormat> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        if (normalised.startsWith(".")) {
            normalised = normalised.substring(1);
        }
        String candidate = normalised;
        return Arrays.stream(values())
                .filter(format -> format.extension.equals(candidate) || format.mediaType.equals(candidate))
                .findFirst();
    }
}
