package com.privatedocs.qa.model;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(@NotBlank String question,
                           String documentId) {
}
