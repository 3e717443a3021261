package com.privatedocs.qa.model;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchQueryRequest(@NotEmpty List<String> questions) {
}
