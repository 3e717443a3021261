package com.privatedocs.qa.model;

import jakarta.validation.constraints.NotNull;

import java.util.Set;

public record AccessTagsRequest(@NotNull Set<String> accessTags) {
}
