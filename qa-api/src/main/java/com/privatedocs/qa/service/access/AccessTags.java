package com.privatedocs.qa.service.access;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public final class AccessTags {

    private AccessTags() {
    }

    public static SortedSet<String> normalise(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptySortedSet();
        }
        TreeSet<String> cleaned = new TreeSet<>();
        tags.stream()
                .filter(Objects::nonNull)
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .filter(tag -> !tag.isEmpty())
                .forEach(cleaned::add);
        return Collections.unmodifiableSortedSet(cleaned);
    }
}
