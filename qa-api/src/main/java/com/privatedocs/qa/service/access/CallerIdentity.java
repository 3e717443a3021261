package com.privatedocs.qa.service.access;

import java.util.Objects;
import java.util.Set;

public record CallerIdentity(String callerId, Set<String> grantedTags, boolean admin) {

    public CallerIdentity {
        Objects.requireNonNull(callerId, "callerId");
        grantedTags = AccessTags.normalise(grantedTags);
    }

    public static CallerIdentity user(String callerId, Set<String> grantedTags) {
        return new CallerIdentity(callerId, grantedTags, false);
    }

    public static CallerIdentity admin(String callerId) {
        return new CallerIdentity(callerId, Set.of(), true);
    }
}
