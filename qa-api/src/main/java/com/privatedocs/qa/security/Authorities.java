package com.privatedocs.qa.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

final class Authorities {

    static final String ROLE_PREFIX = "ROLE_";
    static final String TAG_PREFIX = "TAG_";

    private Authorities() {
    }

    static Set<GrantedAuthority> of(Collection<String> roles, Collection<String> tags) {
        Set<GrantedAuthority> authorities = new LinkedHashSet<>();
        if (roles != null) {
            roles.stream()
                    .filter(role -> role != null && !role.isBlank())
                    .map(role -> role.startsWith(ROLE_PREFIX) ? role : ROLE_PREFIX + role)
                    .map(SimpleGrantedAuthority::new)
                    .forEach(authorities::add);
        }
        if (tags != null) {
            tags.stream()
                    .filter(tag -> tag != null && !tag.isBlank())
                    .map(tag -> tag.startsWith(TAG_PREFIX) ? tag : TAG_PREFIX + tag)
                    .map(SimpleGrantedAuthority::new)
                    .forEach(authorities::add);
        }
        return authorities;
    }
}
