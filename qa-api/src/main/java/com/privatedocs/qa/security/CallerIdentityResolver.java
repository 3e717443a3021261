package com.privatedocs.qa.security;

import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.CallerIdentity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the authenticated principal into the identity the access filter works with. Role names double as access tags.
 */
@Component
public class CallerIdentityResolver {

    private final String adminRole;

    public CallerIdentityResolver(@Value("${docqa.access.admin-role:admin}") String adminRole) {
        this.adminRole = adminRole.trim().toLowerCase(Locale.ROOT);
    }

    public CallerIdentity resolve(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()
                || authentication.getName() == null || authentication.getName().isBlank()) {
            throw new DocQaException(ErrorKind.UNAUTHENTICATED, "Caller identity is required");
        }
        Set<String> roles = new HashSet<>();
        Set<String> tags = new HashSet<>();
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String value = authority.getAuthority();
            if (value == null) {
                continue;
            }
            if (value.startsWith(Authorities.ROLE_PREFIX)) {
                roles.add(value.substring(Authorities.ROLE_PREFIX.length()).toLowerCase(Locale.ROOT));
            } else if (value.startsWith(Authorities.TAG_PREFIX)) {
                tags.add(value.substring(Authorities.TAG_PREFIX.length()));
            }
        }
        tags.addAll(roles);
        return new CallerIdentity(authentication.getName(), tags, roles.contains(adminRole));
    }
}
