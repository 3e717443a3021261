package com.privatedocs.qa.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Single shared bearer token for deployments without an identity provider. Every request authenticated this way
 * acts as the one configured caller.
 */
class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    private static final Logger log = LoggerFactory.getLogger(StaticTokenAuthenticationManager.class);

    private final byte[] expectedToken;
    private final String callerId;
    private final Set<GrantedAuthority> authorities;

    StaticTokenAuthenticationManager(SecurityProperties properties) {
        this.expectedToken = properties.getStaticToken().getBytes(StandardCharsets.UTF_8);
        this.callerId = properties.getStaticCallerId();
        this.authorities = Authorities.of(properties.getStaticRoles(), properties.getStaticTags());
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        return Mono.justOrEmpty(authentication)
                .filter(BearerTokenAuthenticationToken.class::isInstance)
                .cast(BearerTokenAuthenticationToken.class)
                .filter(bearer -> matches(bearer.getToken()))
                .<Authentication>map(bearer -> UsernamePasswordAuthenticationToken.authenticated(callerId, null, authorities))
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Rejected static bearer token");
                    return Mono.error(new BadCredentialsException("Invalid bearer token"));
                }));
    }

    private boolean matches(String presented) {
        return presented != null && MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expectedToken);
    }
}
