package com.privatedocs.qa.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Maps the configured roles claim to {@code ROLE_} authorities and the tags claim to {@code TAG_} authorities.
 * Identity providers differ on claim shape, so both JSON arrays and delimited strings are accepted.
 */
@Component
public class JwtRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    private final SecurityProperties properties;

    public JwtRoleConverter(SecurityProperties properties) {
        this.properties = properties;
    }

    @Override
    public Collection<GrantedAuthority> convert(Jwt jwt) {
        return Authorities.of(claimValues(jwt, properties.getRolesClaim()), claimValues(jwt, properties.getTagsClaim()));
    }

    static List<String> claimValues(Jwt jwt, String claim) {
        Object value = jwt.getClaims().get(claim);
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).map(String::trim).toList();
        }
        if (value instanceof String delimited) {
            return Arrays.stream(delimited.split("[,\\s]+")).filter(part -> !part.isBlank()).toList();
        }
        return List.of();
    }
}
