package com.privatedocs.qa.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.privatedocs.qa.service.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.authentication.ReactiveJwtAuthenticationConverterAdapter;
import org.springframework.security.oauth2.server.resource.web.server.authentication.ServerBearerTokenAuthenticationConverter;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;
import org.springframework.security.web.server.authentication.ServerAuthenticationEntryPointFailureHandler;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Every API call needs a bearer token. When {@code docqa.security.static-token} is set it is the only accepted token,
 * otherwise tokens are validated as JWTs against the configured key set.
 */
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(SecurityProperties.class)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private final JwtRoleConverter roleConverter;
    private final SecurityProperties securityProperties;
    private final ObjectMapper objectMapper;

    public SecurityConfig(JwtRoleConverter roleConverter, SecurityProperties securityProperties, ObjectMapper objectMapper) {
        this.roleConverter = roleConverter;
        this.securityProperties = securityProperties;
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        ServerAuthenticationEntryPoint entryPoint = (exchange, ex) ->
                writeError(exchange.getResponse(), ErrorKind.UNAUTHENTICATED, "A valid bearer token is required");
        ServerAccessDeniedHandler accessDenied = (exchange, ex) ->
                writeError(exchange.getResponse(), ErrorKind.PERMISSION_DENIED, "Access denied");

        http.csrf(ServerHttpSecurity.CsrfSpec::disable)
                .cors(Customizer.withDefaults())
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(entryPoint)
                        .accessDeniedHandler(accessDenied))
                .authorizeExchange(exchanges -> exchanges
                        .pathMatchers("/actuator/health/**", "/actuator/info").permitAll()
                        .anyExchange().authenticated());

        if (securityProperties.hasStaticToken()) {
            log.info("Static bearer token authentication enabled for caller {}", securityProperties.getStaticCallerId());
            AuthenticationWebFilter staticToken = new AuthenticationWebFilter(new StaticTokenAuthenticationManager(securityProperties));
            staticToken.setServerAuthenticationConverter(new ServerBearerTokenAuthenticationConverter());
            staticToken.setRequiresAuthenticationMatcher(ServerWebExchangeMatchers.anyExchange());
            staticToken.setSecurityContextRepository(NoOpServerSecurityContextRepository.getInstance());
            staticToken.setAuthenticationFailureHandler(new ServerAuthenticationEntryPointFailureHandler(entryPoint));
            http.addFilterAt(staticToken, SecurityWebFiltersOrder.AUTHENTICATION);
            return http.build();
        }

        JwtAuthenticationConverter jwtConverter = new JwtAuthenticationConverter();
        jwtConverter.setJwtGrantedAuthoritiesConverter(roleConverter);
        jwtConverter.setPrincipalClaimName(securityProperties.getPrincipalClaim());
        return http
                .oauth2ResourceServer(resourceServer -> resourceServer
                        .authenticationEntryPoint(entryPoint)
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(new ReactiveJwtAuthenticationConverterAdapter(jwtConverter))))
                .build();
    }

    private Mono<Void> writeError(ServerHttpResponse response, ErrorKind kind, String message) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(Map.of("error", message, "kind", kind.name()));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.setStatusCode(kind.status());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }
}
