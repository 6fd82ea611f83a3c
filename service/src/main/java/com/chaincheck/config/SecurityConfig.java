package com.chaincheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;

/**
 * HTTP exposure of the service.
 *
 * <ul>
 *   <li>{@code /api/v1/deliveries/**} - delivery registration, verification and payment</li>
 *   <li>{@code /api/v1/proofs/**} - proof lookup, witness chain and location consensus</li>
 *   <li>{@code /actuator/health/**} - liveness and readiness</li>
 *   <li>OpenAPI document and Swagger UI - {@code dev} profile only</li>
 * </ul>
 *
 * <p>Everything else, other actuator endpoints included, is denied. Callers are not
 * authenticated; the service is expected to sit behind a gateway.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String[] API_ROUTES = {"/api/v1/deliveries/**", "/api/v1/proofs/**"};
    static final String[] API_DOC_ROUTES = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    private final Environment environment;

    public SecurityConfig(Environment environment) {
        this.environment = environment;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        boolean apiDocsExposed = environment.acceptsProfiles(Profiles.of("dev"));
        return http
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(API_ROUTES).permitAll();
                    auth.requestMatchers("/actuator/health/**", "/actuator/health").permitAll();
                    auth.requestMatchers("/error").permitAll();
                    if (apiDocsExposed) {
                        auth.requestMatchers(API_DOC_ROUTES).permitAll();
                    }
                    auth.anyRequest().denyAll();
                })
                .csrf(AbstractHttpConfigurer::disable)
                .build();
    }
}
