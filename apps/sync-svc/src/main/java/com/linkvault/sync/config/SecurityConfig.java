package com.linkvault.sync.config;

import com.linkvault.sync.security.AuthenticatedUserProvider;
import com.linkvault.sync.security.JsonAuthErrorHandlers;
import com.linkvault.sync.security.TraceIdFilter;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {
    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            TraceIdFilter traceIdFilter,
            JsonAuthErrorHandlers jsonAuthErrorHandlers
    ) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> {})
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(registry -> registry
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/healthz").permitAll()
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                )
                .oauth2ResourceServer(resource -> resource
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                        .jwt(jwt -> {})
                );

        http.addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    /**
     * Bearer tokens are minted by the external identity provider with a shared HS256 secret. Tokens whose subject
     * is not a user id are rejected here, before any controller runs.
     */
    @Bean
    JwtDecoder jwtDecoder(LinkvaultProperties properties, Environment environment) {
        String secret;
        if (properties.security().hasDevJwtSecret()) {
            secret = properties.security().devJwtSecret();
        } else if (environment.acceptsProfiles(Profiles.of("test"))) {
            log.warn("Security: generating ephemeral test JWT secret (no linkvault.security.dev-jwt-secret provided)");
            secret = UUID.randomUUID().toString().replace("-", "");
        } else {
            throw new IllegalStateException("linkvault.security.dev-jwt-secret must be configured");
        }
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefault(),
                new JwtClaimValidator<String>(JwtClaimNames.SUB, AuthenticatedUserProvider::isOwnerId)
        ));
        return decoder;
    }
}
