package com.linkvault.sync.security;

import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * The owner of every connection, snapshot and transaction is the bearer token subject, which the identity
 * provider issues as a UUID.
 */
@Component
public class AuthenticatedUserProvider {

    /**
     * @throws InvalidBearerTokenException when the request carries no JWT or its subject is not an owner id
     */
    public UUID requireCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken jwtAuthentication)) {
            throw new InvalidBearerTokenException("bearer token required");
        }
        String subject = jwtAuthentication.getToken().getSubject();
        if (!isOwnerId(subject)) {
            throw new InvalidBearerTokenException("token subject is not a user id");
        }
        UUID ownerId = UUID.fromString(subject);
        RequestContextHolder.setUserId(ownerId);
        MDC.put(TraceIdFilter.USER_MDC_KEY, ownerId.toString());
        return ownerId;
    }

    public static boolean isOwnerId(String subject) {
        if (subject == null || subject.length() != 36) {
            return false;
        }
        try {
            return UUID.fromString(subject).toString().equalsIgnoreCase(subject);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
