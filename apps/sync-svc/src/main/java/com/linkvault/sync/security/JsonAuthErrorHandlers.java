package com.linkvault.sync.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Writes 401 / 403 responses with the same JSON envelope the API uses for every other error.
 */
@Component
public class JsonAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthErrorHandlers.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        writeJson(response, 401, authException, request, "UNAUTHORIZED");
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        writeJson(response, 403, accessDeniedException, request, "FORBIDDEN");
    }

    private void writeJson(HttpServletResponse response, int status, Exception ex, HttpServletRequest request, String code) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");

        String traceId = RequestContextHolder.currentTraceId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", request.getRequestURI());
        details.put("timestamp", Instant.now().toString());
        if (ex instanceof OAuth2AuthenticationException oauthEx && oauthEx.getError() != null) {
            details.put("oauth2ErrorCode", oauthEx.getError().getErrorCode());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", ex.getMessage());
        body.put("details", details);
        body.put("traceId", traceId);

        log.warn("Auth failure status={} code={} path={} traceId={}", status, code, request.getRequestURI(), traceId);
        mapper.writeValue(response.getOutputStream(), body);
    }
}
