package com.linkvault.sync.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a trace id taken from {@value #TRACE_HEADER} or freshly generated. The id lands in the
 * logging MDC, in error bodies and on the response. Inbound ids that could corrupt log lines are replaced.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String MDC_KEY = "trace_id";
    public static final String USER_MDC_KEY = "user_id";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        RequestContextHolder.set(RequestContextHolder.RequestContext.ofTrace(traceId));
        MDC.put(MDC_KEY, traceId);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(USER_MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String inbound) {
        if (inbound != null && ACCEPTED_TRACE_ID.matcher(inbound).matches()) {
            return inbound;
        }
        return UUID.randomUUID().toString().replace("-", "");
    }
}
