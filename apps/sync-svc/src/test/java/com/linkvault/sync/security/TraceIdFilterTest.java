package com.linkvault.sync.security;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void keepsWellFormedInboundTraceIdForTheWholeRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/accounts");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "web-7f3a.2");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        AtomicReference<String> seenInContext = new AtomicReference<>();

        FilterChain chain = (req, res) -> {
            seenInMdc.set(MDC.get(TraceIdFilter.MDC_KEY));
            seenInContext.set(RequestContextHolder.currentTraceId());
        };

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("web-7f3a.2");
        assertThat(seenInMdc.get()).isEqualTo("web-7f3a.2");
        assertThat(seenInContext.get()).isEqualTo("web-7f3a.2");
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
        assertThat(RequestContextHolder.currentTraceId()).isNull();
    }

    @Test
    void replacesMissingOrUnsafeTraceIds() {
        assertThat(TraceIdFilter.resolveTraceId(null)).matches("[0-9a-f]{32}");
        assertThat(TraceIdFilter.resolveTraceId("")).matches("[0-9a-f]{32}");
        assertThat(TraceIdFilter.resolveTraceId("abc\nlevel=ERROR forged")).matches("[0-9a-f]{32}");
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).matches("[0-9a-f]{32}");
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(64))).isEqualTo("x".repeat(64));
    }
}
