package com.aura.backend.config;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void callerIdsAreEchoedAndVisibleInMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/predictions/run");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-42");
        request.addHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER, "batch-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get("requestId") + "/" + MDC.get("correlationId"));
            }
        });

        assertThat(seen.get()).isEqualTo("req-42/batch-7");
        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void unsafeIdsAreReplacedAndCorrelationDefaultsToRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/predictions/current");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "bad id\nforged log line");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String requestId = response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER);
        assertThat(requestId).isNotBlank().doesNotContain("forged");
        assertThat(response.getHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER)).isEqualTo(requestId);
    }
}
