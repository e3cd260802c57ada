package com.atrium.workspace.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Test
    @DisplayName("generates a correlation ID when none is provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates the caller's correlation ID")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an oversized correlation ID")
    void replacesOversized() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "x".repeat(500));
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).hasSizeLessThan(500);
    }

    @Test
    @DisplayName("exposes the ID in the MDC while the chain runs and clears it afterwards")
    void mdcLifecycle() throws Exception {
        var captured = new AtomicReference<String>();
        FilterChain chain = (req, resp) -> captured.set(MDC.get(CorrelationIdFilter.MDC_KEY));
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(captured.get()).isEqualTo("during-chain-123");
        assertThat(MDC.get(CorrelationIdFilter.MDC_KEY)).isNull();
    }
}
