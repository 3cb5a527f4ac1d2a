package com.adobe.daiji.filter;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CorrelationIdFilter}.
 */
@DisplayName("CorrelationIdFilter Unit Tests")
class CorrelationIdFilterTest {

    private CorrelationIdFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new CorrelationIdFilter();
        request = new MockHttpServletRequest("GET", "/daiji");
        response = new MockHttpServletResponse();
    }

    @Test
    @DisplayName("Generates an ID, exposes it in the MDC and clears it afterwards")
    void shouldGenerateCorrelationId() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));

        filter.doFilter(request, response, chain);

        String header = response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertNotNull(header);
        assertEquals(8, header.length());
        assertEquals(header, seen.get());
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Reuses a well-formed caller ID")
    void shouldReuseSuppliedId() throws Exception {
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-42.a_b");

        filter.doFilter(request, response, (req, res) -> { });

        assertEquals("req-42.a_b", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("Replaces IDs that are not plain tokens")
    void shouldReplaceUnsafeIds() {
        assertNotEquals("bad id\nINJECTED", CorrelationIdFilter.resolveCorrelationId("bad id\nINJECTED"));
        assertEquals(8, CorrelationIdFilter.resolveCorrelationId("x".repeat(65)).length());
        assertEquals(8, CorrelationIdFilter.resolveCorrelationId("").length());
    }

    @Test
    @DisplayName("MDC is cleared even when the chain throws")
    void shouldClearMdcOnFailure() {
        FilterChain failing = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class, () -> filter.doFilter(request, response, failing));
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
    }
}
