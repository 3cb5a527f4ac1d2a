package com.adobe.daiji.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestLoggingInterceptor Tests")
class RequestLoggingInterceptorTest {

    private RequestLoggingInterceptor interceptor;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        interceptor = new RequestLoggingInterceptor(new RateLimitConfig(100, 100, List.of()));
        request = new MockHttpServletRequest("GET", "/daiji");
        request.setQueryString("query=12345");
        response = new MockHttpServletResponse();
    }

    @Test
    @DisplayName("preHandle records the start time and lets the request through")
    void shouldRecordStartTime() {
        assertTrue(interceptor.preHandle(request, response, new Object()));
        assertTrue(Collections.list(request.getAttributeNames()).stream()
            .anyMatch(name -> name.startsWith(RequestLoggingInterceptor.class.getName())));
    }

    @Test
    @DisplayName("afterCompletion tolerates a missing start time and a failed request")
    void shouldLogWithoutStartTime() {
        response.setStatus(400);

        assertDoesNotThrow(() ->
            interceptor.afterCompletion(request, response, new Object(), new IllegalStateException("boom")));
    }
}
