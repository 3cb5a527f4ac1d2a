package com.adobe.daiji.config;

import com.adobe.daiji.filter.ClientAddress;
import com.adobe.daiji.filter.CorrelationIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.concurrent.TimeUnit;

/**
 * Writes one access line per handled request to the {@code http.request} logger:
 * method, path with query, status, duration, client address and correlation ID.
 * Client errors and failures are logged at WARN.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger("http.request");
    private static final String START_NANOS_ATTR = RequestLoggingInterceptor.class.getName() + ".start";

    private final RateLimitConfig rateLimitConfig;

    public RequestLoggingInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_NANOS_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_NANOS_ATTR);
        long durationMillis = start instanceof Long
            ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - (Long) start)
            : 0;

        String query = request.getQueryString();
        String path = query != null ? request.getRequestURI() + "?" + query : request.getRequestURI();
        int status = response.getStatus();
        String client = ClientAddress.of(request, rateLimitConfig.getTrustedProxies());

        if (status >= 400 || ex != null) {
            log.warn("method={} path={} status={} duration={}ms client={} correlationId={}",
                request.getMethod(), path, status, durationMillis,
                client, MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        } else {
            log.info("method={} path={} status={} duration={}ms client={} correlationId={}",
                request.getMethod(), path, status, durationMillis,
                client, MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        }
    }
}
