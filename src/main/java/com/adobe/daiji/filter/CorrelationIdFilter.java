package com.adobe.daiji.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation ID for log tracing.
 *
 * <p>A well-formed {@code X-Correlation-ID} header from the caller is reused;
 * otherwise a short random ID is generated. The ID is placed in the MDC under
 * {@value #CORRELATION_ID_MDC_KEY} for the duration of the request and echoed
 * in the response header.</p>
 *
 * <pre>
 * 2024-01-15 10:30:00 [http-nio-8080-exec-1] [abc12345] INFO DaijiNumeralController - Processing conversion request for: 12345
 * </pre>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
@Order(0)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    /**
     * Caller-supplied IDs end up in log lines, so only plain tokens are trusted.
     */
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));

        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    static String resolveCorrelationId(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
