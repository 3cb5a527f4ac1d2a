package com.adobe.daiji.filter;

import com.adobe.daiji.config.RateLimitConfig;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Applies per-client rate limiting to the {@code /daiji} endpoints.
 *
 * <h2>Behavior:</h2>
 * <ul>
 *   <li>Requests with a token available pass through with
 *       {@code X-Rate-Limit-Remaining} and {@code X-Rate-Limit-Limit} headers</li>
 *   <li>Otherwise 429 Too Many Requests with a {@code Retry-After} header</li>
 *   <li>Actuator and API documentation paths are never limited</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String LIMITED_PATH = "/daiji";

    private final RateLimitConfig rateLimitConfig;

    public RateLimitFilter(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return !(uri.equals(LIMITED_PATH) || uri.startsWith(LIMITED_PATH + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String client = ClientAddress.of(request, rateLimitConfig.getTrustedProxies());
        Bucket bucket = rateLimitConfig.resolveBucket(client);
        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);

        String limit = String.valueOf(rateLimitConfig.getRequestsPerMinute());
        response.setHeader("X-Rate-Limit-Limit", limit);

        if (consumption.isConsumed()) {
            response.setHeader("X-Rate-Limit-Remaining", String.valueOf(consumption.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }

        long retryAfterSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(consumption.getNanosToWaitForRefill()));
        logger.warn("Rate limit exceeded for client {}; retry after {}s", client, retryAfterSeconds);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setHeader("X-Rate-Limit-Remaining", "0");
        response.getWriter().write(
            "Error: Rate limit exceeded. Retry after " + retryAfterSeconds
                + " seconds. Limit: " + limit + " requests per minute.");
    }
}
