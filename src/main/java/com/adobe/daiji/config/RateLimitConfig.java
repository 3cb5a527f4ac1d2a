package com.adobe.daiji.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-client rate limiting for the conversion endpoints using Bucket4j.
 *
 * <h2>Rate Limit Strategy:</h2>
 * <ul>
 *   <li>One token bucket per client address</li>
 *   <li>{@code app.rate-limiting.requests-per-minute} tokens, default 100</li>
 *   <li>Greedy refill spread over the minute</li>
 * </ul>
 *
 * <p>Buckets live in memory, so limits are per instance. At most
 * {@code app.rate-limiting.max-clients} buckets are kept; the least recently
 * used one is dropped when a new client arrives at the cap.
 * {@code app.rate-limiting.trusted-proxies} lists the comma-separated proxy
 * addresses whose {@code X-Forwarded-For} header is believed.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Configuration
public class RateLimitConfig {

    private final int requestsPerMinute;

    private final int maxClients;

    private final Set<String> trustedProxies;

    private final Map<String, Bucket> buckets;

    public RateLimitConfig(@Value("${app.rate-limiting.requests-per-minute:100}") int requestsPerMinute,
                           @Value("${app.rate-limiting.max-clients:10000}") int maxClients,
                           @Value("${app.rate-limiting.trusted-proxies:}") List<String> trustedProxies) {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException(
                "app.rate-limiting.requests-per-minute must be positive, got: " + requestsPerMinute);
        }
        if (maxClients < 1) {
            throw new IllegalArgumentException(
                "app.rate-limiting.max-clients must be positive, got: " + maxClients);
        }
        this.requestsPerMinute = requestsPerMinute;
        this.maxClients = maxClients;
        this.trustedProxies = trustedProxies.stream()
            .map(String::trim)
            .filter(address -> !address.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.buckets = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Bucket> eldest) {
                return size() > RateLimitConfig.this.maxClients;
            }
        });
    }

    /**
     * Gets or creates the bucket for a client.
     *
     * @param clientKey the client address
     * @return the Bucket for rate limiting this client
     */
    public Bucket resolveBucket(String clientKey) {
        return buckets.computeIfAbsent(clientKey, key -> newBucket());
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.classic(
            requestsPerMinute,
            Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );

        return Bucket.builder()
            .addLimit(limit)
            .build();
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public int getMaxClients() {
        return maxClients;
    }

    public Set<String> getTrustedProxies() {
        return trustedProxies;
    }

    int getTrackedClientCount() {
        return buckets.size();
    }
}
