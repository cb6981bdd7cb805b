package com.hybridsearch.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute limit, one pair of buckets per key.
 */
@Slf4j
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tokenBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int tokensPerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int tokensPerMinute) {
        if (requestsPerMinute < 1 || tokensPerMinute < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket tokenBucket = tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute));

        // a single request larger than the whole budget would wait forever
        int cost = Math.max(1, Math.min(tokens, tokensPerMinute));
        try {
            requests.asBlocking().consume(1);
            tokenBucket.asBlocking().consume(cost);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit '" + key + "'", e);
        }
    }

    public long availableRequests(String key) {
        return requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute)).getAvailableTokens();
    }

    public long availableTokens(String key) {
        return tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute)).getAvailableTokens();
    }
}
