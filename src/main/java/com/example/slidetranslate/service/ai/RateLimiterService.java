package com.example.slidetranslate.service.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-backend request throttle. Each backend gets a bucket of
 * {@code requests-per-minute} tokens refilled once a minute; callers block until a
 * token is free, so parallel batches queue up instead of hitting quota errors.
 */
@Service
public class RateLimiterService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    @Value("${ai.rate-limit.enabled:false}")
    private boolean enabled;

    @Value("${ai.rate-limit.requests-per-minute:60}")
    private int requestsPerMinute;

    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Wait until a request to the given backend may proceed.
     *
     * @throws TranslationBackendException if interrupted while waiting
     */
    public void acquire(String backendName) {
        if (!enabled || requestsPerMinute <= 0) {
            return;
        }

        TokenBucket bucket = buckets.computeIfAbsent(backendName,
            k -> new TokenBucket(requestsPerMinute, 60000L));
        try {
            bucket.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationBackendException("Interrupted while waiting for " + backendName + " rate limit", e);
        }
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    /**
     * Token bucket refilled in full once per window.
     */
    static class TokenBucket {
        private final int capacity;
        private final long windowMs;
        private int tokens;
        private long windowStart;

        TokenBucket(int capacity, long windowMs) {
            this.capacity = capacity;
            this.windowMs = windowMs;
            this.tokens = capacity;
            this.windowStart = System.currentTimeMillis();
        }

        synchronized void acquire() throws InterruptedException {
            while (true) {
                long now = System.currentTimeMillis();
                if (now - windowStart >= windowMs) {
                    tokens = capacity;
                    windowStart = now;
                }
                if (tokens > 0) {
                    tokens--;
                    return;
                }
                long waitMs = windowMs - (now - windowStart);
                logger.debug("Rate limit reached, waiting {}ms", waitMs);
                wait(Math.max(1L, waitMs));
            }
        }

        synchronized int available() {
            return tokens;
        }
    }
}
