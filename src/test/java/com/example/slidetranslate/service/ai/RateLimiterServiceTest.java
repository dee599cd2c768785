package com.example.slidetranslate.service.ai;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterServiceTest {

    @Test
    void disabledLimiterNeverBlocks() {
        RateLimiterService limiter = new RateLimiterService();
        limiter.setEnabled(false);
        limiter.setRequestsPerMinute(1);

        long start = System.currentTimeMillis();
        for (int i = 0; i < 5; i++) {
            limiter.acquire("backend");
        }

        assertThat(System.currentTimeMillis() - start).isLessThan(1000L);
    }

    @Test
    void bucketHandsOutTokensUpToCapacity() throws InterruptedException {
        RateLimiterService.TokenBucket bucket = new RateLimiterService.TokenBucket(3, 60000L);

        bucket.acquire();
        bucket.acquire();

        assertThat(bucket.available()).isEqualTo(1);
    }

    @Test
    void bucketRefillsAfterWindow() throws InterruptedException {
        RateLimiterService.TokenBucket bucket = new RateLimiterService.TokenBucket(1, 50L);

        long start = System.currentTimeMillis();
        bucket.acquire();
        bucket.acquire();

        assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(40L);
    }
}
