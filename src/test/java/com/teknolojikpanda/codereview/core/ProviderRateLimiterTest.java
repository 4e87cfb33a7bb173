package com.teknolojikpanda.codereview.core;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ProviderRateLimiterTest {

    @Test
    public void consecutiveDispatchesAreSeparatedByTheInterval() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter();

        long first = limiter.acquire("deepseek-chat", 120);
        long second = limiter.acquire("deepseek-chat", 120);

        assertTrue(second - first >= TimeUnit.MILLISECONDS.toNanos(120));
        assertEquals(2, limiter.requestCount("deepseek-chat"));
    }

    @Test
    public void resetForgetsEarlierDispatches() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter();
        limiter.acquire("gpt-4", 5_000);

        limiter.reset();
        long start = System.nanoTime();
        limiter.acquire("gpt-4", 5_000);

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1_000);
        assertEquals(1, limiter.requestCount("gpt-4"));
    }

    @Test
    public void providersAreLimitedIndependently() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter();
        limiter.acquire("gpt-4", 5_000);

        long start = System.nanoTime();
        limiter.acquire("kimi-k2", 5_000);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue("second provider should not wait, waited " + elapsedMs + "ms", elapsedMs < 1_000);
        assertEquals(1, limiter.requestCount("gpt-4"));
        assertEquals(1, limiter.requestCount("kimi-k2"));
        assertEquals(0, limiter.requestCount("doubao-pro"));
    }

    @Test
    public void concurrentCallersAreSerialized() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch ready = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(executor.submit(() -> {
                    ready.await();
                    return limiter.acquire("claude-3-sonnet", 80);
                }));
            }
            ready.countDown();

            List<Long> stamps = new ArrayList<>();
            for (Future<Long> future : futures) {
                stamps.add(future.get(5, TimeUnit.SECONDS));
            }
            Collections.sort(stamps);
            for (int i = 1; i < stamps.size(); i++) {
                assertTrue(stamps.get(i) - stamps.get(i - 1) >= TimeUnit.MILLISECONDS.toNanos(80));
            }
            assertEquals(3, limiter.requestCount("claude-3-sonnet"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void zeroIntervalNeverWaits() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter();

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.acquire("local", 0);
        }

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1_000);
        assertEquals(5, limiter.requestCount("local"));
    }
}
