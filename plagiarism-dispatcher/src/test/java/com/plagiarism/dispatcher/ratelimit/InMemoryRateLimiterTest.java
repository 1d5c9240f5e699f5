package com.plagiarism.dispatcher.ratelimit;

import com.plagiarism.dispatcher.config.DispatcherProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRateLimiterTest {

    @Test
    void windowLimitsRequestsPerKey() {
        DispatcherProperties properties = new DispatcherProperties();
        properties.setRateLimitMaxRequests(2);
        properties.setRateLimitWindowSeconds(10);
        AtomicLong now = new AtomicLong(1_000_000);
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(properties, now::get);

        assertTrue(limiter.tryAcquire("key-1"));
        assertTrue(limiter.tryAcquire("key-1"));
        assertFalse(limiter.tryAcquire("key-1"));
        assertTrue(limiter.tryAcquire("key-2"));
        assertEquals(0, limiter.remainingQuota("key-1"));

        now.addAndGet(10_001);

        assertEquals(2, limiter.remainingQuota("key-1"));
        assertTrue(limiter.tryAcquire("key-1"));
    }

    @Test
    void unknownKeyHasFullQuota() {
        DispatcherProperties properties = new DispatcherProperties();
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(properties);

        assertEquals(properties.getRateLimitMaxRequests(), limiter.remainingQuota("never-used"));
    }
}
