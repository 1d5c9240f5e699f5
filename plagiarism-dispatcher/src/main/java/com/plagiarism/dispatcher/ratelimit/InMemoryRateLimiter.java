package com.plagiarism.dispatcher.ratelimit;

import com.plagiarism.dispatcher.config.DispatcherProperties;
import com.plagiarism.dispatcher.pool.ApiKeyPool;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 基于内存的滑动窗口限流器：每个 Key 一个请求时间戳队列，先清理过期记录再计数。
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final DispatcherProperties properties;
    private final LongSupplier clock;

    /** Key 的哈希 -> 请求时间戳队列 */
    private final Map<Integer, Deque<Long>> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(DispatcherProperties properties) {
        this(properties, System::currentTimeMillis);
    }

    InMemoryRateLimiter(DispatcherProperties properties, LongSupplier clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String apiKey) {
        Deque<Long> timestamps = windows.computeIfAbsent(apiKey.hashCode(), k -> new ArrayDeque<>());
        long now = clock.getAsLong();

        synchronized (timestamps) {
            evictExpired(timestamps, now);
            if (timestamps.size() >= properties.getRateLimitMaxRequests()) {
                log.debug("Key {} 已达速率限制 ({}/{})", ApiKeyPool.mask(apiKey),
                        timestamps.size(), properties.getRateLimitMaxRequests());
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    @Override
    public long remainingQuota(String apiKey) {
        Deque<Long> timestamps = windows.get(apiKey.hashCode());
        if (timestamps == null) {
            return properties.getRateLimitMaxRequests();
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.getAsLong());
            return Math.max(0, properties.getRateLimitMaxRequests() - timestamps.size());
        }
    }

    private void evictExpired(Deque<Long> timestamps, long now) {
        long windowStart = now - properties.getRateLimitWindowSeconds() * 1000L;
        while (!timestamps.isEmpty() && timestamps.peekFirst() < windowStart) {
            timestamps.pollFirst();
        }
    }
}
