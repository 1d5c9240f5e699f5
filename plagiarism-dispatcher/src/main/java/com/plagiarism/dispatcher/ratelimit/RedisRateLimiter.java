package com.plagiarism.dispatcher.ratelimit;

import com.plagiarism.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.UUID;
import java.util.function.LongSupplier;

import static com.plagiarism.dispatcher.pool.ApiKeyPool.mask;

/**
 * 多个检测进程共享的滑动窗口限流，每个 API Key 一个 ZSet，成员分值为请求时刻（毫秒）。
 * <p>
 * 先登记本次请求再计数，超出上限则撤回登记。并发时可能两边同时被拒，但窗口内放行的请求数不会超过上限。
 * 与 {@link InMemoryRateLimiter} 一样，恰好落在窗口起点的请求仍计入窗口。
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;
    private final LongSupplier clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this(redisTemplate, properties, System::currentTimeMillis);
    }

    RedisRateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties, LongSupplier clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    String windowKey(String apiKey) {
        return properties.getRateLimitKeyPrefix() + Integer.toHexString(apiKey.hashCode());
    }

    private long windowStart(long now) {
        return now - properties.getRateLimitWindowSeconds() * 1000L;
    }

    @Override
    public boolean tryAcquire(String apiKey) {
        String key = windowKey(apiKey);
        long now = clock.getAsLong();
        ZSetOperations<String, String> requests = redisTemplate.opsForZSet();

        requests.removeRangeByScore(key, 0, windowStart(now) - 1);
        String member = now + ":" + UUID.randomUUID();
        requests.add(key, member, now);
        redisTemplate.expire(key, Duration.ofSeconds(properties.getRateLimitWindowSeconds() + 10L));

        Long inWindow = requests.zCard(key);
        if (inWindow != null && inWindow > properties.getRateLimitMaxRequests()) {
            requests.remove(key, member);
            log.debug("Key {} 已达速率限制 ({}/{})", mask(apiKey),
                    inWindow - 1, properties.getRateLimitMaxRequests());
            return false;
        }
        return true;
    }

    @Override
    public long remainingQuota(String apiKey) {
        long now = clock.getAsLong();
        Long used = redisTemplate.opsForZSet().count(windowKey(apiKey), windowStart(now), Double.POSITIVE_INFINITY);
        return Math.max(0, properties.getRateLimitMaxRequests() - (used != null ? used : 0));
    }
}
