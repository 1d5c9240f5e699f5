package com.plagiarism.dispatcher.pool;

import com.plagiarism.common.exception.KeyPoolExhaustedException;
import com.plagiarism.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.LongSupplier;

import static com.plagiarism.dispatcher.pool.ApiKeyPool.mask;

/**
 * Redis 上的 API Key 轮询池，多个检测进程共享同一组 Key。
 * <p>
 * 可用 Key 存放在 List 中；失败 Key 存放在 ZSet 中，分值为失败时刻（毫秒），
 * 恢复时只取冷却期满的成员，且只有成功从 ZSet 删除该成员的进程才把它放回 List。
 */
@Slf4j
public class RedisApiKeyPool implements ApiKeyPool {

    private final StringRedisTemplate redisTemplate;
    private final DispatcherProperties properties;
    private final LongSupplier clock;

    public RedisApiKeyPool(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
        this(redisTemplate, properties, System::currentTimeMillis);
    }

    RedisApiKeyPool(StringRedisTemplate redisTemplate, DispatcherProperties properties, LongSupplier clock) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    private ListOperations<String, String> lists() {
        return redisTemplate.opsForList();
    }

    private ZSetOperations<String, String> failedSet() {
        return redisTemplate.opsForZSet();
    }

    @Override
    public String borrowKey() {
        String key;
        try {
            key = lists().leftPop(properties.getKeyPoolName(),
                    Duration.ofSeconds(properties.getKeyBorrowTimeoutSeconds()));
        } catch (QueryTimeoutException e) {
            throw new KeyPoolExhaustedException("从 Redis 借用 Key 超时", e);
        }
        if (key == null) {
            throw new KeyPoolExhaustedException("等待 " + properties.getKeyBorrowTimeoutSeconds()
                    + " 秒仍无可用 Key (" + properties.getKeyPoolName() + ")");
        }
        log.debug("借出 Key: {}", mask(key));
        return key;
    }

    @Override
    public void returnKey(String key) {
        lists().rightPush(properties.getKeyPoolName(), key);
    }

    @Override
    public void markFailed(String key) {
        failedSet().add(properties.getFailedKeyPoolName(), key, clock.getAsLong());
        log.warn("Key {} 调用失败，冷却 {} 秒", mask(key), properties.getKeyCooldownSeconds());
    }

    @Override
    public void addKey(String key) {
        lists().rightPush(properties.getKeyPoolName(), key);
    }

    @Override
    public void addKeys(List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        lists().rightPushAll(properties.getKeyPoolName(), keys);
        log.info("Key 池 {} 新增 {} 个 Key", properties.getKeyPoolName(), keys.size());
    }

    @Override
    public long availableCount() {
        Long size = lists().size(properties.getKeyPoolName());
        return size != null ? size : 0;
    }

    @Override
    public long failedCount() {
        Long size = failedSet().zCard(properties.getFailedKeyPoolName());
        return size != null ? size : 0;
    }

    @Override
    public int recoverFailedKeys() {
        long deadline = clock.getAsLong() - properties.getKeyCooldownSeconds() * 1000L;
        Set<String> due = failedSet().rangeByScore(properties.getFailedKeyPoolName(), 0, deadline);
        if (due == null || due.isEmpty()) {
            return 0;
        }
        int recovered = 0;
        for (String key : due) {
            Long removed = failedSet().remove(properties.getFailedKeyPoolName(), key);
            if (removed != null && removed > 0) {
                lists().rightPush(properties.getKeyPoolName(), key);
                recovered++;
            }
        }
        return recovered;
    }
}
