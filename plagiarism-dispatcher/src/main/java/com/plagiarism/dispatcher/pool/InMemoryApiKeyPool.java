package com.plagiarism.dispatcher.pool;

import com.plagiarism.common.exception.KeyPoolExhaustedException;
import com.plagiarism.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import static com.plagiarism.dispatcher.pool.ApiKeyPool.mask;

/**
 * 单进程内的 API Key 轮询池。
 * <p>
 * 可用 Key 排成队列，借出时阻塞等待归还；失败 Key 记下失败时刻，冷却期满后才会被恢复。
 * 同一个 Key 重复添加只保留一份。
 */
@Slf4j
public class InMemoryApiKeyPool implements ApiKeyPool {

    private final BlockingQueue<String> available = new LinkedBlockingQueue<>();
    private final Map<String, Long> failedSince = new ConcurrentHashMap<>();
    private final Set<String> knownKeys = ConcurrentHashMap.newKeySet();
    private final DispatcherProperties properties;
    private final LongSupplier clock;

    public InMemoryApiKeyPool(DispatcherProperties properties) {
        this(properties, System::currentTimeMillis);
    }

    InMemoryApiKeyPool(DispatcherProperties properties, LongSupplier clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String borrowKey() {
        String key;
        try {
            key = available.poll(properties.getKeyBorrowTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyPoolExhaustedException("等待借用 Key 时被中断", e);
        }
        if (key == null) {
            throw new KeyPoolExhaustedException("等待 " + properties.getKeyBorrowTimeoutSeconds()
                    + " 秒仍无可用 Key (冷却中 " + failedSince.size() + " 个)");
        }
        log.debug("借出 Key: {}", mask(key));
        return key;
    }

    @Override
    public void returnKey(String key) {
        available.offer(key);
    }

    @Override
    public void markFailed(String key) {
        failedSince.put(key, clock.getAsLong());
        log.warn("Key {} 调用失败，冷却 {} 秒", mask(key), properties.getKeyCooldownSeconds());
    }

    @Override
    public void addKey(String key) {
        if (knownKeys.add(key)) {
            available.offer(key);
        } else {
            log.debug("Key {} 已在池中，忽略", mask(key));
        }
    }

    @Override
    public void addKeys(List<String> keys) {
        int before = knownKeys.size();
        keys.forEach(this::addKey);
        log.info("Key 池新增 {} 个 Key (共 {} 个)", knownKeys.size() - before, knownKeys.size());
    }

    @Override
    public long availableCount() {
        return available.size();
    }

    @Override
    public long failedCount() {
        return failedSince.size();
    }

    @Override
    public int recoverFailedKeys() {
        long deadline = clock.getAsLong() - properties.getKeyCooldownSeconds() * 1000L;
        int recovered = 0;
        Iterator<Map.Entry<String, Long>> it = failedSince.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> entry = it.next();
            if (entry.getValue() <= deadline) {
                it.remove();
                available.offer(entry.getKey());
                recovered++;
            }
        }
        return recovered;
    }
}
