package com.plagiarism.dispatcher.service;

import com.plagiarism.common.exception.JudgmentServiceException;
import com.plagiarism.common.exception.KeyPoolExhaustedException;
import com.plagiarism.dispatcher.config.DispatcherProperties;
import com.plagiarism.dispatcher.pool.ApiKeyPool;
import com.plagiarism.dispatcher.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * 外部调用调度：为每次调用借出 API Key、检查限流、失败时换 Key 重试。
 * <p>
 * 核心策略：
 * - 用 Semaphore 限制同一时刻在途的调用数
 * - 调用失败的 Key 进入失败队列，由 {@link KeyRecoveryScheduler} 冷却后恢复；池中最后一个 Key 不进入失败队列
 * - 在调用方线程上同步执行，调用方可通过中断取消
 */
@Slf4j
@Service
public class DispatcherService {

    private final ApiKeyPool keyPool;
    private final RateLimiter rateLimiter;
    private final DispatcherProperties properties;
    private final Semaphore permits;

    public DispatcherService(ApiKeyPool keyPool, RateLimiter rateLimiter, DispatcherProperties properties) {
        this.keyPool = keyPool;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.permits = new Semaphore(Math.max(1, properties.getMaxConcurrent()), true);
    }

    /**
     * 借用 Key 执行一次调用，失败按配置重试。
     *
     * @param task 实际的调用逻辑 apiKey -> result
     * @throws JudgmentServiceException 重试耗尽或等待时被中断
     */
    public <R> R execute(Function<String, R> task) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JudgmentServiceException("等待调度时被中断");
        }
        try {
            return executeWithRetry(task);
        } finally {
            permits.release();
        }
    }

    private <R> R executeWithRetry(Function<String, R> task) {
        int maxRetries = properties.getRetryCount();
        RuntimeException lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new JudgmentServiceException("调用已取消");
            }
            String key = null;
            try {
                key = borrowKeyWithRateLimit();
                R result = task.apply(key);
                keyPool.returnKey(key);
                return result;

            } catch (KeyPoolExhaustedException e) {
                log.debug("Key 暂时不可用，等待后重试 (第 {} 次)", attempt + 1);
                lastException = e;
                backoff(attempt + 1);

            } catch (RuntimeException e) {
                log.warn("外部调用失败 (尝试 {}/{}): {}", attempt + 1, maxRetries + 1, e.getMessage());
                lastException = e;
                if (key != null) {
                    releaseFailedKey(key);
                }
                if (attempt < maxRetries) {
                    backoff(attempt + 1);
                }
            }
        }

        throw new JudgmentServiceException("调用在 " + (maxRetries + 1) + " 次尝试后仍然失败: "
                + (lastException != null ? lastException.getMessage() : "未知错误"), lastException);
    }

    private void releaseFailedKey(String key) {
        if (keyPool.availableCount() > 0) {
            keyPool.markFailed(key);
        } else {
            keyPool.returnKey(key);
        }
    }

    /**
     * 借出 Key 并确保未超过速率限制。
     */
    private String borrowKeyWithRateLimit() {
        int maxAttempts = 3;
        for (int i = 0; i < maxAttempts; i++) {
            String key = keyPool.borrowKey();
            if (rateLimiter.tryAcquire(key)) {
                return key;
            }
            keyPool.returnKey(key);
            log.debug("Key 已达限流，等待后重试");
            backoff(1);
        }
        throw new KeyPoolExhaustedException("Key 当前速率限制中，请稍后重试");
    }

    private void backoff(int multiplier) {
        long ms = properties.getRetryBackoffMillis() * multiplier;
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
