package com.plagiarism.dispatcher.ratelimit;

/**
 * 单个 API Key 的滑动窗口限流，窗口大小与上限来自 {@code plagiarism.dispatcher.rate-limit-*}。
 * 内存实现只在本进程内计数，Redis 实现在多个检测进程间共享计数。
 */
public interface RateLimiter {

    /**
     * 在当前窗口内为该 Key 记一次请求。
     *
     * @return false 表示窗口内请求数已满，本次未计入
     */
    boolean tryAcquire(String apiKey);

    /** 该 Key 在当前窗口内还能发出的请求数 */
    long remainingQuota(String apiKey);
}
