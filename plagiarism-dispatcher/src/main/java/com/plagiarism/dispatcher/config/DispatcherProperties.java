package com.plagiarism.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "plagiarism.dispatcher")
public class DispatcherProperties {

    /** 存储类型: memory（内存，单机部署） / redis（多实例共享 Key 池） */
    private String storageType = "memory";

    /** 同时在途的外部调用上限 */
    private int maxConcurrent = 8;

    /** 调用失败后的重试次数 */
    private int retryCount = 2;

    /** 重试退避基数（毫秒），第 n 次重试等待 n 倍 */
    private long retryBackoffMillis = 1000;

    /** Key 池在 Redis 中的 key 名 */
    private String keyPoolName = "plagiarism:judge:keys";

    /** 失败 Key 在 Redis 中的有序集合名，分值为失败时间 */
    private String failedKeyPoolName = "plagiarism:judge:keys:failed";

    /** Key 冷却时间（秒），失败后至少等待这么久才恢复 */
    private int keyCooldownSeconds = 60;

    /** 检查失败 Key 是否冷却完毕的间隔（秒） */
    private int keyRecoveryIntervalSeconds = 10;

    /** 滑动窗口限流的窗口大小（秒） */
    private int rateLimitWindowSeconds = 60;

    /** 每个 Key 在窗口内的最大请求数 */
    private int rateLimitMaxRequests = 50;

    /** Redis 限流计数的 key 前缀，后接 API Key 的哈希 */
    private String rateLimitKeyPrefix = "plagiarism:judge:ratelimit:";

    /** 借用 Key 的超时时间（秒） */
    private int keyBorrowTimeoutSeconds = 30;
}
