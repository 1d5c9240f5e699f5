package com.plagiarism.dispatcher.pool;

import java.util.List;

/**
 * 语义判定服务的 API Key 轮询池。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryApiKeyPool}：内存实现
 * - {@link RedisApiKeyPool}：Redis 实现，多实例共享
 */
public interface ApiKeyPool {

    /** 从池中借出一个可用 Key，超时未借到抛出 KeyPoolExhaustedException */
    String borrowKey();

    /** 归还 Key 到池尾部 */
    void returnKey(String key);

    /** 标记 Key 为失败状态，冷却后由定时任务恢复 */
    void markFailed(String key);

    /** 向池中添加一个 Key */
    void addKey(String key);

    /** 批量添加 Key */
    void addKeys(List<String> keys);

    /** 获取可用 Key 数量 */
    long availableCount();

    /** 获取失败 Key 数量 */
    long failedCount();

    /** 恢复失败的 Key 到可用池 */
    int recoverFailedKeys();

    /**
     * 日志中只显示 Key 的前 8 位。
     */
    static String mask(String key) {
        if (key == null || key.length() <= 8) {
            return "***";
        }
        return key.substring(0, 8) + "***";
    }
}
