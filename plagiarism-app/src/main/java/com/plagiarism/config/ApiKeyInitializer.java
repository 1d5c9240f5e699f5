package com.plagiarism.config;

import com.plagiarism.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 应用启动时，从配置加载语义判定服务的 API Keys 到调度池。
 * <p>
 * 配置方式（在 application.yml 中）：
 * plagiarism.api-keys=key1,key2,key3
 * <p>
 * 或通过环境变量：PLAGIARISM_API_KEYS=key1,key2,key3
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class ApiKeyInitializer implements CommandLineRunner {

    private final ApiKeyPool keyPool;

    @Value("${plagiarism.api-keys:}")
    private String apiKeysConfig;

    @Override
    public void run(String... args) {
        List<String> keys = apiKeysConfig == null ? List.of() : Arrays.stream(apiKeysConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();

        if (keys.isEmpty()) {
            log.warn("未配置 API Keys，语义判定不可用，可疑学生对将使用算法兜底判定");
            log.warn("请设置 plagiarism.api-keys 或环境变量 PLAGIARISM_API_KEYS");
            return;
        }

        // 仅在池为空时添加，多实例共享 Redis 池时避免重复添加
        long existing = keyPool.availableCount() + keyPool.failedCount();
        if (existing == 0) {
            keyPool.addKeys(keys);
            log.info("已加载 {} 个 API Keys 到调度池", keys.size());
        } else {
            log.info("Key 池中已有 {} 个 Key，跳过初始化加载", existing);
        }
    }
}
