package com.plagiarism.dispatcher.config;

import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.dispatcher.pool.ApiKeyPool;
import com.plagiarism.dispatcher.pool.InMemoryApiKeyPool;
import com.plagiarism.dispatcher.pool.RedisApiKeyPool;
import com.plagiarism.dispatcher.ratelimit.InMemoryRateLimiter;
import com.plagiarism.dispatcher.ratelimit.RateLimiter;
import com.plagiarism.dispatcher.ratelimit.RedisRateLimiter;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Set;

/**
 * 调度模块配置，{@code plagiarism.dispatcher.storage-type} 决定 Key 池与限流计数放在哪里：
 * {@code memory}（默认）只在本进程内有效，{@code redis} 供多个检测进程共享。
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ComponentScan(basePackages = "com.plagiarism.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    private static final Set<String> STORAGE_TYPES = Set.of("memory", "redis");

    private final DispatcherProperties properties;

    @PostConstruct
    void checkStorageType() {
        if (!STORAGE_TYPES.contains(properties.getStorageType())) {
            throw new ConfigurationException("未知的 storage-type: " + properties.getStorageType()
                    + "，可选 " + STORAGE_TYPES);
        }
        log.info("调度存储: {}", properties.getStorageType());
    }

    @Configuration
    @ConditionalOnProperty(name = "plagiarism.dispatcher.storage-type", havingValue = "memory", matchIfMissing = true)
    static class MemoryStorage {

        @Bean
        ApiKeyPool inMemoryApiKeyPool(DispatcherProperties properties) {
            return new InMemoryApiKeyPool(properties);
        }

        @Bean
        RateLimiter inMemoryRateLimiter(DispatcherProperties properties) {
            return new InMemoryRateLimiter(properties);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "plagiarism.dispatcher.storage-type", havingValue = "redis")
    static class RedisStorage {

        @Bean
        ApiKeyPool redisApiKeyPool(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
            log.info("Key 池: {}，失败集合: {}", properties.getKeyPoolName(), properties.getFailedKeyPoolName());
            return new RedisApiKeyPool(redisTemplate, properties);
        }

        @Bean
        RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, DispatcherProperties properties) {
            return new RedisRateLimiter(redisTemplate, properties);
        }
    }
}
