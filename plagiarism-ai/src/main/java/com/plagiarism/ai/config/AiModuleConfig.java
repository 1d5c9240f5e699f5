package com.plagiarism.ai.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 语义判定模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.plagiarism.ai")
@EnableConfigurationProperties(AiProperties.class)
public class AiModuleConfig {

    /**
     * 三家模型共用的 HTTP 客户端。整次调用受 request-timeout-seconds 约束；
     * 连接失败不在这里重试，换 Key 重试由调度模块负责。
     */
    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        Duration perCall = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .callTimeout(perCall)
                .readTimeout(perCall)
                .retryOnConnectionFailure(false)
                .build();
    }
}
