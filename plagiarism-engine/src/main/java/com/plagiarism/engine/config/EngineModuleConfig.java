package com.plagiarism.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 引擎模块自动配置。
 * <p>
 * 配置在创建线程池时校验，不合法时应用启动失败。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.plagiarism.engine")
@EnableConfigurationProperties(EngineProperties.class)
public class EngineModuleConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor(EngineProperties properties) {
        properties.validate();
        log.info("检测引擎配置: 筛选策略={}, 源码阈值={}, HEX阈值={}, 兜底阈值={}, 并行度={}",
                properties.getFilterMode(), properties.getSourceThreshold(), properties.getHexThreshold(),
                properties.getFallbackThreshold(), properties.getParallelism());
        return Executors.newFixedThreadPool(properties.getParallelism(),
                new CustomizableThreadFactory("compare-"));
    }

    /** 语义判定调用专用线程池，不与比对线程池共用 */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService judgmentExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(properties.getJudgmentConcurrency(),
                new CustomizableThreadFactory("judge-"));
    }
}
