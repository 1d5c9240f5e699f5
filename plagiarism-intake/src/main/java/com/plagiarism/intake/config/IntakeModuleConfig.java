package com.plagiarism.intake.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 采集模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.plagiarism.intake")
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeModuleConfig {
}
