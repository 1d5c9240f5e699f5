package com.plagiarism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 8051 作业抄袭检测系统 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.plagiarism")
@EnableScheduling
public class PlagiarismApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlagiarismApplication.class, args);
    }
}
