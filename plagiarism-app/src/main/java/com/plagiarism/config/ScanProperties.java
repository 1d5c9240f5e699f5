package com.plagiarism.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 命令行目录扫描配置。设置 root 后启动即扫描，报告以 JSON 写入 output。
 */
@Data
@ConfigurationProperties(prefix = "plagiarism.scan")
public class ScanProperties {

    /** 作业根目录，每个子目录是一名学生；为空时不扫描 */
    private String root;

    /** 报告输出路径 */
    private String output = "plagiarism-report.json";
}
