package com.plagiarism.intake.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 作业采集相关配置。
 */
@Data
@ConfigurationProperties(prefix = "plagiarism.intake")
public class IntakeProperties {

    /** 源文件解码时依次尝试的字符集，全部失败后按 UTF-8 宽松解码 */
    private List<String> encodings = new ArrayList<>(List.of("UTF-8", "Big5", "GBK"));

    /** 单个文件大小上限（字节），超过的文件跳过 */
    private long maxFileBytes = 2 * 1024 * 1024;

    /** C51 编译配置 */
    private CompilerConfig compiler = new CompilerConfig();

    @Data
    public static class CompilerConfig {

        /** 是否把 C 源文件编译为汇编后参与比对 */
        private boolean enabled = false;

        /** Keil C51 安装目录（含 BIN/C51.exe），为空时从环境变量与常见位置查找 */
        private String keilPath;

        /** 单个文件编译超时（秒） */
        private int timeoutSeconds = 30;

        /** 优化级别 OPTIMIZE(LEVEL(n)) */
        private int optimizeLevel = 9;
    }
}
