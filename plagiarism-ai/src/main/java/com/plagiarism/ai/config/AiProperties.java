package com.plagiarism.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 大模型语义判定配置项。
 */
@Data
@ConfigurationProperties(prefix = "plagiarism.ai")
public class AiProperties {

    /** 是否启用大模型判定，关闭时判定级联直接走算法兜底 */
    private boolean enabled = false;

    /** 当前使用的提供商: gemini / openai / anthropic */
    private String provider = "gemini";

    private OpenAiConfig openai = new OpenAiConfig();

    private AnthropicConfig anthropic = new AnthropicConfig();

    private GeminiConfig gemini = new GeminiConfig();

    /** 单次 HTTP 调用的读超时（秒） */
    private int requestTimeoutSeconds = 30;

    /** 每份源码写入 Prompt 的最大字符数，超出部分截断 */
    private int maxSourceChars = 12000;

    @Data
    public static class OpenAiConfig {
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        private int maxTokens = 1024;
    }

    @Data
    public static class AnthropicConfig {
        private String baseUrl = "https://api.anthropic.com/v1";
        private String model = "claude-3-5-haiku-20241022";
        private double temperature = 0.2;
        private int maxTokens = 1024;
    }

    @Data
    public static class GeminiConfig {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-2.5-flash-lite";
        private double temperature = 0.2;
        private int maxTokens = 1024;
    }
}
