package com.plagiarism.ai.provider;

/**
 * 大模型提供商接口。
 * 通过适配器模式支持不同的服务商（Gemini、OpenAI、Anthropic）。
 */
public interface AiProvider {

    /**
     * 发送单轮文本请求（阻塞式，等待完整响应）。
     *
     * @param prompt 完整提示词
     * @param apiKey API Key
     * @return 模型返回的文本
     */
    String complete(String prompt, String apiKey);

    /**
     * 获取提供商名称。
     */
    String getProviderName();
}
