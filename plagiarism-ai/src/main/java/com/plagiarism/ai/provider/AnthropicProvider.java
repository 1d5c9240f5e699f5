package com.plagiarism.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.plagiarism.ai.config.AiProperties;
import com.plagiarism.common.exception.JudgmentServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Anthropic Messages 接口。判定提示词作为单条 user 消息发送，回复中的 text 块按顺序拼接。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnthropicProvider implements AiProvider {

    static final String API_VERSION = "2023-06-01";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String complete(String prompt, String apiKey) {
        AiProperties.AnthropicConfig config = properties.getAnthropic();
        Request request;
        try {
            request = new Request.Builder()
                    .url(config.getBaseUrl() + "/messages")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .post(RequestBody.create(objectMapper.writeValueAsString(messageBody(config, prompt)), JSON))
                    .build();
        } catch (IOException e) {
            throw new JudgmentServiceException("无法序列化 Anthropic 请求", e);
        }

        try (Response response = aiHttpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                log.error("Anthropic API 调用失败: {} - {}", response.code(), body);
                throw new JudgmentServiceException("Anthropic API 返回错误: HTTP " + response.code());
            }
            String text = joinTextBlocks(objectMapper.readTree(body));
            if (text.isEmpty()) {
                throw new JudgmentServiceException("Anthropic API 返回空内容");
            }
            return text;
        } catch (IOException e) {
            throw new JudgmentServiceException("调用 Anthropic API 时发生网络错误", e);
        }
    }

    private ObjectNode messageBody(AiProperties.AnthropicConfig config, String prompt) {
        ObjectNode root = objectMapper.createObjectNode()
                .put("model", config.getModel())
                .put("max_tokens", config.getMaxTokens())
                .put("temperature", config.getTemperature());
        root.putArray("messages").addObject()
                .put("role", "user")
                .put("content", prompt);
        return root;
    }

    /** 忽略 tool_use 等非文本块 */
    private static String joinTextBlocks(JsonNode json) {
        return StreamSupport.stream(json.path("content").spliterator(), false)
                .filter(block -> "text".equals(block.path("type").asText()))
                .map(block -> block.path("text").asText())
                .collect(Collectors.joining());
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }
}
