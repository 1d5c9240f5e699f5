package com.plagiarism.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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

/**
 * OpenAI 兼容 Chat Completions 接口实现。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiProvider implements AiProvider {

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public String complete(String prompt, String apiKey) {
        AiProperties.OpenAiConfig config = properties.getOpenai();
        String url = config.getBaseUrl() + "/chat/completions";

        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("model", config.getModel());
            root.put("max_tokens", config.getMaxTokens());
            root.put("temperature", config.getTemperature());

            ArrayNode messages = root.putArray("messages");
            ObjectNode userMsg = messages.addObject();
            userMsg.put("role", "user");
            userMsg.put("content", prompt);

            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                    .build();

            try (Response response = aiHttpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("OpenAI API 调用失败: {} - {}", response.code(), body);
                    throw new JudgmentServiceException("OpenAI API 返回错误: HTTP " + response.code());
                }

                JsonNode json = objectMapper.readTree(body);
                String result = json.path("choices").path(0).path("message").path("content").asText();

                if (result.isEmpty()) {
                    throw new JudgmentServiceException("OpenAI API 返回空内容");
                }

                log.debug("OpenAI 响应长度: {} 字符", result.length());
                return result;
            }

        } catch (JudgmentServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new JudgmentServiceException("调用 OpenAI API 时发生网络错误", e);
        }
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
