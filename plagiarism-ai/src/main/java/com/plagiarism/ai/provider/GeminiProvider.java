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
 * Google Gemini generateContent 接口实现。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiProvider implements AiProvider {

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public String complete(String prompt, String apiKey) {
        AiProperties.GeminiConfig config = properties.getGemini();
        String url = config.getBaseUrl() + "/models/" + config.getModel() + ":generateContent";

        try {
            ObjectNode root = objectMapper.createObjectNode();
            ArrayNode contents = root.putArray("contents");
            ObjectNode userMsg = contents.addObject();
            userMsg.put("role", "user");
            userMsg.putArray("parts").addObject().put("text", prompt);

            ObjectNode generation = root.putObject("generationConfig");
            generation.put("temperature", config.getTemperature());
            generation.put("maxOutputTokens", config.getMaxTokens());

            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("x-goog-api-key", apiKey)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                    .build();

            try (Response response = aiHttpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("Gemini API 调用失败: {} - {}", response.code(), body);
                    throw new JudgmentServiceException("Gemini API 返回错误: HTTP " + response.code());
                }

                JsonNode parts = objectMapper.readTree(body)
                        .path("candidates").path(0).path("content").path("parts");
                StringBuilder result = new StringBuilder();
                if (parts.isArray()) {
                    for (JsonNode part : parts) {
                        result.append(part.path("text").asText(""));
                    }
                }

                if (result.length() == 0) {
                    throw new JudgmentServiceException("Gemini API 返回空内容");
                }

                log.debug("Gemini 响应长度: {} 字符", result.length());
                return result.toString();
            }

        } catch (JudgmentServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new JudgmentServiceException("调用 Gemini API 时发生网络错误", e);
        }
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }
}
