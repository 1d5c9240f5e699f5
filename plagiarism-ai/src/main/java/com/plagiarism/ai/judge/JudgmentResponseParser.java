package com.plagiarism.ai.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.common.exception.JudgmentServiceException;
import org.springframework.stereotype.Component;

/**
 * 解析模型输出中的判定 JSON。
 * <p>
 * 先去掉 Markdown 代码块标记整体解析，失败时取第一个 '{' 到最后一个 '}' 之间的内容再解析。
 * 必须包含布尔型 {@code is_plagiarized}，否则视为判定失败。
 */
@Component
public class JudgmentResponseParser {

    private static final int SNIPPET_LENGTH = 100;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public JudgmentResult parse(String response) {
        if (response == null || response.isBlank()) {
            throw new JudgmentServiceException("模型返回空内容");
        }
        String cleaned = response.replace("```json", "").replace("```", "").trim();

        JsonNode json = readObject(cleaned);
        if (json == null) {
            int start = cleaned.indexOf('{');
            int end = cleaned.lastIndexOf('}');
            if (start >= 0 && end > start) {
                json = readObject(cleaned.substring(start, end + 1));
            }
        }
        if (json == null) {
            throw new JudgmentServiceException("无法解析模型响应: " + snippet(response));
        }

        JsonNode verdict = json.path("is_plagiarized");
        if (!verdict.isBoolean()) {
            throw new JudgmentServiceException("模型响应缺少 is_plagiarized 字段: " + snippet(response));
        }
        JsonNode reasoning = json.path("reasoning");
        return JudgmentResult.builder()
                .plagiarized(verdict.booleanValue())
                .reasoning(reasoning.isNull() ? "" : reasoning.asText(""))
                .build();
    }

    private JsonNode readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String snippet(String response) {
        String s = response.strip();
        return s.length() <= SNIPPET_LENGTH ? s : s.substring(0, SNIPPET_LENGTH) + "...";
    }
}
