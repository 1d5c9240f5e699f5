package com.plagiarism.ai.judge;

import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.common.exception.JudgmentServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JudgmentResponseParserTest {

    private final JudgmentResponseParser parser = new JudgmentResponseParser();

    @Test
    void parsesPlainJson() {
        JudgmentResult result = parser.parse("{\"reasoning\": \"控制流程一致\", \"is_plagiarized\": true}");

        assertThat(result.isPlagiarized()).isTrue();
        assertThat(result.getReasoning()).isEqualTo("控制流程一致");
    }

    @Test
    void stripsMarkdownFence() {
        JudgmentResult result = parser.parse("```json\n{\"reasoning\": \"延时子程序不同\", \"is_plagiarized\": false}\n```");

        assertThat(result.isPlagiarized()).isFalse();
        assertThat(result.getReasoning()).isEqualTo("延时子程序不同");
    }

    @Test
    void extractsObjectFromSurroundingAnalysis() {
        String response = "两份程序都使用 R7 计数。\n结论如下：\n"
                + "{\"reasoning\": \"仅标号改名\", \"is_plagiarized\": true}\n以上。";

        JudgmentResult result = parser.parse(response);

        assertThat(result.isPlagiarized()).isTrue();
        assertThat(result.getReasoning()).isEqualTo("仅标号改名");
    }

    @Test
    void missingReasoningDefaultsToEmpty() {
        JudgmentResult result = parser.parse("{\"is_plagiarized\": false}");

        assertThat(result.isPlagiarized()).isFalse();
        assertThat(result.getReasoning()).isEmpty();
    }

    @Test
    void rejectsResponseWithoutVerdict() {
        assertThatThrownBy(() -> parser.parse("{\"reasoning\": \"无法判断\"}"))
                .isInstanceOf(JudgmentServiceException.class)
                .hasMessageContaining("is_plagiarized");
    }

    @Test
    void rejectsNonBooleanVerdict() {
        assertThatThrownBy(() -> parser.parse("{\"is_plagiarized\": \"maybe\"}"))
                .isInstanceOf(JudgmentServiceException.class);
    }

    @Test
    void rejectsTextWithoutJson() {
        assertThatThrownBy(() -> parser.parse("我认为这两份代码很相似"))
                .isInstanceOf(JudgmentServiceException.class)
                .hasMessageContaining("无法解析");
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(JudgmentServiceException.class);
    }
}
