package com.plagiarism.ai.prompt;

import com.plagiarism.ai.config.AiProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 抄袭判定 Prompt 模板。
 * <p>
 * 提示词从 classpath 下的 {@code prompts/plagiarism-judgment.md} 加载，
 * 修改提示词只需编辑 .md 文件并重启。模板中 {@code {codeA}}、{@code {codeB}} 为两份源码的占位符。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptTemplates {

    private static final String PROMPT_DIR = "prompts/";
    private static final String TRUNCATED_MARK = "\n... (已截断)";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(codeA|codeB)}");

    private final AiProperties properties;

    private String judgmentTemplate;

    @PostConstruct
    void loadPrompts() {
        judgmentTemplate = loadPrompt("plagiarism-judgment.md");
        log.info("已加载抄袭判定 Prompt 模板 (来自 classpath:prompts/)");
    }

    /**
     * 填充两份源码，超长源码按配置截断。占位符只替换一遍，源码中出现的占位符文本原样保留。
     */
    public String buildJudgmentPrompt(String codeA, String codeB) {
        String a = truncate(codeA);
        String b = truncate(codeB);
        Matcher matcher = PLACEHOLDER.matcher(judgmentTemplate);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = "codeA".equals(matcher.group(1)) ? a : b;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    String truncate(String code) {
        if (code == null) {
            return "";
        }
        int limit = properties.getMaxSourceChars();
        if (limit <= 0 || code.length() <= limit) {
            return code;
        }
        return code.substring(0, limit) + TRUNCATED_MARK;
    }

    private String loadPrompt(String filename) {
        try {
            ClassPathResource resource = new ClassPathResource(PROMPT_DIR + filename);
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("加载 Prompt: {} ({} 字符)", filename, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", filename, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + PROMPT_DIR + filename, e);
        }
    }
}
