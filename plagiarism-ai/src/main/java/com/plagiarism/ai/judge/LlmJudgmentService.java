package com.plagiarism.ai.judge;

import com.plagiarism.ai.prompt.PromptTemplates;
import com.plagiarism.ai.provider.AiProvider;
import com.plagiarism.ai.provider.AiProviderFactory;
import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.dispatcher.pool.ApiKeyPool;
import com.plagiarism.dispatcher.service.DispatcherService;
import com.plagiarism.engine.verdict.JudgmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 基于大模型的语义判定。
 * <p>
 * 每次判定经 {@link DispatcherService} 借用 API Key 调用当前提供商，
 * 响应解析失败与调用失败一样按调度配置重试，重试耗尽后抛出 JudgmentServiceException。
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "plagiarism.ai.enabled", havingValue = "true")
public class LlmJudgmentService implements JudgmentService {

    private final AiProviderFactory providerFactory;
    private final PromptTemplates promptTemplates;
    private final JudgmentResponseParser responseParser;
    private final DispatcherService dispatcherService;
    private final ApiKeyPool keyPool;

    /**
     * 池中有 Key（含冷却中的失败 Key）即视为可用。
     */
    @Override
    public boolean isAvailable() {
        return keyPool.availableCount() + keyPool.failedCount() > 0;
    }

    @Override
    public JudgmentResult judge(String codeA, String codeB) {
        AiProvider provider = providerFactory.getProvider();
        String prompt = promptTemplates.buildJudgmentPrompt(codeA, codeB);
        long start = System.currentTimeMillis();

        JudgmentResult result = dispatcherService.execute(
                apiKey -> responseParser.parse(provider.complete(prompt, apiKey)));

        log.debug("{} 判定完成: {} (耗时 {}ms)", provider.getProviderName(),
                result.isPlagiarized() ? "抄袭" : "未抄袭", System.currentTimeMillis() - start);
        return result;
    }

    @Override
    public String getName() {
        return "llm";
    }
}
