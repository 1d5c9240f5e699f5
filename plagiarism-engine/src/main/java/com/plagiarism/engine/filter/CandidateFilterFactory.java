package com.plagiarism.engine.filter;

import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 候选筛选策略工厂，根据配置选择对应的实现。
 */
@Component
@RequiredArgsConstructor
public class CandidateFilterFactory {

    private final List<CandidateFilter> filters;
    private final EngineProperties properties;

    /**
     * 获取当前配置的筛选策略。
     */
    public CandidateFilter getFilter() {
        FilterMode target = properties.getFilterMode();
        return filters.stream()
                .filter(f -> f.getMode() == target)
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "未找到筛选策略: " + target + "，可选: threshold, top-percent"));
    }
}
