package com.plagiarism.engine.filter;

import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 阈值策略：源码聚合分 > 源码阈值，或 HEX 编辑距离分 > HEX 阈值。
 * <p>
 * 每条记录独立判断，结果与输入顺序无关。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThresholdCandidateFilter implements CandidateFilter {

    private final EngineProperties properties;

    @Override
    public List<ComparisonRecord> select(List<ComparisonRecord> records) {
        double sourceThreshold = properties.getSourceThreshold();
        double hexThreshold = properties.getHexThreshold();

        List<ComparisonRecord> candidates = records.stream()
                .filter(r -> r.getAggregateSourceScore() > sourceThreshold
                        || r.getHexLevenshtein() > hexThreshold)
                .toList();

        log.info("阈值筛选 (源码 > {}, HEX > {}): {}/{} 条记录入选",
                sourceThreshold, hexThreshold, candidates.size(), records.size());
        return candidates;
    }

    @Override
    public FilterMode getMode() {
        return FilterMode.THRESHOLD;
    }
}
