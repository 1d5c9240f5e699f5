package com.plagiarism.engine.filter;

import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * 前 P 比例策略：按指标降序排名，取前 {@code ceil(P × total)} 条。
 * <p>
 * 得分相同时按学生对标识升序，保证同样的输入每次选出同样的集合。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopPercentCandidateFilter implements CandidateFilter {

    private final EngineProperties properties;

    @Override
    public List<ComparisonRecord> select(List<ComparisonRecord> records) {
        RankMetric metric = properties.getRankMetric();
        int limit = selectionCount(properties.getTopPercent(), records.size());

        List<ComparisonRecord> candidates = records.stream()
                .sorted(Comparator.comparingDouble(metric::scoreOf).reversed()
                        .thenComparing(ComparisonRecord::getPair))
                .limit(limit)
                .toList();

        log.info("前 {}% 筛选 (指标 {}): {}/{} 条记录入选",
                properties.getTopPercent() * 100, metric, candidates.size(), records.size());
        return candidates;
    }

    /**
     * {@code ceil(P × total)}，用十进制计算，0.3 × 10 得 3 而不是 4。
     */
    static int selectionCount(double percent, int total) {
        return BigDecimal.valueOf(percent)
                .multiply(BigDecimal.valueOf(total))
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
    }

    @Override
    public FilterMode getMode() {
        return FilterMode.TOP_PERCENT;
    }
}
