package com.plagiarism.engine.filter;

import com.plagiarism.common.dto.ComparisonRecord;

import java.util.List;

/**
 * 候选筛选策略接口。
 * <p>
 * 提供两种实现：
 * - {@link ThresholdCandidateFilter}：逐条按阈值判断
 * - {@link TopPercentCandidateFilter}：按指标排名取前 P 比例
 * <p>
 * 未入选的记录只计入统计，不进入判定，也不意味着"未抄袭"。
 */
public interface CandidateFilter {

    /**
     * 从全部比对记录中选出可疑记录。
     */
    List<ComparisonRecord> select(List<ComparisonRecord> records);

    /**
     * 对应的筛选策略。
     */
    FilterMode getMode();
}
