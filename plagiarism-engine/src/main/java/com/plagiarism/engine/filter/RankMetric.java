package com.plagiarism.engine.filter;

import com.plagiarism.common.dto.ComparisonRecord;

import java.util.function.ToDoubleFunction;

/**
 * 前 P 比例策略的排名指标，均取自源码通道。
 */
public enum RankMetric {

    AGGREGATE(ComparisonRecord::getAggregateSourceScore),
    TOKEN_SEQUENCE(r -> r.getSource().getLcs()),
    EDIT_DISTANCE(r -> r.getSource().getLevenshtein());

    private final ToDoubleFunction<ComparisonRecord> extractor;

    RankMetric(ToDoubleFunction<ComparisonRecord> extractor) {
        this.extractor = extractor;
    }

    public double scoreOf(ComparisonRecord record) {
        return extractor.applyAsDouble(record);
    }
}
