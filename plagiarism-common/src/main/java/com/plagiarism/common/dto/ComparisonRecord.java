package com.plagiarism.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 一对作业的比对记录，得分计算完成后不可变。
 */
@Value
@Builder
public class ComparisonRecord {

    PairKey pair;

    @Builder.Default
    ChannelScores source = ChannelScores.ZERO;

    @Builder.Default
    ChannelScores hex = ChannelScores.ZERO;

    /** 源码聚合分：源码通道两种算法的算术平均，HEX 不计入 */
    public double getAggregateSourceScore() {
        return source.mean();
    }

    public double getHexLevenshtein() {
        return hex.getLevenshtein();
    }

    /** 源码聚合分与 HEX 编辑距离分中的较大者，用于排序与兜底判定 */
    public double getPeakScore() {
        return Math.max(getAggregateSourceScore(), getHexLevenshtein());
    }
}
