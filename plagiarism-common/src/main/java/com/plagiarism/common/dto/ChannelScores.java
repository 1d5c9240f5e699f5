package com.plagiarism.common.dto;

import lombok.Value;

/**
 * 单个通道上两种算法的得分，均在 [0,1]。
 */
@Value
public class ChannelScores {

    public static final ChannelScores ZERO = new ChannelScores(0.0, 0.0);

    /** token 序列（LCS）相似度 */
    double lcs;

    /** 编辑距离相似度 */
    double levenshtein;

    public double mean() {
        return (lcs + levenshtein) / 2.0;
    }
}
