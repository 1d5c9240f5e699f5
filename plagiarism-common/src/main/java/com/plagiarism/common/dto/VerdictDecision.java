package com.plagiarism.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 判定结果。{@code verdict} 为展示用结论，{@code cascadeVerdict} 保留三规则级联本身的结论。
 */
@Value
@Builder
public class VerdictDecision {

    Verdict verdict;

    Verdict cascadeVerdict;

    DecisionRule rule;

    String reasoning;

    boolean judgmentConsulted;

    /** 无效提交说明，双方都有效时为 null */
    String invalidNote;
}
