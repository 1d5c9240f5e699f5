package com.plagiarism.common.dto;

/**
 * 判定级联中命中的规则。
 */
public enum DecisionRule {
    /** HEX 输出逐字节相同 */
    EXACT_HEX,
    /** 外部语义判定服务 */
    EXTERNAL_JUDGMENT,
    /** 算法兜底阈值 */
    ALGORITHMIC_FALLBACK
}
