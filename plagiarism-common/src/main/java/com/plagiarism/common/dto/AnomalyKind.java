package com.plagiarism.common.dto;

/**
 * 结构异常类别。异常只作为警告展示，不影响抄袭判定。
 */
public enum AnomalyKind {

    MISSING_EOF_RECORD("缺少 EOF 记录"),
    MALFORMED_HEX_RECORD("HEX 记录格式错误"),
    LENGTH_OUTLIER("HEX 长度异常"),
    INSUFFICIENT_DATA("HEX 数据不足"),
    TOO_FEW_INSTRUCTIONS("指令数过少"),
    MISSING_KEY_INSTRUCTION("缺少关键指令"),
    EXCESSIVE_COMMENT_RATIO("注释或空行比例过高"),
    MISSING_ORG_DIRECTIVE("缺少 ORG 伪指令"),
    MISSING_END_DIRECTIVE("缺少 END 伪指令");

    private final String label;

    AnomalyKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
