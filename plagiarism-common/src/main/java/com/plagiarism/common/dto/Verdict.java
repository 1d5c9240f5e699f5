package com.plagiarism.common.dto;

/**
 * 最终判定。
 */
public enum Verdict {

    PLAGIARIZED("抄袭"),
    NOT_PLAGIARIZED("未抄袭"),
    INVALID_SUBMISSION("无效提交");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
