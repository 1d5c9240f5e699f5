package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 语义判定服务的结论。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JudgmentResult {

    private boolean plagiarized;

    /** 服务返回的说明原文 */
    private String reasoning;
}
