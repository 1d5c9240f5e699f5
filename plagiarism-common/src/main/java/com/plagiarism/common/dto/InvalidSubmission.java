package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 无效提交清单中的一项，与是否参与两两比对无关。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidSubmission {

    private String studentId;

    private String reason;
}
