package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 附加在作业上的异常标记。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyTag {

    private AnomalyKind kind;

    /** 可读的详情，如 "数据长度 3 字节，低于 5 字节" */
    private String detail;

    public static AnomalyTag of(AnomalyKind kind, String detail) {
        return new AnomalyTag(kind, detail);
    }
}
