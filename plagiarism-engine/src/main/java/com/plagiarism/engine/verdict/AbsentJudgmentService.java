package com.plagiarism.engine.verdict;

import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.common.exception.JudgmentServiceException;

/**
 * 未配置语义判定服务时的实现，判定级联直接走算法兜底。
 */
public class AbsentJudgmentService implements JudgmentService {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public JudgmentResult judge(String codeA, String codeB) {
        throw new JudgmentServiceException("未配置语义判定服务");
    }

    @Override
    public String getName() {
        return "absent";
    }
}
