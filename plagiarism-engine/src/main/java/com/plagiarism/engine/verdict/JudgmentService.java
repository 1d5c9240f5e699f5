package com.plagiarism.engine.verdict;

import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.common.exception.JudgmentServiceException;

/**
 * 外部语义判定能力。
 * <p>
 * 提供两种实现：
 * - {@link AbsentJudgmentService}：未配置判定服务时使用，始终不可用
 * - 大模型实现（plagiarism-ai 模块），开启 {@code plagiarism.ai.enabled} 后注册
 */
public interface JudgmentService {

    /**
     * 判定服务是否已配置且可调用。
     */
    boolean isAvailable();

    /**
     * 对两段源码做抄袭判定（阻塞式）。
     *
     * @param codeA 学生 A 的源码
     * @param codeB 学生 B 的源码
     * @return 判定结论与说明
     * @throws JudgmentServiceException 调用失败或响应无法解析
     */
    JudgmentResult judge(String codeA, String codeB);

    /**
     * 服务名称，用于日志。
     */
    String getName();
}
