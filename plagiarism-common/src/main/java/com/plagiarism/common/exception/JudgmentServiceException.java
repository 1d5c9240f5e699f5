package com.plagiarism.common.exception;

/**
 * 语义判定服务调用异常（超时、网络失败、响应格式错误等）。
 */
public class JudgmentServiceException extends PlagiarismException {

    public JudgmentServiceException(String message) {
        super("JUDGE_ERROR", message);
    }

    public JudgmentServiceException(String message, Throwable cause) {
        super("JUDGE_ERROR", message, cause);
    }
}
