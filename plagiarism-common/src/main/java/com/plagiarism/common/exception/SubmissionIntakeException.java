package com.plagiarism.common.exception;

/**
 * 作业采集异常（作业根目录不存在、无法遍历等）。
 * <p>
 * 单个文件读取失败不抛出此异常，只影响该学生的有效性。
 */
public class SubmissionIntakeException extends PlagiarismException {

    public SubmissionIntakeException(String message) {
        super("INTAKE_ERROR", message);
    }

    public SubmissionIntakeException(String message, Throwable cause) {
        super("INTAKE_ERROR", message, cause);
    }
}
