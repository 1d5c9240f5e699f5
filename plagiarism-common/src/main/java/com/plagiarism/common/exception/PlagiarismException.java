package com.plagiarism.common.exception;

import lombok.Getter;

/**
 * 检测系统各模块异常的父类。{@code errorCode} 原样出现在接口响应的 {@code code} 字段，
 * 如 {@code INTAKE_ERROR}、{@code CONFIG_ERROR}、{@code JUDGE_ERROR}、{@code KEY_EXHAUSTED}。
 */
@Getter
public class PlagiarismException extends RuntimeException {

    private final String errorCode;

    public PlagiarismException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public PlagiarismException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
