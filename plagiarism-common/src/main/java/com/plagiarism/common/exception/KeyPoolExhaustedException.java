package com.plagiarism.common.exception;

/**
 * 在借用超时内没有拿到可用的 API Key。
 * 判定器把它当作一次判定不可用，转入算法兜底。
 */
public class KeyPoolExhaustedException extends PlagiarismException {

    public KeyPoolExhaustedException(String message) {
        super("KEY_EXHAUSTED", message);
    }

    public KeyPoolExhaustedException(String message, Throwable cause) {
        super("KEY_EXHAUSTED", message, cause);
    }
}
