package com.plagiarism.common.exception;

/**
 * 配置错误（筛选模式非法、阈值越界等），在任何比对开始之前抛出。
 */
public class ConfigurationException extends PlagiarismException {

    public ConfigurationException(String message) {
        super("CONFIG_ERROR", message);
    }
}
