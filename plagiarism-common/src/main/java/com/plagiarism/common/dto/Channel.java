package com.plagiarism.common.dto;

/**
 * 比较通道：源码或 HEX 输出。
 */
public enum Channel {
    SOURCE, HEX
}
