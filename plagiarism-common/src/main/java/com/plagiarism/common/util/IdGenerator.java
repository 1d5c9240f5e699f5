package com.plagiarism.common.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 检测任务编号。格式 {@code run-yyyyMMdd-HHmmss-xxxxxx}，按字典序即按启动时间排序，
 * 末尾 6 位随机串区分同一秒内启动的任务。
 */
public final class IdGenerator {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private IdGenerator() {
    }

    public static String runId() {
        return runId(LocalDateTime.now());
    }

    static String runId(LocalDateTime startedAt) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return "run-" + startedAt.format(STAMP) + "-" + random;
    }
}
