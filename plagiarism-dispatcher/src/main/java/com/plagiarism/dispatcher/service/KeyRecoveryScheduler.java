package com.plagiarism.dispatcher.service;

import com.plagiarism.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 定时把冷却期满的失败 Key 放回可用池，冷却时长由 Key 池自己判断。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeyRecoveryScheduler {

    private final ApiKeyPool keyPool;

    @Scheduled(fixedDelayString = "${plagiarism.dispatcher.key-recovery-interval-seconds:10}",
            initialDelayString = "${plagiarism.dispatcher.key-recovery-interval-seconds:10}",
            timeUnit = TimeUnit.SECONDS)
    public void recoverKeys() {
        if (keyPool.failedCount() == 0) {
            return;
        }
        int recovered = keyPool.recoverFailedKeys();
        if (recovered > 0) {
            log.info("{} 个 Key 冷却完毕已恢复，可用 {} 个，仍在冷却 {} 个",
                    recovered, keyPool.availableCount(), keyPool.failedCount());
        }
    }
}
