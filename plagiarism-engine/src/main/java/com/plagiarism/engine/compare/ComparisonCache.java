package com.plagiarism.engine.compare;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.plagiarism.common.dto.ChannelScores;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.engine.config.EngineProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 比对得分缓存，键为两份作业内容指纹的无序组合，与学号无关。
 * <p>
 * 同一批作业重复检测时直接复用得分。条目数上限为 {@code memo-max-entries}，
 * 超过 {@code memo-expire-minutes} 未被访问的条目会被淘汰。
 */
@Slf4j
@Component
public class ComparisonCache {

    private final Cache<String, CachedScores> cache;

    @Value
    public static class CachedScores {
        ChannelScores source;
        ChannelScores hex;
    }

    @Autowired
    public ComparisonCache(EngineProperties properties) {
        this(properties, null);
    }

    /** {@code maintenanceExecutor} 为 null 时使用 Caffeine 默认的后台线程池 */
    ComparisonCache(EngineProperties properties, Executor maintenanceExecutor) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(properties.getMemoMaxEntries())
                .expireAfterAccess(Duration.ofMinutes(properties.getMemoExpireMinutes()));
        if (maintenanceExecutor != null) {
            builder.executor(maintenanceExecutor);
        }
        this.cache = builder.build();
        log.info("比对缓存: 最多 {} 条, 闲置 {} 分钟淘汰",
                properties.getMemoMaxEntries(), properties.getMemoExpireMinutes());
    }

    public CachedScores getOrCompute(Submission a, Submission b, Supplier<CachedScores> computation) {
        return cache.get(keyOf(a, b), key -> computation.get());
    }

    /** 当前条目数，先执行待处理的淘汰 */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static String keyOf(Submission a, Submission b) {
        String ha = a.getContentHash();
        String hb = b.getContentHash();
        return ha.compareTo(hb) <= 0 ? ha + ":" + hb : hb + ":" + ha;
    }
}
