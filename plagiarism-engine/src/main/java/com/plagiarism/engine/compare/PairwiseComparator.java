package com.plagiarism.engine.compare;

import com.plagiarism.common.dto.ChannelScores;
import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.common.dto.PairKey;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.engine.config.EngineProperties;
import com.plagiarism.engine.similarity.SimilarityComputer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 两两比对：对每个无序学生对在源码、HEX 两个通道上计算两种相似度。
 * <p>
 * 至少有一个通道双方都有数据的学生对才会产生记录；某通道任一方无数据时该通道两项得分都为 0。
 * 每个学生对的计算只依赖这两份作业，在线程池中并行执行。
 */
@Slf4j
@Component
public class PairwiseComparator {

    private final Executor executor;
    private final ComparisonCache cache;
    private final EngineProperties properties;

    public PairwiseComparator(@Qualifier("comparisonExecutor") Executor executor,
                              ComparisonCache cache,
                              EngineProperties properties) {
        this.executor = executor;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * 比对全部学生对。
     *
     * @return 按学生对标识排序的比对记录，每个无序学生对至多一条
     */
    public List<ComparisonRecord> compareAll(List<Submission> submissions) {
        List<Submission> ordered = new ArrayList<>(submissions);
        ordered.sort(Comparator.comparing(Submission::getStudentId));

        int totalPairs = ordered.size() * (ordered.size() - 1) / 2;
        log.info("开始两两比对: {} 份作业, {} 个学生对, 并行度: {}",
                ordered.size(), totalPairs, properties.getParallelism());

        AtomicInteger skipped = new AtomicInteger();
        List<CompletableFuture<ComparisonRecord>> futures = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                Submission a = ordered.get(i);
                Submission b = ordered.get(j);
                if (!comparable(a, b)) {
                    skipped.incrementAndGet();
                    continue;
                }
                futures.add(CompletableFuture.supplyAsync(() -> compare(a, b), executor));
            }
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ComparisonRecord> records = new ArrayList<>(futures.size());
        for (CompletableFuture<ComparisonRecord> future : futures) {
            records.add(future.join());
        }
        records.sort(Comparator.comparing(ComparisonRecord::getPair));

        log.info("两两比对完成: 生成 {} 条记录, 跳过 {} 个无可比数据的学生对, 缓存 {} 条",
                records.size(), skipped.get(), properties.isMemoizationEnabled() ? cache.size() : 0);
        return records;
    }

    /**
     * 比对单个学生对，结果与参数顺序无关。
     */
    public ComparisonRecord compare(Submission x, Submission y) {
        Submission a = x.getStudentId().compareTo(y.getStudentId()) <= 0 ? x : y;
        Submission b = a == x ? y : x;

        ComparisonCache.CachedScores scores = properties.isMemoizationEnabled()
                ? cache.getOrCompute(a, b, () -> computeScores(a, b))
                : computeScores(a, b);

        ComparisonRecord record = ComparisonRecord.builder()
                .pair(PairKey.of(a.getStudentId(), b.getStudentId()))
                .source(scores.getSource())
                .hex(scores.getHex())
                .build();
        log.debug("{} vs {}: 源码 lcs={}, lev={}, HEX lcs={}, lev={}",
                a.getStudentId(), b.getStudentId(),
                record.getSource().getLcs(), record.getSource().getLevenshtein(),
                record.getHex().getLcs(), record.getHex().getLevenshtein());
        return record;
    }

    /**
     * 至少一个通道双方都有数据。
     */
    public static boolean comparable(Submission a, Submission b) {
        return (a.hasSourceData() && b.hasSourceData()) || (a.hasHexData() && b.hasHexData());
    }

    private ComparisonCache.CachedScores computeScores(Submission a, Submission b) {
        ChannelScores source = a.hasSourceData() && b.hasSourceData()
                ? SimilarityComputer.sourceScores(a.getSourceTokens(), b.getSourceTokens())
                : ChannelScores.ZERO;
        ChannelScores hex = a.hasHexData() && b.hasHexData()
                ? SimilarityComputer.hexScores(a.getHexBytes(), b.getHexBytes())
                : ChannelScores.ZERO;
        return new ComparisonCache.CachedScores(source, hex);
    }
}
