package com.plagiarism.engine.service;

import com.plagiarism.common.dto.AnomalyTag;
import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.common.dto.DetectionReport;
import com.plagiarism.common.dto.InvalidSubmission;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.dto.Verdict;
import com.plagiarism.common.dto.VerdictDecision;
import com.plagiarism.common.dto.VerdictRecord;
import com.plagiarism.common.exception.SubmissionIntakeException;
import com.plagiarism.common.util.IdGenerator;
import com.plagiarism.engine.anomaly.AnomalyDetector;
import com.plagiarism.engine.compare.PairwiseComparator;
import com.plagiarism.engine.config.EngineProperties;
import com.plagiarism.engine.filter.CandidateFilter;
import com.plagiarism.engine.filter.CandidateFilterFactory;
import com.plagiarism.engine.verdict.VerdictResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 检测流水线：异常检测 → 两两比对 → 候选筛选 → 逐对判定 → 汇总报告。
 * <p>
 * 输入为已载入的作业列表，学号在一次检测内必须唯一。
 */
@Slf4j
@Service
public class DetectionService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AnomalyDetector anomalyDetector;
    private final PairwiseComparator comparator;
    private final CandidateFilterFactory filterFactory;
    private final VerdictResolver verdictResolver;
    private final Executor executor;
    private final EngineProperties properties;

    public DetectionService(AnomalyDetector anomalyDetector,
                            PairwiseComparator comparator,
                            CandidateFilterFactory filterFactory,
                            VerdictResolver verdictResolver,
                            @Qualifier("comparisonExecutor") Executor executor,
                            EngineProperties properties) {
        this.anomalyDetector = anomalyDetector;
        this.comparator = comparator;
        this.filterFactory = filterFactory;
        this.verdictResolver = verdictResolver;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * 对一批作业执行完整检测。
     */
    public DetectionReport detect(List<Submission> submissions) {
        properties.validate();
        long startTime = System.currentTimeMillis();
        String runId = IdGenerator.runId();
        Map<String, Submission> byId = indexById(submissions);
        CandidateFilter filter = filterFactory.getFilter();

        log.info("开始检测任务 {}: {} 份作业, 筛选策略: {}", runId, submissions.size(), filter.getMode());

        anomalyDetector.inspectAll(submissions);

        List<ComparisonRecord> records = comparator.compareAll(submissions);
        List<ComparisonRecord> candidates = filter.select(records);
        log.info("任务 {} 候选筛选: {}/{} 个学生对进入判定", runId, candidates.size(), records.size());

        List<VerdictRecord> verdicts = resolveAll(candidates, byId);
        int plagiarized = (int) verdicts.stream()
                .filter(v -> v.getVerdict() == Verdict.PLAGIARIZED)
                .count();

        DetectionReport report = DetectionReport.builder()
                .runId(runId)
                .filterMode(filter.getMode().name())
                .totalSubmissions(submissions.size())
                .totalComparisons(records.size())
                .candidateCount(candidates.size())
                .plagiarizedCount(plagiarized)
                .verdicts(verdicts)
                .invalidSubmissions(collectInvalid(submissions))
                .anomalyWarnings(collectAnomalies(submissions))
                .processingTimeMs(System.currentTimeMillis() - startTime)
                .createdAt(LocalDateTime.now().format(TIME_FORMAT))
                .build();

        log.info("检测任务 {} 完成: 可疑 {} 对, 判定抄袭 {} 对, 无效提交 {} 份, 耗时 {}ms",
                runId, candidates.size(), plagiarized, report.getInvalidSubmissions().size(),
                report.getProcessingTimeMs());
        return report;
    }

    private Map<String, Submission> indexById(List<Submission> submissions) {
        Map<String, Submission> byId = new HashMap<>();
        Set<String> duplicates = new HashSet<>();
        for (Submission s : submissions) {
            if (byId.putIfAbsent(s.getStudentId(), s) != null) {
                duplicates.add(s.getStudentId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new SubmissionIntakeException("学号重复: " + String.join(", ", duplicates));
        }
        return byId;
    }

    /**
     * 各可疑对的判定互不依赖，并行执行；结果按峰值得分降序、学生对升序排列。
     */
    private List<VerdictRecord> resolveAll(List<ComparisonRecord> candidates, Map<String, Submission> byId) {
        List<CompletableFuture<Resolved>> futures = new ArrayList<>(candidates.size());
        for (ComparisonRecord record : candidates) {
            Submission a = byId.get(record.getPair().getStudentA());
            Submission b = byId.get(record.getPair().getStudentB());
            futures.add(CompletableFuture.supplyAsync(
                    () -> new Resolved(record, verdictResolver.resolve(record, a, b), a, b), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparingDouble((Resolved r) -> r.record.getPeakScore()).reversed()
                        .thenComparing(r -> r.record.getPair()))
                .map(Resolved::toVerdictRecord)
                .toList();
    }

    private List<InvalidSubmission> collectInvalid(List<Submission> submissions) {
        return submissions.stream()
                .filter(s -> !s.isValid())
                .sorted(Comparator.comparing(Submission::getStudentId))
                .map(s -> InvalidSubmission.builder()
                        .studentId(s.getStudentId())
                        .reason(s.getInvalidReason())
                        .build())
                .toList();
    }

    private Map<String, List<AnomalyTag>> collectAnomalies(List<Submission> submissions) {
        Map<String, List<AnomalyTag>> warnings = new LinkedHashMap<>();
        submissions.stream()
                .filter(s -> !s.getAnomalies().isEmpty())
                .sorted(Comparator.comparing(Submission::getStudentId))
                .forEach(s -> warnings.put(s.getStudentId(), List.copyOf(s.getAnomalies())));
        return warnings;
    }

    private static final class Resolved {
        private final ComparisonRecord record;
        private final VerdictDecision decision;
        private final Submission a;
        private final Submission b;

        private Resolved(ComparisonRecord record, VerdictDecision decision, Submission a, Submission b) {
            this.record = record;
            this.decision = decision;
            this.a = a;
            this.b = b;
        }

        private VerdictRecord toVerdictRecord() {
            return VerdictRecord.builder()
                    .studentA(record.getPair().getStudentA())
                    .studentB(record.getPair().getStudentB())
                    .sourceScores(record.getSource())
                    .hexScores(record.getHex())
                    .aggregateSourceScore(record.getAggregateSourceScore())
                    .verdict(decision.getVerdict())
                    .cascadeVerdict(decision.getCascadeVerdict())
                    .decisionRule(decision.getRule())
                    .reasoning(decision.getReasoning())
                    .judgmentConsulted(decision.isJudgmentConsulted())
                    .invalidNote(decision.getInvalidNote())
                    .anomaliesA(List.copyOf(a.getAnomalies()))
                    .anomaliesB(List.copyOf(b.getAnomalies()))
                    .build();
        }
    }
}
