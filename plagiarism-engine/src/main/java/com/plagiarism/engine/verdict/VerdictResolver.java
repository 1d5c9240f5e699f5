package com.plagiarism.engine.verdict;

import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.common.dto.DecisionRule;
import com.plagiarism.common.dto.JudgmentResult;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.dto.Verdict;
import com.plagiarism.common.dto.VerdictDecision;
import com.plagiarism.engine.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 判定器：对每条可疑记录按顺序执行三条规则，首条命中即为结论。
 * <ol>
 *   <li>HEX 编辑距离分恰为 1.0：判定抄袭，不调用语义判定</li>
 *   <li>语义判定服务可用：以服务结论为准，说明原样保留；失败或超时落到规则 3</li>
 *   <li>算法兜底：max(源码聚合分, HEX 编辑距离分) &gt; 兜底阈值 即判定抄袭</li>
 * </ol>
 * 级联之后再叠加有效性：任一方无效且级联结论不是抄袭时，展示结论改为无效提交，级联结论与说明保留。
 */
@Slf4j
@Component
public class VerdictResolver {

    static final String EXACT_HEX_REASON = "HEX 输出完全相同 (100%)";

    private final JudgmentService judgmentService;
    private final ExecutorService judgmentExecutor;
    private final EngineProperties properties;

    @Autowired
    public VerdictResolver(ObjectProvider<JudgmentService> judgmentServices,
                           @Qualifier("judgmentExecutor") ExecutorService judgmentExecutor,
                           EngineProperties properties) {
        this(judgmentServices.getIfAvailable(AbsentJudgmentService::new), judgmentExecutor, properties);
    }

    public VerdictResolver(JudgmentService judgmentService, ExecutorService judgmentExecutor,
                           EngineProperties properties) {
        this.judgmentService = judgmentService;
        this.judgmentExecutor = judgmentExecutor;
        this.properties = properties;
        log.info("语义判定服务: {} (可用: {})", judgmentService.getName(), judgmentService.isAvailable());
    }

    /**
     * 对一条可疑记录给出判定。{@code a}、{@code b} 为记录中的两份作业，顺序不限。
     */
    public VerdictDecision resolve(ComparisonRecord record, Submission a, Submission b) {
        VerdictDecision cascade = runCascade(record, a, b);
        VerdictDecision decision = applyValidity(cascade, a, b);
        log.debug("{} 判定: {} (规则 {})", record.getPair().getId(), decision.getVerdict(), decision.getRule());
        return decision;
    }

    // ======================== 三规则级联 ========================

    private VerdictDecision runCascade(ComparisonRecord record, Submission a, Submission b) {
        // 规则 1
        if (record.getHexLevenshtein() == 1.0) {
            return VerdictDecision.builder()
                    .verdict(Verdict.PLAGIARIZED)
                    .cascadeVerdict(Verdict.PLAGIARIZED)
                    .rule(DecisionRule.EXACT_HEX)
                    .reasoning(EXACT_HEX_REASON)
                    .judgmentConsulted(false)
                    .build();
        }

        // 规则 2
        String unavailableReason = null;
        boolean consulted = false;
        if (judgmentService.isAvailable()) {
            consulted = true;
            try {
                JudgmentResult result = consultJudgment(record, a, b);
                Verdict verdict = result.isPlagiarized() ? Verdict.PLAGIARIZED : Verdict.NOT_PLAGIARIZED;
                return VerdictDecision.builder()
                        .verdict(verdict)
                        .cascadeVerdict(verdict)
                        .rule(DecisionRule.EXTERNAL_JUDGMENT)
                        .reasoning(result.getReasoning())
                        .judgmentConsulted(true)
                        .build();
            } catch (JudgmentUnavailableException e) {
                unavailableReason = e.getMessage();
                log.warn("{} 语义判定不可用，改用算法兜底: {}", record.getPair().getId(), e.getMessage());
            }
        }

        // 规则 3
        return fallback(record, consulted, unavailableReason);
    }

    private VerdictDecision fallback(ComparisonRecord record, boolean consulted, String unavailableReason) {
        double aggregate = record.getAggregateSourceScore();
        double hex = record.getHexLevenshtein();
        double threshold = properties.getFallbackThreshold();
        boolean sourceLeads = aggregate >= hex;
        String leader = sourceLeads ? "源码聚合分" : "HEX 编辑距离分";
        double peak = Math.max(aggregate, hex);
        boolean plagiarized = peak > threshold;

        StringBuilder reasoning = new StringBuilder();
        if (unavailableReason != null) {
            reasoning.append("语义判定不可用 (").append(unavailableReason).append(") - ");
        }
        reasoning.append("算法分析: ")
                .append(leader)
                .append(String.format(Locale.ROOT, " %.2f %s %.2f", peak, plagiarized ? ">" : "未超过", threshold))
                .append(String.format(Locale.ROOT, " (源码聚合=%.2f, HEX=%.2f)", aggregate, hex));

        Verdict verdict = plagiarized ? Verdict.PLAGIARIZED : Verdict.NOT_PLAGIARIZED;
        return VerdictDecision.builder()
                .verdict(verdict)
                .cascadeVerdict(verdict)
                .rule(DecisionRule.ALGORITHMIC_FALLBACK)
                .reasoning(reasoning.toString())
                .judgmentConsulted(consulted)
                .build();
    }

    /**
     * 在判定线程池中调用语义判定服务，超时则取消该次调用。
     */
    private JudgmentResult consultJudgment(ComparisonRecord record, Submission a, Submission b) {
        int timeout = properties.getJudgmentTimeoutSeconds();
        Future<JudgmentResult> future = judgmentExecutor.submit(
                () -> judgmentService.judge(a.getSourceText(), b.getSourceText()));
        try {
            JudgmentResult result = future.get(timeout, TimeUnit.SECONDS);
            if (result == null) {
                throw new JudgmentUnavailableException("判定服务返回空结果");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new JudgmentUnavailableException("调用超时 (" + timeout + " 秒)");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("{} 语义判定调用失败", record.getPair().getId(), cause);
            throw new JudgmentUnavailableException(cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new JudgmentUnavailableException("等待判定结果时被中断");
        }
    }

    // ======================== 有效性叠加 ========================

    private VerdictDecision applyValidity(VerdictDecision cascade, Submission a, Submission b) {
        List<String> invalid = new ArrayList<>();
        for (Submission s : List.of(a, b)) {
            if (!s.isValid()) {
                invalid.add(s.getStudentId());
            }
        }
        if (invalid.isEmpty()) {
            return cascade;
        }

        String note = "无效提交: " + String.join(", ", invalid);
        Verdict shown = cascade.getCascadeVerdict() == Verdict.PLAGIARIZED
                ? Verdict.PLAGIARIZED
                : Verdict.INVALID_SUBMISSION;
        return VerdictDecision.builder()
                .verdict(shown)
                .cascadeVerdict(cascade.getCascadeVerdict())
                .rule(cascade.getRule())
                .reasoning(cascade.getReasoning())
                .judgmentConsulted(cascade.isJudgmentConsulted())
                .invalidNote(note)
                .build();
    }

    /**
     * 本次判定调用不可用（失败、超时、空结果），只在本类内部用于落到规则 3。
     */
    private static class JudgmentUnavailableException extends RuntimeException {
        JudgmentUnavailableException(String message) {
            super(message);
        }
    }
}
