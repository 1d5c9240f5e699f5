package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 一次检测的完整输出。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {

    /** 检测任务ID */
    private String runId;

    /** 使用的筛选策略 */
    private String filterMode;

    /** 作业总数 */
    private int totalSubmissions;

    /** 产生比对记录的学生对数 */
    private int totalComparisons;

    /** 进入判定的可疑对数 */
    private int candidateCount;

    /** 判定为抄袭的对数 */
    private int plagiarizedCount;

    /** 可疑对的判定结果，按峰值得分降序 */
    private List<VerdictRecord> verdicts;

    /** 无效提交清单 */
    private List<InvalidSubmission> invalidSubmissions;

    /** 学号 -> 异常标记，仅包含有异常的学生 */
    private Map<String, List<AnomalyTag>> anomalyWarnings;

    /** 处理耗时（毫秒） */
    private long processingTimeMs;

    /** 检测时间（yyyy-MM-dd HH:mm:ss） */
    private String createdAt;
}
