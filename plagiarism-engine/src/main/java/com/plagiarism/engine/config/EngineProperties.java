package com.plagiarism.engine.config;

import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.engine.filter.FilterMode;
import com.plagiarism.engine.filter.RankMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 检测引擎配置项。
 */
@Data
@ConfigurationProperties(prefix = "plagiarism.engine")
public class EngineProperties {

    /** 候选筛选策略: threshold / top-percent */
    private FilterMode filterMode = FilterMode.THRESHOLD;

    /** 源码聚合分阈值（严格大于才算可疑） */
    private double sourceThreshold = 0.8;

    /** HEX 编辑距离分阈值（严格大于才算可疑） */
    private double hexThreshold = 0.7;

    /** 前 P 比例策略的 P，取值 (0,1] */
    private double topPercent = 0.1;

    /** 前 P 比例策略的排名指标 */
    private RankMetric rankMetric = RankMetric.AGGREGATE;

    /** 语义判定不可用时的兜底阈值，固定 0.85，仅为测试开放覆盖 */
    private double fallbackThreshold = 0.85;

    /** 两两比对与判定阶段的工作线程数 */
    private int parallelism = 4;

    /** 是否按内容指纹缓存比对得分 */
    private boolean memoizationEnabled = true;

    /** 比对缓存最多保留的学生对条目数 */
    private long memoMaxEntries = 20_000;

    /** 比对缓存条目闲置多久后淘汰（分钟） */
    private int memoExpireMinutes = 60;

    /** 单次语义判定调用的超时时间（秒） */
    private int judgmentTimeoutSeconds = 60;

    /** 同时进行的语义判定调用数 */
    private int judgmentConcurrency = 4;

    /** 结构异常检测配置 */
    private AnomalyConfig anomaly = new AnomalyConfig();

    @Data
    public static class AnomalyConfig {

        /** 最少指令数（汇编按指令行，C 按语句） */
        private int minInstructionCount = 3;

        /** 关键指令集合，汇编作业至少出现其中一个；为空时跳过该检查 */
        private List<String> requiredInstructions = new ArrayList<>(List.of("mov"));

        /** 注释行与空行占总行数的上限 */
        private double maxCommentRatio = 0.6;

        /** 是否检查汇编的 ORG / END 伪指令 */
        private boolean directiveCheckEnabled = true;

        /** HEX 数据字节数低于此值视为数据不足 */
        private int insufficientDataBytes = 5;

        /** HEX 数据合理长度下限（字节） */
        private int minHexBytes = 8;

        /** HEX 数据合理长度上限（字节），默认 8051 片内外程序空间的常见上限 */
        private int maxHexBytes = 8192;
    }

    /**
     * 校验配置，任何比对开始之前调用；不合法时抛出 {@link ConfigurationException}。
     */
    public void validate() {
        if (filterMode == null) {
            throw new ConfigurationException("filter-mode 不能为空，可选: threshold, top-percent");
        }
        requireUnit("source-threshold", sourceThreshold);
        requireUnit("hex-threshold", hexThreshold);
        requireUnit("fallback-threshold", fallbackThreshold);
        if (!(topPercent > 0.0 && topPercent <= 1.0)) {
            throw new ConfigurationException("top-percent 必须在 (0,1] 范围内，当前: " + topPercent);
        }
        if (filterMode == FilterMode.TOP_PERCENT && rankMetric == null) {
            throw new ConfigurationException("top-percent 模式需要指定 rank-metric");
        }
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism 至少为 1，当前: " + parallelism);
        }
        if (memoMaxEntries < 1) {
            throw new ConfigurationException("memo-max-entries 至少为 1，当前: " + memoMaxEntries);
        }
        if (memoExpireMinutes < 1) {
            throw new ConfigurationException("memo-expire-minutes 至少为 1，当前: " + memoExpireMinutes);
        }
        if (judgmentConcurrency < 1) {
            throw new ConfigurationException("judgment-concurrency 至少为 1，当前: " + judgmentConcurrency);
        }
        if (judgmentTimeoutSeconds < 1) {
            throw new ConfigurationException("judgment-timeout-seconds 至少为 1，当前: " + judgmentTimeoutSeconds);
        }
        if (anomaly == null) {
            throw new ConfigurationException("anomaly 配置不能为空");
        }
        requireUnit("anomaly.max-comment-ratio", anomaly.getMaxCommentRatio());
        if (anomaly.getMinHexBytes() < 0 || anomaly.getMaxHexBytes() < anomaly.getMinHexBytes()) {
            throw new ConfigurationException("HEX 长度范围不合法: [" + anomaly.getMinHexBytes()
                    + ", " + anomaly.getMaxHexBytes() + "]");
        }
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " 必须在 [0,1] 范围内，当前: " + value);
        }
    }
}
