package com.plagiarism.engine.filter;

/**
 * 候选筛选策略，两者互斥。
 */
public enum FilterMode {
    /** 源码聚合分或 HEX 编辑距离分超过阈值 */
    THRESHOLD,
    /** 按指标排名取前 P 比例 */
    TOP_PERCENT
}
