package com.plagiarism.engine.similarity;

import com.plagiarism.common.dto.ChannelScores;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 两种序列相似度算法：基于最长公共子序列的 token 序列相似度，以及基于编辑距离的相似度。
 * <p>
 * 两者均为纯函数、对参数交换对称，空序列按约定取值：双方都为空得 1.0，仅一方为空得 0.0。
 * 动态规划只保留两行，内存为 O(min(n,m))，可处理数千 token 的作业。
 */
public final class SimilarityComputer {

    private SimilarityComputer() {
    }

    // ======================== 通道得分 ========================

    /**
     * 源码通道：LCS 基于 token，编辑距离基于清洗后文本的字符。
     */
    public static ChannelScores sourceScores(List<String> tokensA, List<String> tokensB) {
        return new ChannelScores(
                tokenSequence(tokensA, tokensB),
                levenshtein(String.join(" ", tokensA), String.join(" ", tokensB)));
    }

    /**
     * HEX 通道：两种算法都基于数据字节序列。
     */
    public static ChannelScores hexScores(byte[] a, byte[] b) {
        return new ChannelScores(tokenSequence(a, b), levenshtein(a, b));
    }

    // ======================== token 序列相似度 ========================

    /**
     * {@code 2·LCS / (n+m)}，token 按字符串相等比较。
     */
    public static double tokenSequence(List<String> a, List<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> dictionary = new HashMap<>();
        int[] x = encode(a, dictionary);
        int[] y = encode(b, dictionary);
        return 2.0 * lcsLength(x, y) / (x.length + y.length);
    }

    public static double tokenSequence(byte[] a, byte[] b) {
        if (a.length == 0 && b.length == 0) {
            return 1.0;
        }
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        return 2.0 * lcsLength(unsigned(a), unsigned(b)) / (a.length + b.length);
    }

    // ======================== 编辑距离相似度 ========================

    /**
     * {@code (n+m-D) / (n+m)}，D 为插入/删除/替换单位代价的编辑距离，按字符计算。
     */
    public static double levenshtein(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int[] x = a.chars().toArray();
        int[] y = b.chars().toArray();
        return ratio(editDistance(x, y), x.length + y.length);
    }

    public static double levenshtein(byte[] a, byte[] b) {
        if (a.length == 0 && b.length == 0) {
            return 1.0;
        }
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        return ratio(editDistance(unsigned(a), unsigned(b)), a.length + b.length);
    }

    // ======================== 动态规划 ========================

    /**
     * 最长公共子序列长度（保持顺序，允许间隔）。
     */
    public static int lcsLength(int[] a, int[] b) {
        if (b.length > a.length) {
            int[] t = a;
            a = b;
            b = t;
        }
        int m = b.length;
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 1; i <= a.length; i++) {
            int ai = a[i - 1];
            for (int j = 1; j <= m; j++) {
                if (ai == b[j - 1]) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] t = prev;
            prev = curr;
            curr = t;
        }
        return prev[m];
    }

    /**
     * 单位代价编辑距离。
     */
    public static int editDistance(int[] a, int[] b) {
        if (b.length > a.length) {
            int[] t = a;
            a = b;
            b = t;
        }
        int m = b.length;
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            curr[0] = i;
            int ai = a[i - 1];
            for (int j = 1; j <= m; j++) {
                int substitution = prev[j - 1] + (ai == b[j - 1] ? 0 : 1);
                int deletion = prev[j] + 1;
                int insertion = curr[j - 1] + 1;
                curr[j] = Math.min(substitution, Math.min(deletion, insertion));
            }
            int[] t = prev;
            prev = curr;
            curr = t;
        }
        return prev[m];
    }

    private static double ratio(int distance, int totalLength) {
        return (double) (totalLength - distance) / totalLength;
    }

    private static int[] encode(List<String> tokens, Map<String, Integer> dictionary) {
        int[] codes = new int[tokens.size()];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = dictionary.computeIfAbsent(tokens.get(i), k -> dictionary.size());
        }
        return codes;
    }

    private static int[] unsigned(byte[] bytes) {
        int[] codes = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            codes[i] = bytes[i] & 0xFF;
        }
        return codes;
    }
}
