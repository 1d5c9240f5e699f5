package com.plagiarism.common.dto;

import com.plagiarism.common.util.ContentHasher;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 一名学生的作业：清洗后的源码 token 序列、HEX 解析结果、原始源文件与有效性。
 * <p>
 * 创建后除异常标记外不再修改，可在比对线程间只读共享。
 */
@Getter
public class Submission {

    private final String studentId;

    private final List<SourceUnit> sourceUnits;

    /** 去注释、归一化空白并转小写后的 token 序列 */
    private final List<String> sourceTokens;

    private final HexImage hex;

    /** 必需文件缺失或清洗后为空时为 false */
    private final boolean valid;

    private final String invalidReason;

    /** 最近一次结构检测的结果，重复检测时整体替换 */
    private volatile List<AnomalyTag> anomalies = List.of();

    private volatile String contentHash;

    @Builder
    private Submission(String studentId, List<SourceUnit> sourceUnits, List<String> sourceTokens,
                       HexImage hex, boolean valid, String invalidReason) {
        this.studentId = studentId;
        this.sourceUnits = sourceUnits == null ? List.of() : List.copyOf(sourceUnits);
        this.sourceTokens = sourceTokens == null ? List.of() : List.copyOf(sourceTokens);
        this.hex = hex == null ? HexImage.empty() : hex;
        this.valid = valid;
        this.invalidReason = valid ? null : invalidReason;
    }

    /**
     * 根据文件情况与清洗结果创建作业并判定有效性。
     */
    public static Submission of(String studentId, List<SourceUnit> sourceUnits, List<String> sourceTokens,
                                HexImage hex, FilePresence presence) {
        HexImage image = hex == null ? HexImage.empty() : hex;
        List<String> reasons = new ArrayList<>();

        if (!presence.isSourceFilePresent()) {
            if (presence.getExtensionsFound() == null || presence.getExtensionsFound().isEmpty()) {
                reasons.add("未找到任何文件");
            } else {
                reasons.add("找到 " + String.join(", ", presence.getExtensionsFound())
                        + " 文件，但需要 .a51 / .asm 或 .c 源文件");
            }
        } else if (sourceTokens == null || sourceTokens.isEmpty()) {
            reasons.add("源代码清洗后为空");
        }

        if (!presence.isHexFilePresent()) {
            reasons.add("未找到 hex 文件");
        } else if (image.getDataLength() == 0) {
            reasons.add("未找到有效的 hex 数据");
        }

        return Submission.builder()
                .studentId(studentId)
                .sourceUnits(sourceUnits)
                .sourceTokens(sourceTokens)
                .hex(image)
                .valid(reasons.isEmpty())
                .invalidReason(reasons.isEmpty() ? null : "无效提交：" + String.join(" | ", reasons))
                .build();
    }

    public boolean hasSourceData() {
        return !sourceTokens.isEmpty();
    }

    public boolean hasHexData() {
        return hex.getDataLength() > 0;
    }

    public byte[] getHexBytes() {
        return hex.getDataBytes();
    }

    /**
     * 清洗后的源码文本（token 以单个空格连接），编辑距离按字符在此文本上计算。
     */
    public String getCleanedSource() {
        return String.join(" ", sourceTokens);
    }

    /**
     * 提交给语义判定服务的源码原文，多个文件以文件名分隔；没有原文时退回清洗文本。
     */
    public String getSourceText() {
        if (sourceUnits.isEmpty()) {
            return getCleanedSource();
        }
        StringBuilder sb = new StringBuilder();
        for (SourceUnit unit : sourceUnits) {
            sb.append("--- ").append(unit.getFileName()).append(" ---\n")
                    .append(unit.getRawText() == null ? "" : unit.getRawText())
                    .append("\n\n");
        }
        return sb.toString().strip();
    }

    public void replaceAnomalies(List<AnomalyTag> tags) {
        anomalies = List.copyOf(tags);
    }

    /**
     * 作业内容指纹（token 序列 + HEX 数据），与学号无关。
     */
    public String getContentHash() {
        String hash = contentHash;
        if (hash == null) {
            hash = ContentHasher.hash(sourceTokens, getHexBytes());
            contentHash = hash;
        }
        return hash;
    }
}
