package com.plagiarism.engine.anomaly;

import com.plagiarism.common.dto.AnomalyKind;
import com.plagiarism.common.dto.AnomalyTag;
import com.plagiarism.common.dto.HexImage;
import com.plagiarism.common.dto.SourceLanguage;
import com.plagiarism.common.dto.SourceUnit;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.util.Mcs51Mnemonics;
import com.plagiarism.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 单份作业的结构异常检测，不跨作业比较。
 * <p>
 * 所有检查都会执行，每项失败追加一个标记。有效性由比对阶段另行判断，与此处无关。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private final EngineProperties properties;

    /**
     * 检测并用结果替换作业上的标记，同一份作业重复检测结果不变。
     *
     * @return 本次检测得到的标记
     */
    public List<AnomalyTag> inspect(Submission submission) {
        List<AnomalyTag> tags = new ArrayList<>();
        tags.addAll(checkHex(submission.getHex()));
        tags.addAll(checkSource(submission));

        submission.replaceAnomalies(tags);
        if (!tags.isEmpty()) {
            log.debug("学生 {} 发现 {} 项异常: {}", submission.getStudentId(), tags.size(),
                    tags.stream().map(t -> t.getKind().name()).collect(Collectors.joining(",")));
        }
        return tags;
    }

    public void inspectAll(List<Submission> submissions) {
        int flagged = 0;
        for (Submission submission : submissions) {
            if (!inspect(submission).isEmpty()) {
                flagged++;
            }
        }
        log.info("结构异常检测完成: {}/{} 份作业存在异常", flagged, submissions.size());
    }

    // ======================== HEX 检查 ========================

    List<AnomalyTag> checkHex(HexImage hex) {
        EngineProperties.AnomalyConfig config = properties.getAnomaly();
        List<AnomalyTag> tags = new ArrayList<>();
        int length = hex.getDataLength();

        if (!hex.isEofPresent()) {
            tags.add(AnomalyTag.of(AnomalyKind.MISSING_EOF_RECORD, "未找到 EOF 记录 (:00000001FF)"));
        }

        List<String> errors = hex.getFormatErrors();
        if (!errors.isEmpty()) {
            tags.add(AnomalyTag.of(AnomalyKind.MALFORMED_HEX_RECORD,
                    "共 " + errors.size() + " 处格式错误，首个: " + errors.get(0)));
        }

        if (length < config.getInsufficientDataBytes()) {
            tags.add(AnomalyTag.of(AnomalyKind.INSUFFICIENT_DATA,
                    "数据仅 " + length + " 字节，低于 " + config.getInsufficientDataBytes() + " 字节"));
        }

        if (length < config.getMinHexBytes() || length > config.getMaxHexBytes()) {
            tags.add(AnomalyTag.of(AnomalyKind.LENGTH_OUTLIER,
                    "数据 " + length + " 字节，超出合理范围 [" + config.getMinHexBytes()
                            + ", " + config.getMaxHexBytes() + "]"));
        }
        return tags;
    }

    // ======================== 源码检查 ========================

    List<AnomalyTag> checkSource(Submission submission) {
        EngineProperties.AnomalyConfig config = properties.getAnomaly();
        SourceProfile profile = submission.getSourceUnits().isEmpty()
                ? SourceProfile.fromTokens(submission.getSourceTokens())
                : SourceProfile.fromUnits(submission.getSourceUnits());
        List<AnomalyTag> tags = new ArrayList<>();

        if (profile.getInstructionCount() < config.getMinInstructionCount()) {
            tags.add(AnomalyTag.of(AnomalyKind.TOO_FEW_INSTRUCTIONS,
                    "仅 " + profile.getInstructionCount() + " 条指令/语句，至少需要 " + config.getMinInstructionCount()));
        }

        Set<String> required = config.getRequiredInstructions().stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        if (!required.isEmpty() && profile.isHasAssembly()
                && profile.getMnemonics().stream().noneMatch(required::contains)) {
            tags.add(AnomalyTag.of(AnomalyKind.MISSING_KEY_INSTRUCTION,
                    "未出现任何关键指令: " + String.join(", ", new TreeSet<>(required))));
        }

        if (profile.getTotalLines() > 0) {
            double ratio = (double) profile.getCommentOrBlankLines() / profile.getTotalLines();
            if (ratio > config.getMaxCommentRatio()) {
                tags.add(AnomalyTag.of(AnomalyKind.EXCESSIVE_COMMENT_RATIO,
                        String.format(Locale.ROOT, "注释/空行占 %.0f%% (%d/%d 行)，上限 %.0f%%",
                                ratio * 100, profile.getCommentOrBlankLines(), profile.getTotalLines(),
                                config.getMaxCommentRatio() * 100)));
            }
        }

        if (config.isDirectiveCheckEnabled() && profile.isHasAssemblyText()) {
            if (!profile.isOrgPresent()) {
                tags.add(AnomalyTag.of(AnomalyKind.MISSING_ORG_DIRECTIVE, "汇编源文件中未找到 ORG 伪指令"));
            }
            if (!profile.isEndPresent()) {
                tags.add(AnomalyTag.of(AnomalyKind.MISSING_END_DIRECTIVE, "汇编源文件中未找到 END 伪指令"));
            }
        }
        return tags;
    }

    /**
     * 源码行统计结果。
     */
    @Value
    static class SourceProfile {
        int totalLines;
        int commentOrBlankLines;
        int instructionCount;
        List<String> mnemonics;
        boolean hasAssembly;
        boolean hasAssemblyText;
        boolean orgPresent;
        boolean endPresent;

        static SourceProfile fromUnits(List<SourceUnit> units) {
            int total = 0;
            int commentOrBlank = 0;
            int instructions = 0;
            List<String> mnemonics = new ArrayList<>();
            boolean hasAssembly = false;
            boolean org = false;
            boolean end = false;

            for (SourceUnit unit : units) {
                String text = unit.getRawText() == null ? "" : unit.getRawText();
                if (unit.getLanguage() == SourceLanguage.C) {
                    SourceLines.CStats stats = SourceLines.scanC(text);
                    total += stats.getTotalLines();
                    commentOrBlank += stats.getCommentOrBlankLines();
                    instructions += stats.getStatements();
                } else {
                    hasAssembly = true;
                    SourceLines.AsmStats stats = SourceLines.scanAssembly(text);
                    total += stats.getTotalLines();
                    commentOrBlank += stats.getCommentOrBlankLines();
                    instructions += stats.getMnemonics().size();
                    mnemonics.addAll(stats.getMnemonics());
                    org |= stats.isOrgPresent();
                    end |= stats.isEndPresent();
                }
            }
            return new SourceProfile(total, commentOrBlank, instructions, mnemonics,
                    hasAssembly, hasAssembly, org, end);
        }

        /** 只有 token 没有原文时（如直接构造的作业），按 token 中的助记符统计 */
        static SourceProfile fromTokens(List<String> tokens) {
            List<String> mnemonics = tokens.stream()
                    .filter(Mcs51Mnemonics::isMnemonic)
                    .toList();
            return new SourceProfile(0, 0, mnemonics.size(), mnemonics, true, false, false, false);
        }
    }
}
