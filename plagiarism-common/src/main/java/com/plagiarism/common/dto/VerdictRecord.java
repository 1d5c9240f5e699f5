package com.plagiarism.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 交给报告层的单条结果：学生对、各通道得分、判定与双方异常标记。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerdictRecord {

    private String studentA;

    private String studentB;

    private ChannelScores sourceScores;

    private ChannelScores hexScores;

    private double aggregateSourceScore;

    private Verdict verdict;

    private Verdict cascadeVerdict;

    private DecisionRule decisionRule;

    private String reasoning;

    private boolean judgmentConsulted;

    private String invalidNote;

    private List<AnomalyTag> anomaliesA;

    private List<AnomalyTag> anomaliesB;
}
