package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 学生提交的单个源文件（原文），用于语义判定与源码结构检查。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceUnit {

    /** 文件名（不含目录） */
    private String fileName;

    /** 源文件语言 */
    private SourceLanguage language;

    /** 解码后的原始文本，未去注释 */
    private String rawText;
}
