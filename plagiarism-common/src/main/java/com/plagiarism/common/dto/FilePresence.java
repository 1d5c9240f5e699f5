package com.plagiarism.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.TreeSet;

/**
 * 采集阶段发现的文件情况，用于判定提交是否有效。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilePresence {

    /** 是否找到至少一个源文件（.a51 / .asm / .c） */
    private boolean sourceFilePresent;

    /** 是否找到至少一个 .hex 文件 */
    private boolean hexFilePresent;

    /** 学生目录下出现过的所有扩展名 */
    @Builder.Default
    private Set<String> extensionsFound = new TreeSet<>();
}
