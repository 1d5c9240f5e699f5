package com.plagiarism.intake.compile;

import lombok.Value;

/**
 * 单个 C 文件的编译结果。成功时 {@code assembly} 为提取后的汇编指令行。
 */
@Value
public class CompilationResult {

    boolean success;
    String assembly;
    String error;

    public static CompilationResult ok(String assembly) {
        return new CompilationResult(true, assembly, null);
    }

    public static CompilationResult failure(String error) {
        return new CompilationResult(false, "", error);
    }
}
