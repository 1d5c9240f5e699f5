package com.plagiarism.intake.compile;

/**
 * C 源文件到 8051 汇编的编译器。
 */
public interface AssemblyCompiler {

    /**
     * 编译器已启用且可执行文件存在。
     */
    boolean isAvailable();

    /**
     * 编译单个 C 文件，失败不抛异常，以 {@link CompilationResult#failure(String)} 返回。
     *
     * @param fileName 原文件名，用于生成同名的中间文件
     * @param source   C 源码
     */
    CompilationResult compile(String fileName, String source);
}
