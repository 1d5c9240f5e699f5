package com.plagiarism.intake.service;

import com.plagiarism.common.dto.SourceLanguage;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 源码清洗：去注释、统一小写、合并空白后按空白切分为 token。
 */
public final class SourceCleaner {

    private static final Pattern ASM_COMMENT = Pattern.compile(";.*");
    private static final Pattern C_PREPROCESSOR = Pattern.compile("(?m)^\\s*#.*$");
    private static final Pattern C_LINE_COMMENT = Pattern.compile("//.*");
    private static final Pattern C_BLOCK_COMMENT = Pattern.compile("(?s)/\\*.*?\\*/");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SourceCleaner() {
    }

    public static List<String> clean(String text, SourceLanguage language) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String stripped = language == SourceLanguage.C ? stripC(text) : stripAssembly(text);
        String normalized = stripped.toLowerCase(Locale.ROOT).trim();
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(normalized));
    }

    static String stripAssembly(String text) {
        return ASM_COMMENT.matcher(text).replaceAll("");
    }

    /**
     * 顺序：预处理行、块注释、行注释。块注释先于行注释去除，注释内的 {@code //} 不会截断其后代码。
     */
    static String stripC(String text) {
        String s = C_PREPROCESSOR.matcher(text).replaceAll("");
        s = C_BLOCK_COMMENT.matcher(s).replaceAll(" ");
        return C_LINE_COMMENT.matcher(s).replaceAll("");
    }
}
