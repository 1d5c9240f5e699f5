package com.plagiarism.engine.anomaly;

import com.plagiarism.common.util.Mcs51Mnemonics;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 按行扫描汇编与 C 源码的统计工具。
 */
final class SourceLines {

    private static final Pattern LABEL = Pattern.compile("^[A-Za-z_?][\\w?]*:\\s*");

    private SourceLines() {
    }

    @Value
    static class AsmStats {
        int totalLines;
        int commentOrBlankLines;
        List<String> mnemonics;
        boolean orgPresent;
        boolean endPresent;
    }

    @Value
    static class CStats {
        int totalLines;
        int commentOrBlankLines;
        int statements;
    }

    // ======================== 汇编 ========================

    static AsmStats scanAssembly(String text) {
        int total = 0;
        int commentOrBlank = 0;
        List<String> mnemonics = new ArrayList<>();
        boolean org = false;
        boolean end = false;

        for (String line : text.lines().toList()) {
            total++;
            String code = stripAsmComment(line).trim();
            if (code.isEmpty()) {
                commentOrBlank++;
                continue;
            }
            code = LABEL.matcher(code).replaceFirst("");
            if (code.isEmpty()) {
                continue;
            }
            String[] words = code.toLowerCase(Locale.ROOT).split("\\s+");
            String first = words[0];
            if ("org".equals(first) || ("cseg".equals(first) && code.toLowerCase(Locale.ROOT).contains(" at "))) {
                org = true;
            } else if ("end".equals(first)) {
                end = true;
            } else if (Mcs51Mnemonics.isMnemonic(first)) {
                mnemonics.add(first);
            }
        }
        return new AsmStats(total, commentOrBlank, mnemonics, org, end);
    }

    /**
     * 去掉 {@code ;} 之后的注释，引号内的分号不算。
     */
    static String stripAsmComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ';') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    // ======================== C ========================

    static CStats scanC(String text) {
        int total = 0;
        int commentOrBlank = 0;
        int statements = 0;
        boolean inBlock = false;

        for (String line : text.lines().toList()) {
            total++;
            StringBuilder code = new StringBuilder();
            int i = 0;
            while (i < line.length()) {
                if (inBlock) {
                    int close = line.indexOf("*/", i);
                    if (close < 0) {
                        i = line.length();
                    } else {
                        inBlock = false;
                        i = close + 2;
                    }
                } else if (line.startsWith("//", i)) {
                    break;
                } else if (line.startsWith("/*", i)) {
                    inBlock = true;
                    i += 2;
                } else {
                    code.append(line.charAt(i));
                    i++;
                }
            }
            String stripped = code.toString().trim();
            if (stripped.isEmpty()) {
                commentOrBlank++;
            } else if (!stripped.startsWith("#")) {
                statements += countSemicolons(stripped);
            }
        }
        return new CStats(total, commentOrBlank, statements);
    }

    private static int countSemicolons(String code) {
        int count = 0;
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == ';') {
                count++;
            }
        }
        return count;
    }
}
