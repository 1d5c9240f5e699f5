package com.plagiarism.intake.compile;

import com.plagiarism.common.util.Mcs51Mnemonics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 从 Keil C51 的 .lst 列表文件中提取汇编指令行。
 * <p>
 * 列表行形如 {@code 1     0000 7855      MOV A,#55H}：行号、地址、机器码之后的部分为指令。
 * 只保留以 8051 助记符开头（可带标号）的行，表头、汇总、伪指令都丢弃。
 */
public final class KeilListingExtractor {

    private static final Set<String> HEADER_PREFIXES = Set.of(
            "MODULE", "COMPILER", "SUMMARY", "FUNCTION", "NAME", "CODE SIZE", "CONSTANT SIZE",
            "XDATA SIZE", "PDATA SIZE", "DATA SIZE", "IDATA SIZE", "BIT SIZE", "END OF");

    private KeilListingExtractor() {
    }

    public static String extract(String listing) {
        if (listing == null || listing.isBlank()) {
            return "";
        }
        List<String> instructions = new ArrayList<>();
        for (String raw : listing.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith(";") || isHeader(line)) {
                continue;
            }
            String instruction = instructionOf(line);
            if (instruction != null) {
                instructions.add(instruction);
            }
        }
        return String.join("\n", instructions);
    }

    private static boolean isHeader(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        for (String prefix : HEADER_PREFIXES) {
            if (upper.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 跳过行号、地址、机器码与标号，从第一个助记符开始截取；找不到助记符返回 null。
     */
    static String instructionOf(String line) {
        String[] words = line.split("\\s+");
        int offset = 0;
        for (String word : words) {
            if (Mcs51Mnemonics.isMnemonic(word)) {
                String rest = line.substring(line.indexOf(word, offset)).trim();
                int comment = rest.indexOf(';');
                return (comment >= 0 ? rest.substring(0, comment) : rest).trim();
            }
            if (!isAddressOrCode(word) && !word.endsWith(":")) {
                return null;
            }
            offset = line.indexOf(word, offset) + word.length();
        }
        return null;
    }

    private static boolean isAddressOrCode(String word) {
        String w = word.endsWith("+") ? word.substring(0, word.length() - 1) : word;
        if (w.isEmpty()) {
            return false;
        }
        for (int i = 0; i < w.length(); i++) {
            if (Character.digit(w.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
