package com.plagiarism.common.util;

import java.util.Locale;
import java.util.Set;

/**
 * 8051 (MCS-51) 指令助记符表。
 */
public final class Mcs51Mnemonics {

    public static final Set<String> ALL = Set.of(
            "acall", "add", "addc", "ajmp", "anl", "call", "cjne", "clr", "cpl", "da", "dec",
            "div", "djnz", "inc", "jb", "jbc", "jc", "jmp", "jnb", "jnc", "jnz", "jz", "lcall",
            "ljmp", "mov", "movc", "movx", "mul", "nop", "orl", "pop", "push", "ret", "reti",
            "rl", "rlc", "rr", "rrc", "setb", "sjmp", "subb", "swap", "xch", "xchd", "xrl");

    private Mcs51Mnemonics() {
    }

    public static boolean isMnemonic(String word) {
        return word != null && ALL.contains(word.toLowerCase(Locale.ROOT));
    }
}
