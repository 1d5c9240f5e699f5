package com.plagiarism.intake.compile;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeilListingExtractorTest {

    private static final String LISTING = String.join("\n",
            "C51 COMPILER V9.60.0.0   MAIN                                                                 03/12/2024",
            "",
            "MODULE INFORMATION:   STATIC OVERLAYABLE",
            "             ; FUNCTION main (BEGIN)",
            "                                           ; SOURCE LINE # 3",
            "   1          #include <reg51.h>",
            "   5   1          P1 = 0x55;",
            "0000 7590 55       MOV     P1,#055H",
            "0003         ?C0001:",
            "0003 80FE          SJMP    ?C0001",
            "        1     0000 7855      MOV A,#55H",
            "0005 22            RET     ; return",
            "CODE SIZE        =      6    ----",
            "END OF MODULE INFORMATION.");

    @Test
    void keepsOnlyInstructionLines() {
        String asm = KeilListingExtractor.extract(LISTING);

        assertEquals(String.join("\n",
                "MOV     P1,#055H",
                "SJMP    ?C0001",
                "MOV A,#55H",
                "RET"), asm);
    }

    @Test
    void headersAndSummariesAreDropped() {
        String asm = KeilListingExtractor.extract(LISTING);

        assertFalse(asm.contains("COMPILER"));
        assertFalse(asm.contains("MODULE"));
        assertFalse(asm.contains("CODE SIZE"));
        assertFalse(asm.contains("P1 = 0x55"));
    }

    @Test
    void emptyListingYieldsEmptyText() {
        assertEquals("", KeilListingExtractor.extract(""));
        assertEquals("", KeilListingExtractor.extract(null));
    }

    @Test
    void bareInstructionIsAccepted() {
        assertEquals("MOV A,#55H", KeilListingExtractor.instructionOf("MOV A,#55H"));
        assertNull(KeilListingExtractor.instructionOf("5   1   P1 = 0x55;"));
    }
}
