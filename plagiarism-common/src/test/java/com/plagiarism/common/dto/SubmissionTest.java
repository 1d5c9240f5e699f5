package com.plagiarism.common.dto;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionTest {

    private static HexImage hexOf(byte... data) {
        return HexImage.builder()
                .records(List.of(HexRecord.builder().recordType(HexRecord.TYPE_DATA).data(data).build()))
                .eofPresent(true)
                .build();
    }

    @Test
    void completeSubmissionIsValid() {
        Submission s = Submission.of("s1", List.of(), List.of("mov", "a,", "#55h"), hexOf((byte) 0x74),
                FilePresence.builder().sourceFilePresent(true).hexFilePresent(true).build());

        assertTrue(s.isValid());
        assertNull(s.getInvalidReason());
        assertTrue(s.hasSourceData());
        assertTrue(s.hasHexData());
    }

    @Test
    void missingSourceNamesFoundExtensions() {
        Submission s = Submission.of("s2", List.of(), List.of(), hexOf((byte) 0x74),
                FilePresence.builder()
                        .sourceFilePresent(false)
                        .hexFilePresent(true)
                        .extensionsFound(new TreeSet<>(Set.of(".txt", ".hex")))
                        .build());

        assertFalse(s.isValid());
        assertTrue(s.getInvalidReason().contains(".txt"));
    }

    @Test
    void emptyHexMakesSubmissionInvalid() {
        Submission s = Submission.of("s3", List.of(), List.of("mov"), HexImage.empty(),
                FilePresence.builder().sourceFilePresent(true).hexFilePresent(true).build());

        assertFalse(s.isValid());
        assertTrue(s.getInvalidReason().contains("hex"));
    }

    @Test
    void sourceTextFallsBackToCleanedTokens() {
        Submission s = Submission.builder().studentId("s4").sourceTokens(List.of("mov", "a,", "#55h")).valid(true).build();
        assertEquals("mov a, #55h", s.getSourceText());
    }

    @Test
    void contentHashIgnoresStudentId() {
        Submission a = Submission.builder().studentId("a").sourceTokens(List.of("mov")).hex(hexOf((byte) 1)).valid(true).build();
        Submission b = Submission.builder().studentId("b").sourceTokens(List.of("mov")).hex(hexOf((byte) 1)).valid(true).build();
        assertEquals(a.getContentHash(), b.getContentHash());
    }
}
