package com.plagiarism.common.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class IdGeneratorTest {

    @Test
    void runIdCarriesStartTime() {
        String id = IdGenerator.runId(LocalDateTime.of(2024, 3, 5, 9, 7, 1));
        assertTrue(id.matches("run-20240305-090701-[0-9a-f]{6}"), id);
    }

    @Test
    void laterRunsSortAfterEarlierOnes() {
        String earlier = IdGenerator.runId(LocalDateTime.of(2024, 3, 5, 9, 7, 1));
        String later = IdGenerator.runId(LocalDateTime.of(2024, 3, 5, 10, 0, 0));
        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void sameSecondRunsDiffer() {
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 0, 0, 0);
        assertNotEquals(IdGenerator.runId(now), IdGenerator.runId(now));
    }
}
