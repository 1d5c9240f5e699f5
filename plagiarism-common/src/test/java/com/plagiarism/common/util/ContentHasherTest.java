package com.plagiarism.common.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    @Test
    void sameContentSameHash() {
        String a = ContentHasher.hash(List.of("mov", "a,", "#55h"), new byte[]{1, 2, 3});
        String b = ContentHasher.hash(List.of("mov", "a,", "#55h"), new byte[]{1, 2, 3});
        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    void tokenBoundariesAreSignificant() {
        String joined = ContentHasher.hash(List.of("mova"), new byte[0]);
        String split = ContentHasher.hash(List.of("mov", "a"), new byte[0]);
        assertNotEquals(joined, split);
    }

    @Test
    void hexDataIsPartOfTheFingerprint() {
        String a = ContentHasher.hash(List.of("mov"), new byte[]{0x12});
        String b = ContentHasher.hash(List.of("mov"), new byte[]{0x13});
        assertNotEquals(a, b);
    }
}
