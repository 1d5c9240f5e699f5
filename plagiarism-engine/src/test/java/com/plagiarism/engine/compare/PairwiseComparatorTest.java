package com.plagiarism.engine.compare;

import com.plagiarism.common.dto.ComparisonRecord;
import com.plagiarism.common.dto.HexImage;
import com.plagiarism.common.dto.PairKey;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.engine.TestSubmissions;
import com.plagiarism.engine.config.EngineProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PairwiseComparatorTest {

    private ExecutorService executor;
    private ComparisonCache cache;
    private EngineProperties properties;
    private PairwiseComparator comparator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        properties = new EngineProperties();
        cache = new ComparisonCache(properties, Runnable::run);
        comparator = new PairwiseComparator(executor, cache, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void producesOneRecordPerComparablePair() {
        List<Submission> submissions = List.of(
                TestSubmissions.asm("s3", "MOV A,#1\nSJMP $", TestSubmissions.hex(0x74, 0x01)),
                TestSubmissions.asm("s1", "MOV A,#2\nSJMP $", TestSubmissions.hex(0x74, 0x02)),
                TestSubmissions.asm("s2", "MOV A,#3\nSJMP $", TestSubmissions.hex(0x74, 0x03)),
                TestSubmissions.asm("s4", "CLR A", TestSubmissions.hex(0xE4)));

        List<ComparisonRecord> records = comparator.compareAll(submissions);

        assertEquals(6, records.size());
        Set<PairKey> pairs = new HashSet<>();
        for (ComparisonRecord r : records) {
            assertTrue(r.getPair().getStudentA().compareTo(r.getPair().getStudentB()) < 0);
            assertTrue(pairs.add(r.getPair()));
        }
        assertEquals(PairKey.of("s1", "s2"), records.get(0).getPair());
    }

    @Test
    void pairWithoutSharedChannelIsSkipped() {
        Submission sourceOnly = TestSubmissions.asm("a", "MOV A,#1", HexImage.empty());
        Submission hexOnly = TestSubmissions.hexOnly("b", TestSubmissions.hex(0x74, 0x01));

        List<ComparisonRecord> records = comparator.compareAll(List.of(sourceOnly, hexOnly));

        assertTrue(records.isEmpty());
    }

    @Test
    void missingChannelScoresZero() {
        Submission full = TestSubmissions.asm("a", "MOV A,#1", TestSubmissions.hex(0x74, 0x01));
        Submission hexOnly = TestSubmissions.hexOnly("b", TestSubmissions.hex(0x74, 0x01));

        ComparisonRecord record = comparator.compare(full, hexOnly);

        assertEquals(0.0, record.getSource().getLcs());
        assertEquals(0.0, record.getSource().getLevenshtein());
        assertEquals(1.0, record.getHexLevenshtein());
    }

    @Test
    void argumentOrderDoesNotMatter() {
        Submission a = TestSubmissions.asm("a", "MOV A,#1\nNOP\nSJMP $", TestSubmissions.hex(0x74, 0x01, 0x00));
        Submission b = TestSubmissions.asm("b", "MOV A,#1\nSJMP $", TestSubmissions.hex(0x74, 0x01));

        assertEquals(comparator.compare(a, b), comparator.compare(b, a));
    }

    @Test
    void identicalContentIsComputedOnce() {
        Submission a = TestSubmissions.asm("a", "MOV A,#1\nSJMP $", TestSubmissions.hex(0x74, 0x01));
        Submission b = TestSubmissions.asm("b", "MOV A,#2\nSJMP $", TestSubmissions.hex(0x74, 0x02));
        Submission copyOfA = TestSubmissions.asm("c", "MOV A,#1\nSJMP $", TestSubmissions.hex(0x74, 0x01));
        Submission copyOfB = TestSubmissions.asm("d", "MOV A,#2\nSJMP $", TestSubmissions.hex(0x74, 0x02));

        ComparisonRecord first = comparator.compare(a, b);
        ComparisonRecord second = comparator.compare(copyOfB, copyOfA);

        assertEquals(1, cache.size());
        assertEquals(first.getSource(), second.getSource());
        assertEquals(first.getHex(), second.getHex());
        assertEquals(PairKey.of("c", "d"), second.getPair());
    }

    @Test
    void memoizationCanBeDisabled() {
        properties.setMemoizationEnabled(false);
        Submission a = TestSubmissions.asm("a", "MOV A,#1", TestSubmissions.hex(0x74, 0x01));
        Submission b = TestSubmissions.asm("b", "MOV A,#2", TestSubmissions.hex(0x74, 0x02));

        comparator.compare(a, b);

        assertEquals(0, cache.size());
    }

    @Test
    void cacheKeepsAtMostConfiguredEntries() {
        properties.setMemoMaxEntries(2);
        ComparisonCache small = new ComparisonCache(properties, Runnable::run);
        PairwiseComparator bounded = new PairwiseComparator(executor, small, properties);

        for (int i = 0; i < 20; i++) {
            Submission a = TestSubmissions.asm("a" + i, "MOV A,#" + i, TestSubmissions.hex(0x74, i));
            Submission b = TestSubmissions.asm("b" + i, "MOV B,#" + i, TestSubmissions.hex(0x75, i));
            bounded.compare(a, b);
        }

        assertTrue(small.size() <= 2, "size=" + small.size());
    }
}
