package com.plagiarism.common.dto;

import lombok.Value;

import java.util.Comparator;

/**
 * 无序学生对 {A,B}，规范化为学号较小者在前。
 */
@Value
public class PairKey implements Comparable<PairKey> {

    private static final Comparator<PairKey> ORDER = Comparator
            .comparing(PairKey::getStudentA)
            .thenComparing(PairKey::getStudentB);

    String studentA;
    String studentB;

    public static PairKey of(String x, String y) {
        return x.compareTo(y) <= 0 ? new PairKey(x, y) : new PairKey(y, x);
    }

    public String getId() {
        return studentA + "|" + studentB;
    }

    @Override
    public int compareTo(PairKey other) {
        return ORDER.compare(this, other);
    }
}
