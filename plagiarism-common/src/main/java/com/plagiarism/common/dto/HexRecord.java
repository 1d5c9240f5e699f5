package com.plagiarism.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条 Intel HEX 记录 {@code :LLAAAATT[DD...]CC}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HexRecord {

    public static final int TYPE_DATA = 0x00;
    public static final int TYPE_EOF = 0x01;

    /** 在原文件中的行号（从1开始） */
    private int lineNumber;

    /** 载荷地址 */
    private int address;

    /** 记录类型 */
    private int recordType;

    /** 载荷字节 */
    @JsonIgnore
    private byte[] data;

    public boolean isData() {
        return recordType == TYPE_DATA;
    }

    public boolean isEof() {
        return recordType == TYPE_EOF;
    }
}
