package com.plagiarism.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 一个学生全部 HEX 文件的解析结果。
 * <p>
 * HEX 通道只比较数据记录（类型 00）的载荷字节，地址与校验和不参与比较。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HexImage {

    /** 按出现顺序排列的全部合法记录 */
    @Builder.Default
    private List<HexRecord> records = new ArrayList<>();

    /** 结构错误描述（缺少冒号、非十六进制字符、长度不符、校验和错误） */
    @Builder.Default
    private List<String> formatErrors = new ArrayList<>();

    /** 是否出现过 EOF 记录 {@code :00000001FF} */
    private boolean eofPresent;

    public static HexImage empty() {
        return HexImage.builder().build();
    }

    /**
     * 按顺序拼接所有数据记录的载荷。
     */
    @JsonIgnore
    public byte[] getDataBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (HexRecord record : records) {
            if (record.isData() && record.getData() != null) {
                out.writeBytes(record.getData());
            }
        }
        return out.toByteArray();
    }

    public int getDataLength() {
        int length = 0;
        for (HexRecord record : records) {
            if (record.isData() && record.getData() != null) {
                length += record.getData().length;
            }
        }
        return length;
    }

    /**
     * 合并另一个 HEX 文件的解析结果（同一学生提交多个 HEX 时使用）。
     */
    public HexImage merge(HexImage other) {
        List<HexRecord> mergedRecords = new ArrayList<>(records);
        mergedRecords.addAll(other.getRecords());
        List<String> mergedErrors = new ArrayList<>(formatErrors);
        mergedErrors.addAll(other.getFormatErrors());
        return HexImage.builder()
                .records(mergedRecords)
                .formatErrors(mergedErrors)
                .eofPresent(eofPresent || other.isEofPresent())
                .build();
    }
}
