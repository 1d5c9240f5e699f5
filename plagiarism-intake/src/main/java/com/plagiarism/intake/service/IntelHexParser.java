package com.plagiarism.intake.service;

import com.plagiarism.common.dto.HexImage;
import com.plagiarism.common.dto.HexRecord;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Intel HEX 解析：{@code :LLAAAATT[DD...]CC}。
 * <p>
 * 结构错误不抛异常，记入 {@link HexImage#getFormatErrors()}：
 * 缺少冒号、非十六进制字符、长度与 LL 不符的行整行丢弃；仅校验和不符的记录保留数据。
 */
public final class IntelHexParser {

    private static final int MAX_RECORD_TYPE = 0x05;

    private IntelHexParser() {
    }

    public static HexImage parse(String text) {
        List<HexRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean eof = false;

        if (text == null) {
            return HexImage.empty();
        }

        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.charAt(0) != ':') {
                errors.add("第 " + lineNumber + " 行: 缺少起始冒号");
                continue;
            }
            String body = line.substring(1);
            if (body.length() < 10 || body.length() % 2 != 0 || !isHex(body)) {
                errors.add("第 " + lineNumber + " 行: 含非十六进制字符或长度不完整");
                continue;
            }

            byte[] bytes = HexFormat.of().parseHex(body);
            int length = bytes[0] & 0xFF;
            if (bytes.length != length + 5) {
                errors.add("第 " + lineNumber + " 行: 长度字段为 " + length + "，实际数据 " + (bytes.length - 5) + " 字节");
                continue;
            }
            int type = bytes[3] & 0xFF;
            if (type > MAX_RECORD_TYPE) {
                errors.add("第 " + lineNumber + " 行: 未知记录类型 " + String.format("%02X", type));
                continue;
            }
            if (!checksumValid(bytes)) {
                errors.add("第 " + lineNumber + " 行: 校验和错误");
            }

            byte[] data = new byte[length];
            System.arraycopy(bytes, 4, data, 0, length);
            records.add(HexRecord.builder()
                    .lineNumber(lineNumber)
                    .address(((bytes[1] & 0xFF) << 8) | (bytes[2] & 0xFF))
                    .recordType(type)
                    .data(data)
                    .build());
            if (type == HexRecord.TYPE_EOF) {
                eof = true;
            }
        }

        return HexImage.builder()
                .records(records)
                .formatErrors(errors)
                .eofPresent(eof)
                .build();
    }

    private static boolean isHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'))) {
                return false;
            }
        }
        return true;
    }

    /** 全部字节（含校验和）之和的低 8 位为 0 */
    private static boolean checksumValid(byte[] bytes) {
        int sum = 0;
        for (byte b : bytes) {
            sum += b & 0xFF;
        }
        return (sum & 0xFF) == 0;
    }
}
