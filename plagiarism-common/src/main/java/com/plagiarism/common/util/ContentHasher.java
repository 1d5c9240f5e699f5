package com.plagiarism.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * 作业内容指纹（SHA-256）。比对结果的缓存按内容而非学号做键。
 */
public final class ContentHasher {

    private static final byte TOKEN_SEPARATOR = 0x00;
    private static final byte CHANNEL_SEPARATOR = 0x01;

    private ContentHasher() {
    }

    public static String hash(List<String> tokens, byte[] hexData) {
        MessageDigest digest = newDigest();
        for (String token : tokens) {
            digest.update(token.getBytes(StandardCharsets.UTF_8));
            digest.update(TOKEN_SEPARATOR);
        }
        digest.update(CHANNEL_SEPARATOR);
        digest.update(hexData);
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
