package com.plagiarism.intake.service;

import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.intake.config.IntakeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;

/**
 * 源文件解码：学生作业常见 UTF-8、Big5、GBK 混用。
 * <p>
 * 有 BOM 时按 BOM 解码；否则依次用配置的字符集严格解码，第一个成功的为准；都失败时按 UTF-8 宽松解码。
 */
@Slf4j
@Component
public class TextDecoder {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final List<Charset> charsets;

    @Autowired
    public TextDecoder(IntakeProperties properties) {
        this(properties.getEncodings());
    }

    TextDecoder(List<String> encodings) {
        List<Charset> resolved = new ArrayList<>();
        for (String name : encodings) {
            try {
                resolved.add(Charset.forName(name.trim()));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                throw new ConfigurationException("不支持的字符集: " + name);
            }
        }
        if (resolved.isEmpty()) {
            resolved.add(StandardCharsets.UTF_8);
        }
        this.charsets = List.copyOf(resolved);
    }

    public String decode(byte[] bytes) {
        if (startsWith(bytes, UTF8_BOM)) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }

        for (Charset charset : charsets) {
            try {
                return charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("{} 解码失败，尝试下一个字符集", charset.name());
            }
        }
        log.warn("所有字符集均无法严格解码，按 UTF-8 宽松解码");
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
