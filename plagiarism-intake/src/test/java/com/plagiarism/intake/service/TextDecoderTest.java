package com.plagiarism.intake.service;

import com.plagiarism.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextDecoderTest {

    private final TextDecoder decoder = new TextDecoder(List.of("UTF-8", "Big5", "GBK"));

    @Test
    void utf8IsDecodedDirectly() {
        String text = "MOV A,#55H ; 載入常數";
        assertEquals(text, decoder.decode(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void big5CommentsFallBackToBig5() {
        String text = "; 實驗一 跑馬燈\nMOV A,#01H";
        byte[] big5 = text.getBytes(Charset.forName("Big5"));

        assertEquals(text, decoder.decode(big5));
    }

    @Test
    void bomSelectsEncoding() {
        byte[] body = "NOP".getBytes(StandardCharsets.UTF_16LE);
        byte[] withBom = new byte[body.length + 2];
        withBom[0] = (byte) 0xFF;
        withBom[1] = (byte) 0xFE;
        System.arraycopy(body, 0, withBom, 2, body.length);

        assertEquals("NOP", decoder.decode(withBom));
        assertEquals("NOP", decoder.decode(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'N', 'O', 'P'}));
    }

    @Test
    void undecodableBytesFallBackLeniently() {
        TextDecoder strictUtf8 = new TextDecoder(List.of("UTF-8"));

        String decoded = strictUtf8.decode(new byte[]{'A', (byte) 0xFF, 'B'});

        assertTrue(decoded.startsWith("A"));
        assertTrue(decoded.endsWith("B"));
    }

    @Test
    void unknownCharsetIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> new TextDecoder(List.of("no-such-charset")));
    }
}
