package com.plagiarism.intake.service;

import com.plagiarism.common.dto.SourceLanguage;
import com.plagiarism.common.dto.SourceUnit;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.exception.SubmissionIntakeException;
import com.plagiarism.intake.compile.AssemblyCompiler;
import com.plagiarism.intake.compile.CompilationResult;
import com.plagiarism.intake.config.IntakeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SubmissionLoaderTest {

    private static final String HEX = ":0300000002000BF0\n:00000001FF\n";

    @TempDir
    Path root;

    private IntakeProperties properties;
    private AssemblyCompiler compiler;
    private SubmissionLoader loader;

    @BeforeEach
    void setUp() {
        properties = new IntakeProperties();
        compiler = mock(AssemblyCompiler.class);
        loader = new SubmissionLoader(new SubmissionCrawler(), new TextDecoder(properties), compiler, properties);
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void studentsAreSubdirectoriesAndFilesAreCollectedRecursively() throws IOException {
        write("s002/lab1/main.a51", "MOV A,#55H\nSJMP $");
        write("s002/lab1/out/main.hex", HEX);
        write("s001/main.c", "void main() { P1 = 0; }");
        write("s001/main.hex", HEX);
        write("readme.txt", "ignored");

        List<Submission> submissions = loader.loadDirectory(root);

        assertEquals(2, submissions.size());
        assertEquals("s001", submissions.get(0).getStudentId());
        Submission s2 = submissions.get(1);
        assertTrue(s2.isValid());
        assertEquals(List.of("mov", "a,#55h", "sjmp", "$"), s2.getSourceTokens());
        assertEquals(3, s2.getHex().getDataLength());
        assertEquals(SourceLanguage.ASSEMBLY, s2.getSourceUnits().get(0).getLanguage());
    }

    @Test
    void missingSourceNamesFoundExtensions() throws IOException {
        write("s003/report.docx", "binary");
        write("s003/prog.hex", HEX);

        Submission s = loader.loadDirectory(root).get(0);

        assertFalse(s.isValid());
        assertTrue(s.getInvalidReason().contains(".docx"));
    }

    @Test
    void emptyStudentDirectoryIsInvalid() throws IOException {
        Files.createDirectories(root.resolve("s004"));

        Submission s = loader.loadDirectory(root).get(0);

        assertFalse(s.isValid());
        assertTrue(s.getInvalidReason().contains("未找到任何文件"));
        assertTrue(s.getInvalidReason().contains("hex"));
    }

    @Test
    void missingRootIsIntakeError() {
        assertThrows(SubmissionIntakeException.class, () -> loader.loadDirectory(root.resolve("nope")));
    }

    @Test
    void compiledAssemblyReplacesCTokens() {
        properties.getCompiler().setEnabled(true);
        when(compiler.isAvailable()).thenReturn(true);
        when(compiler.compile(eq("main.c"), anyString())).thenReturn(CompilationResult.ok("MOV P1,#055H\nRET"));

        Submission s = loader.assemble("s5",
                List.of(SourceUnit.builder().fileName("main.c").rawText("void main() { P1 = 0x55; }").build()),
                HEX);

        assertEquals(List.of("mov", "p1,#055h", "ret"), s.getSourceTokens());
        assertEquals(SourceLanguage.C, s.getSourceUnits().get(0).getLanguage());
    }

    @Test
    void failedCompilationContributesNothing() {
        properties.getCompiler().setEnabled(true);
        when(compiler.isAvailable()).thenReturn(true);
        when(compiler.compile(anyString(), anyString())).thenReturn(CompilationResult.failure("syntax error"));

        Submission s = loader.assemble("s6", List.of(
                SourceUnit.builder().fileName("main.c").rawText("void main() {}").build(),
                SourceUnit.builder().fileName("delay.asm").rawText("NOP\nRET").build()), HEX);

        assertEquals(List.of("nop", "ret"), s.getSourceTokens());
        assertTrue(s.isValid());
    }

    @Test
    void compilerIsNotUsedWhenDisabled() {
        Submission s = loader.assemble("s7",
                List.of(SourceUnit.builder().fileName("main.c").rawText("int x;").build()), HEX);

        assertEquals(List.of("int", "x;"), s.getSourceTokens());
        verifyNoInteractions(compiler);
    }

    @Test
    void uploadWithoutHexIsInvalid() {
        Submission s = loader.assemble("s8",
                List.of(SourceUnit.builder().fileName("main.a51").rawText("NOP").build()), null);

        assertFalse(s.isValid());
        assertTrue(s.getInvalidReason().contains("未找到 hex 文件"));
    }
}
