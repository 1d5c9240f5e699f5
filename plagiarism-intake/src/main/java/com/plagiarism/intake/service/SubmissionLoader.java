package com.plagiarism.intake.service;

import com.plagiarism.common.dto.FilePresence;
import com.plagiarism.common.dto.HexImage;
import com.plagiarism.common.dto.SourceLanguage;
import com.plagiarism.common.dto.SourceUnit;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.intake.compile.AssemblyCompiler;
import com.plagiarism.intake.compile.CompilationResult;
import com.plagiarism.intake.config.IntakeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 把学生文件转换为 {@link Submission}：解码、清洗源码、解析 HEX、判定有效性。
 * <p>
 * 单个文件读取失败只记录警告并跳过，不影响其他学生。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionLoader {

    private final SubmissionCrawler crawler;
    private final TextDecoder decoder;
    private final AssemblyCompiler compiler;
    private final IntakeProperties properties;

    /**
     * 载入根目录下全部学生的作业，按学号排序。
     */
    public List<Submission> loadDirectory(Path root) {
        long startTime = System.currentTimeMillis();
        Map<String, SubmissionCrawler.StudentFiles> students = crawler.crawl(root);

        List<Submission> submissions = new ArrayList<>(students.size());
        for (SubmissionCrawler.StudentFiles files : students.values()) {
            submissions.add(load(files));
        }

        long invalid = submissions.stream().filter(s -> !s.isValid()).count();
        log.info("作业载入完成: {} 份, 其中无效 {} 份, 耗时 {}ms",
                submissions.size(), invalid, System.currentTimeMillis() - startTime);
        return submissions;
    }

    Submission load(SubmissionCrawler.StudentFiles files) {
        List<SourceUnit> units = new ArrayList<>();
        for (Path path : files.getSourceFiles()) {
            String name = path.getFileName().toString();
            Optional<SourceLanguage> language = SourceLanguage.fromExtension(SubmissionCrawler.extensionOf(path));
            if (language.isEmpty()) {
                continue;
            }
            readText(path).ifPresent(text -> units.add(SourceUnit.builder()
                    .fileName(name)
                    .language(language.get())
                    .rawText(text)
                    .build()));
        }

        HexImage hex = HexImage.empty();
        for (Path path : files.getHexFiles()) {
            Optional<String> text = readText(path);
            if (text.isPresent()) {
                hex = hex.merge(IntelHexParser.parse(text.get()));
            }
        }

        FilePresence presence = FilePresence.builder()
                .sourceFilePresent(!files.getSourceFiles().isEmpty())
                .hexFilePresent(!files.getHexFiles().isEmpty())
                .extensionsFound(new TreeSet<>(files.getExtensions()))
                .build();

        Submission submission = Submission.of(files.getStudentId(), units, tokenize(files.getStudentId(), units),
                hex, presence);
        if (!submission.isValid()) {
            log.warn("学生 {} {}", submission.getStudentId(), submission.getInvalidReason());
        }
        return submission;
    }

    /**
     * 由上传的文本直接组装作业，文件名用于识别源文件语言。
     *
     * @param hexText HEX 文件内容，可为 null 表示未提交
     */
    public Submission assemble(String studentId, List<SourceUnit> sources, String hexText) {
        List<SourceUnit> units = new ArrayList<>();
        Set<String> extensions = new TreeSet<>();
        boolean sourcePresent = false;
        if (sources != null) {
            for (SourceUnit unit : sources) {
                String extension = SubmissionCrawler.extensionOf(unit.getFileName());
                if (!extension.isEmpty()) {
                    extensions.add(extension);
                }
                SourceLanguage language = unit.getLanguage() != null
                        ? unit.getLanguage()
                        : SourceLanguage.fromExtension(extension).orElse(null);
                if (language == null) {
                    continue;
                }
                sourcePresent = true;
                units.add(SourceUnit.builder()
                        .fileName(unit.getFileName())
                        .language(language)
                        .rawText(unit.getRawText() == null ? "" : unit.getRawText())
                        .build());
            }
        }

        boolean hexPresent = hexText != null && !hexText.isBlank();
        if (hexPresent) {
            extensions.add(SubmissionCrawler.HEX_EXTENSION);
        }
        HexImage hex = hexPresent ? IntelHexParser.parse(hexText) : HexImage.empty();

        FilePresence presence = FilePresence.builder()
                .sourceFilePresent(sourcePresent)
                .hexFilePresent(hexPresent)
                .extensionsFound(extensions)
                .build();
        return Submission.of(studentId, units, tokenize(studentId, units), hex, presence);
    }

    /**
     * 清洗全部源文件并按文件顺序拼接 token。启用编译时 C 文件以编译出的汇编代替，编译失败的文件不贡献 token。
     */
    List<String> tokenize(String studentId, List<SourceUnit> units) {
        boolean compile = properties.getCompiler().isEnabled() && compiler.isAvailable();
        List<String> tokens = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (compile && unit.getLanguage() == SourceLanguage.C) {
                CompilationResult result = compiler.compile(unit.getFileName(), unit.getRawText());
                if (result.isSuccess()) {
                    tokens.addAll(SourceCleaner.clean(result.getAssembly(), SourceLanguage.ASSEMBLY));
                    log.debug("学生 {} 的 {} 已编译为汇编", studentId, unit.getFileName());
                } else {
                    log.warn("学生 {} 的 {} 编译失败: {}", studentId, unit.getFileName(), result.getError());
                }
            } else {
                tokens.addAll(SourceCleaner.clean(unit.getRawText(), unit.getLanguage()));
            }
        }
        return tokens;
    }

    private Optional<String> readText(Path path) {
        try {
            long size = Files.size(path);
            if (size > properties.getMaxFileBytes()) {
                log.warn("文件过大已跳过: {} ({} 字节)", path, size);
                return Optional.empty();
            }
            return Optional.of(decoder.decode(Files.readAllBytes(path)));
        } catch (IOException e) {
            log.warn("读取文件失败: {} - {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
