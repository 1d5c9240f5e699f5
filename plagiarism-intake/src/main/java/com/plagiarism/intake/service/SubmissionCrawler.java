package com.plagiarism.intake.service;

import com.plagiarism.common.dto.SourceLanguage;
import com.plagiarism.common.exception.SubmissionIntakeException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * 目录遍历：根目录下的每个一级子目录对应一名学生，目录名即学号，其下文件递归收集。
 * <p>
 * 根目录下直接存放的文件不属于任何学生，忽略。
 */
@Slf4j
@Component
public class SubmissionCrawler {

    static final String HEX_EXTENSION = ".hex";

    /**
     * 一名学生目录下收集到的文件。
     */
    @Data
    public static class StudentFiles {
        private final String studentId;
        private final List<Path> sourceFiles = new ArrayList<>();
        private final List<Path> hexFiles = new ArrayList<>();
        /** 出现过的全部扩展名（小写，含点） */
        private final Set<String> extensions = new TreeSet<>();
    }

    public SortedMap<String, StudentFiles> crawl(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new SubmissionIntakeException("作业根目录不存在或不是目录: " + root);
        }

        SortedMap<String, StudentFiles> students = new TreeMap<>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path dir : children.filter(Files::isDirectory).sorted().toList()) {
                StudentFiles files = new StudentFiles(dir.getFileName().toString());
                collect(dir, files);
                students.put(files.getStudentId(), files);
            }
        } catch (IOException e) {
            throw new SubmissionIntakeException("读取作业根目录失败: " + root, e);
        }

        log.info("目录遍历完成: {} 名学生 ({})", students.size(), root);
        return students;
    }

    private void collect(Path studentDir, StudentFiles files) throws IOException {
        try (Stream<Path> walk = Files.walk(studentDir)) {
            for (Path file : walk.filter(Files::isRegularFile).sorted().toList()) {
                String extension = extensionOf(file);
                if (!extension.isEmpty()) {
                    files.getExtensions().add(extension);
                }
                if (HEX_EXTENSION.equals(extension)) {
                    files.getHexFiles().add(file);
                } else if (SourceLanguage.fromExtension(extension).isPresent()) {
                    files.getSourceFiles().add(file);
                }
            }
        }
        log.debug("学生 {}: 源文件 {} 个, HEX 文件 {} 个, 扩展名 {}", files.getStudentId(),
                files.getSourceFiles().size(), files.getHexFiles().size(), files.getExtensions());
    }

    static String extensionOf(Path file) {
        return extensionOf(file.getFileName().toString());
    }

    static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
