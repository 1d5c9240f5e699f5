package com.plagiarism.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plagiarism.common.dto.DetectionReport;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.config.ScanProperties;
import com.plagiarism.engine.service.DetectionService;
import com.plagiarism.intake.service.SubmissionLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 命令行扫描：配置了 {@code plagiarism.scan.root} 时，启动后扫描该目录并写出 JSON 报告。
 * <p>
 * 只做一次扫描可配合 {@code --spring.main.web-application-type=none} 启动，扫描结束即退出。
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ScanCommandRunner implements CommandLineRunner {

    private final SubmissionLoader submissionLoader;
    private final DetectionService detectionService;
    private final ScanProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) {
        if (properties.getRoot() == null || properties.getRoot().isBlank()) {
            return;
        }
        Path root = Path.of(properties.getRoot().trim());
        Path output = Path.of(properties.getOutput());
        log.info("命令行扫描: {} → {}", root, output);

        List<Submission> submissions = submissionLoader.loadDirectory(root);
        DetectionReport report = detectionService.detect(submissions);
        write(report, output);

        log.info("报告已写入 {}: {} 份作业, {} 对可疑, {} 对判定抄袭",
                output.toAbsolutePath(), report.getTotalSubmissions(), report.getCandidateCount(),
                report.getPlagiarizedCount());
    }

    private void write(DetectionReport report, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), report);
        } catch (IOException e) {
            throw new IllegalStateException("无法写入检测报告: " + output, e);
        }
    }
}
