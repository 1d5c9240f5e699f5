package com.plagiarism.web.controller;

import com.plagiarism.common.dto.ApiResponse;
import com.plagiarism.common.dto.DetectionReport;
import com.plagiarism.common.dto.SourceUnit;
import com.plagiarism.common.dto.Submission;
import com.plagiarism.common.exception.SubmissionIntakeException;
import com.plagiarism.engine.config.EngineProperties;
import com.plagiarism.engine.service.DetectionService;
import com.plagiarism.intake.service.SubmissionLoader;
import com.plagiarism.web.dto.DetectionRequest;
import com.plagiarism.web.dto.ScanRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 抄袭检测 REST API 控制器。
 * <p>
 * 支持两种输入：
 * 1. 请求体直接携带每名学生的源文件与 HEX 内容
 * 2. 指定服务器本地的作业根目录，按子目录采集
 */
@Slf4j
@RestController
@RequestMapping("/api/detections")
@RequiredArgsConstructor
public class DetectionController {

    private final SubmissionLoader submissionLoader;
    private final DetectionService detectionService;
    private final EngineProperties engineProperties;

    @PostMapping
    public ApiResponse<DetectionReport> detect(@RequestBody DetectionRequest request) {
        if (request == null || request.getSubmissions() == null || request.getSubmissions().isEmpty()) {
            throw new SubmissionIntakeException("未提供任何作业");
        }
        log.info("收到检测请求: {} 份作业", request.getSubmissions().size());

        List<Submission> submissions = new ArrayList<>();
        for (DetectionRequest.SubmissionPayload payload : request.getSubmissions()) {
            if (payload == null || payload.getStudentId() == null || payload.getStudentId().isBlank()) {
                throw new SubmissionIntakeException("作业缺少学号");
            }
            String studentId = payload.getStudentId().trim();
            submissions.add(submissionLoader.assemble(
                    studentId, toUnits(studentId, payload.getFiles()), payload.getHexText()));
        }
        return ApiResponse.ok(detectionService.detect(submissions), "检测完成");
    }

    /**
     * 扫描服务器本地目录。
     */
    @PostMapping("/scan")
    public ApiResponse<DetectionReport> scan(@RequestBody ScanRequest request) {
        if (request == null || request.getRoot() == null || request.getRoot().isBlank()) {
            throw new SubmissionIntakeException("未指定作业根目录");
        }
        Path root;
        try {
            root = Path.of(request.getRoot().trim());
        } catch (InvalidPathException e) {
            throw new SubmissionIntakeException("作业根目录路径非法: " + request.getRoot(), e);
        }
        log.info("收到目录扫描请求: {}", root);

        List<Submission> submissions = submissionLoader.loadDirectory(root);
        return ApiResponse.ok(detectionService.detect(submissions), "检测完成");
    }

    /** 当前生效的引擎配置 */
    @GetMapping("/config")
    public ApiResponse<EngineProperties> config() {
        return ApiResponse.ok(engineProperties);
    }

    private static List<SourceUnit> toUnits(String studentId, List<DetectionRequest.FilePayload> files) {
        List<SourceUnit> units = new ArrayList<>();
        if (files == null) {
            return units;
        }
        for (DetectionRequest.FilePayload file : files) {
            if (file == null || file.getFileName() == null || file.getFileName().isBlank()) {
                throw new SubmissionIntakeException("学生 " + studentId + " 的源文件缺少文件名");
            }
            units.add(SourceUnit.builder()
                    .fileName(file.getFileName())
                    .rawText(file.getContent())
                    .build());
        }
        return units;
    }
}
