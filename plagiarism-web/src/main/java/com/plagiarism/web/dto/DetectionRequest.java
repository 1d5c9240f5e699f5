package com.plagiarism.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 直接上传作业内容的检测请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRequest {

    @Builder.Default
    private List<SubmissionPayload> submissions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SubmissionPayload {

        private String studentId;

        /** 源文件，按文件名扩展名识别语言 */
        @Builder.Default
        private List<FilePayload> files = new ArrayList<>();

        /** HEX 文件内容，未提交时为 null */
        private String hexText;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FilePayload {
        private String fileName;
        private String content;
    }
}
