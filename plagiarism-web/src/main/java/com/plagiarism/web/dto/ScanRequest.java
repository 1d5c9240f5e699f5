package com.plagiarism.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 扫描服务器本地作业目录的请求，目录下每个子目录是一名学生。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    private String root;
}
