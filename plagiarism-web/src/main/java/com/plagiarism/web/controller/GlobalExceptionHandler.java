package com.plagiarism.web.controller;

import com.plagiarism.common.dto.ApiResponse;
import com.plagiarism.common.exception.JudgmentServiceException;
import com.plagiarism.common.exception.KeyPoolExhaustedException;
import com.plagiarism.common.exception.PlagiarismException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 把检测接口的异常转成统一的 {@link ApiResponse}。
 * 输入或配置问题返回 400；判定服务侧的问题（Key 耗尽、模型调用失败）返回 503，便于调用方稍后重试。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PlagiarismException.class)
    public ResponseEntity<ApiResponse<Void>> handleDetectionFailure(PlagiarismException e) {
        HttpStatus status = isUpstreamFailure(e) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_REQUEST;
        log.warn("检测请求失败 {} [{}]: {}", status.value(), e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status).body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    private static boolean isUpstreamFailure(PlagiarismException e) {
        return e instanceof KeyPoolExhaustedException || e instanceof JudgmentServiceException;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("作业 JSON 无法解析", e);
        return ApiResponse.error("BAD_REQUEST", "请求体不是合法的作业 JSON");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNoResourceFound(NoResourceFoundException e) {
        return ApiResponse.error("NOT_FOUND", "路径不存在: /" + e.getResourcePath());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleUnexpected(Exception e) {
        log.error("检测过程中出现未预期的错误", e);
        return ApiResponse.error("SYSTEM_ERROR", "系统内部错误，请稍后重试");
    }
}
