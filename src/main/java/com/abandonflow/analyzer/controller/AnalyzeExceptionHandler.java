package com.abandonflow.analyzer.controller;

import com.abandonflow.analyzer.parser.CallLogReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * 文件整体不可读时返回 400 + ProblemDetail。
 */
@RestControllerAdvice
@Slf4j
public class AnalyzeExceptionHandler {

    @ExceptionHandler(CallLogReadException.class)
    public ProblemDetail handleUnreadableLog(CallLogReadException e) {
        log.warn("Rejecting upload: {}", e.getMessage());
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
        pd.setTitle("Unreadable call log");
        pd.setProperty("timestamp", Instant.now().toString());
        return pd;
    }
}
