package com.abandonflow.analyzer.controller;

import com.abandonflow.analyzer.model.AbandonAnalysisResult;
import com.abandonflow.analyzer.model.AnalyzeRecordsRequest;
import com.abandonflow.analyzer.service.AbandonAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/api/abandon")
@Slf4j
@RequiredArgsConstructor
public class AnalyzeController {

    private final AbandonAnalysisService analysisService;

    /**
     * 上传 ACD 呼入工作簿（必填）和外呼工作簿（可选）。
     */
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AbandonAnalysisResult analyzeWorkbooks(@RequestPart("acdFile") MultipartFile acdFile,
                                                  @RequestPart(value = "callFile", required = false) MultipartFile callFile)
            throws IOException {
        log.info("收到 ACD 文件: name={}, size={}", acdFile.getOriginalFilename(), acdFile.getSize());
        boolean hasCallFile = callFile != null && !callFile.isEmpty();
        if (hasCallFile) {
            log.info("收到外呼文件: name={}, size={}", callFile.getOriginalFilename(), callFile.getSize());
        }
        try (InputStream acd = acdFile.getInputStream();
             InputStream call = hasCallFile ? callFile.getInputStream() : null) {
            return analysisService.analyzeWorkbooks(acd, call);
        }
    }

    /**
     * 直接提交已结构化的记录。
     */
    @PostMapping(value = "/analyze/records", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AbandonAnalysisResult analyzeRecords(@RequestBody AnalyzeRecordsRequest request) {
        log.info("收到结构化记录: inbound={}, outbound={}",
                request.getInbound() == null ? 0 : request.getInbound().size(),
                request.getOutbound() == null ? 0 : request.getOutbound().size());
        return analysisService.analyze(request.getInbound(), request.getOutbound());
    }
}
