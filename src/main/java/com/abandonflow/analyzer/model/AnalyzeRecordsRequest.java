package com.abandonflow.analyzer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON 方式提交的两份日志，outbound 可以为空。
 */
@Data
public class AnalyzeRecordsRequest {
    private List<InboundCallRecord> inbound = new ArrayList<>();
    private List<OutboundCallRecord> outbound = new ArrayList<>();
}
