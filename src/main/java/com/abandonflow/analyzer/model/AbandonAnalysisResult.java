package com.abandonflow.analyzer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次分析的完整输出，交给外部的报表层使用：
 * {
 *   summary, aggregates, daily, consistencyChecks, followUps, issues, issueCounts
 * }
 */
@Data
public class AbandonAnalysisResult {
    private SummaryMetrics summary = new SummaryMetrics();

    /** 号码 -> 汇总，按首次出现顺序 */
    private Map<String, PhoneAbandonAggregate> aggregates = new LinkedHashMap<>();

    /** 按业务日升序 */
    private List<DailyMetrics> daily = new ArrayList<>();

    private List<Diagnosis> consistencyChecks = new ArrayList<>();

    private List<FollowUpAssignment> followUps = new ArrayList<>();

    private List<DataQualityIssue> issues = new ArrayList<>();

    private Map<DataQualityIssueType, Integer> issueCounts = new EnumMap<>(DataQualityIssueType.class);
}
