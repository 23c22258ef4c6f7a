package com.abandonflow.analyzer.service;

import com.abandonflow.analyzer.correlate.AbandonDetector;
import com.abandonflow.analyzer.correlate.RecoveryMatcher;
import com.abandonflow.analyzer.metrics.ConsistencyValidator;
import com.abandonflow.analyzer.metrics.FollowUpPlanner;
import com.abandonflow.analyzer.metrics.MetricsAggregator;
import com.abandonflow.analyzer.model.AbandonAnalysisResult;
import com.abandonflow.analyzer.model.CallSource;
import com.abandonflow.analyzer.model.DataQualityIssueType;
import com.abandonflow.analyzer.model.DataQualityLog;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.NormalizedInboundCall;
import com.abandonflow.analyzer.model.NormalizedOutboundCall;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import com.abandonflow.analyzer.parser.CallLogWorkbookReader;
import com.abandonflow.analyzer.parser.CallRecordNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * 放弃呼叫分析主流程：
 * 归一化 -> 放弃识别 -> 回访匹配 -> 指标 -> 自检 -> 分派清单。
 * 每次调用的状态都在方法内部，组件本身无状态。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AbandonAnalysisService {

    private final CallLogWorkbookReader workbookReader;
    private final CallRecordNormalizer recordNormalizer;
    private final AbandonDetector abandonDetector;
    private final RecoveryMatcher recoveryMatcher;
    private final MetricsAggregator metricsAggregator;
    private final ConsistencyValidator consistencyValidator;
    private final FollowUpPlanner followUpPlanner;

    /**
     * @param acdWorkbook  呼入日志工作簿，必填
     * @param callWorkbook 外呼日志工作簿，可以为 null
     */
    public AbandonAnalysisResult analyzeWorkbooks(InputStream acdWorkbook, InputStream callWorkbook) {
        DataQualityLog issues = new DataQualityLog();
        List<InboundCallRecord> inbound = workbookReader.readInbound(acdWorkbook, issues);
        List<OutboundCallRecord> outbound = callWorkbook == null
                ? List.of()
                : workbookReader.readOutbound(callWorkbook, issues);
        if (callWorkbook == null) {
            log.info("CALL data not provided - proceeding with ACD data only");
        }
        return analyze(inbound, outbound, issues);
    }

    public AbandonAnalysisResult analyze(List<InboundCallRecord> inbound, List<OutboundCallRecord> outbound) {
        return analyze(inbound, outbound, new DataQualityLog());
    }

    AbandonAnalysisResult analyze(List<InboundCallRecord> inbound,
                                  List<OutboundCallRecord> outbound,
                                  DataQualityLog issues) {
        log.info("Starting abandon calls analysis: inbound={}, outbound={}",
                inbound == null ? 0 : inbound.size(), outbound == null ? 0 : outbound.size());

        AbandonAnalysisResult result = new AbandonAnalysisResult();
        if (inbound == null || inbound.isEmpty()) {
            issues.add(DataQualityIssueType.EMPTY_DATASET, CallSource.INBOUND_QUEUE, 0, null, "No data to process");
            log.warn("Inbound dataset is empty, returning empty analysis");
            finish(result, issues);
            return result;
        }

        List<NormalizedInboundCall> inboundCalls = recordNormalizer.normalizeInbound(inbound, issues);
        List<NormalizedOutboundCall> outboundCalls = recordNormalizer.normalizeOutbound(outbound, issues);

        Map<String, PhoneAbandonAggregate> aggregates = abandonDetector.detect(inboundCalls);
        recoveryMatcher.match(aggregates, inboundCalls, outboundCalls);

        result.setAggregates(aggregates);
        result.setSummary(metricsAggregator.summarize(inboundCalls, aggregates));
        result.setDaily(metricsAggregator.daily(inboundCalls, aggregates));
        result.setFollowUps(followUpPlanner.plan(aggregates));
        finish(result, issues);
        return result;
    }

    private void finish(AbandonAnalysisResult result, DataQualityLog issues) {
        result.setConsistencyChecks(consistencyValidator.validate(result.getSummary()));
        result.setIssues(issues.getIssues());
        result.setIssueCounts(issues.countsByType());
        if (!issues.isEmpty()) {
            log.info("⚠️ DATA QUALITY ISSUES: {}", issues.getIssues().size());
            result.getIssueCounts().forEach((type, count) -> log.info("   {}: {} instances", type, count));
        }
    }
}
