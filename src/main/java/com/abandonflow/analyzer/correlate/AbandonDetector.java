package com.abandonflow.analyzer.correlate;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.AbandonEvent;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.NormalizedInboundCall;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import com.abandonflow.analyzer.model.QueueOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从呼入日志里找出放弃呼叫，按号码聚合。
 * 放弃 = HUNGUP 且排队等待超过 quick drop 阈值；其余记录不进入聚合。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AbandonDetector {

    private final AbandonAnalysisProperties properties;

    public boolean isAbandon(NormalizedInboundCall call) {
        return call.getOutcome() == QueueOutcome.HUNGUP
                && call.getWaitSeconds() > properties.getQuickDropThresholdSeconds();
    }

    /**
     * @param calls 已校验的呼入记录，保持原始顺序
     * @return 号码 -> 放弃汇总，按号码首次放弃出现的顺序
     */
    public Map<String, PhoneAbandonAggregate> detect(List<NormalizedInboundCall> calls) {
        Map<String, PhoneAbandonAggregate> aggregates = new LinkedHashMap<>();
        int abandonCalls = 0;

        for (NormalizedInboundCall call : calls) {
            if (!isAbandon(call)) {
                continue;
            }
            abandonCalls++;
            AbandonEvent event = toEvent(call);
            PhoneAbandonAggregate existing = aggregates.get(call.getPhone());
            if (existing == null) {
                aggregates.put(call.getPhone(),
                        new PhoneAbandonAggregate(call.getPhone(), call.getRecord().getPhone(), event));
            } else {
                existing.addEvent(event);
            }
        }

        log.info("Found {} unique phone numbers with abandon calls, total abandon calls={}",
                aggregates.size(), abandonCalls);
        return aggregates;
    }

    private AbandonEvent toEvent(NormalizedInboundCall call) {
        InboundCallRecord r = call.getRecord();
        AbandonEvent e = new AbandonEvent();
        e.setCallTime(call.getCallTime());
        e.setCallTimeText(r.getCallTime());
        e.setBusinessDate(call.getBusinessDate());
        e.setWaitSeconds(call.getWaitSeconds());
        e.setWaitTimeText(r.getWaitTime());
        e.setQueueName(nullToEmpty(r.getQueueName()));
        e.setAgent(nullToEmpty(r.getUsername()));
        e.setDisposition(nullToEmpty(r.getDispositionCode()));
        return e;
    }

    private static String nullToEmpty(String v) {
        return v == null ? "" : v;
    }
}
