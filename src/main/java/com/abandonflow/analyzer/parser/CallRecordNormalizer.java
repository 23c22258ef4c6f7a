package com.abandonflow.analyzer.parser;

import com.abandonflow.analyzer.model.CallSource;
import com.abandonflow.analyzer.model.DataQualityLog;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.NormalizedInboundCall;
import com.abandonflow.analyzer.model.NormalizedOutboundCall;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import com.abandonflow.analyzer.model.QueueOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 把原始记录逐条过一遍 FieldNormalizer，每条记录只归一化一次。
 * 号码或时间任一无效的记录直接丢弃（问题已记入 DataQualityLog），输入顺序保持不变。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CallRecordNormalizer {

    private final FieldNormalizer fieldNormalizer;

    public List<NormalizedInboundCall> normalizeInbound(List<InboundCallRecord> records, DataQualityLog issues) {
        List<NormalizedInboundCall> result = new ArrayList<>();
        if (records == null) {
            return result;
        }
        int skipped = 0;
        for (int i = 0; i < records.size(); i++) {
            InboundCallRecord r = records.get(i);
            if (r == null) {
                // JSON 提交时可能混入 null 元素
                skipped++;
                log.warn("Skip null {} record at position {}", CallSource.INBOUND_QUEUE, i);
                continue;
            }
            CallSource source = CallSource.INBOUND_QUEUE;
            String phone = fieldNormalizer.normalizePhone(r.getPhone(), source, r.getRowNumber(), issues);
            if (phone == null) {
                skipped++;
                continue;
            }
            LocalDateTime callTime = fieldNormalizer.normalizeTimestamp(r.getCallTime(), source, r.getRowNumber(), issues);
            if (callTime == null) {
                skipped++;
                continue;
            }
            QueueOutcome outcome = fieldNormalizer.queueOutcome(r.getAnsweredHungup());
            // 只有挂机记录需要等待时长，避免对接通记录重复报时长问题
            int waitSeconds = outcome == QueueOutcome.HUNGUP
                    ? fieldNormalizer.durationSeconds(r.getWaitTime(), source, r.getRowNumber(), issues)
                    : 0;
            result.add(new NormalizedInboundCall(r, phone, callTime,
                    fieldNormalizer.businessDate(callTime), outcome, waitSeconds));
        }
        log.info("Normalized inbound records: total={}, valid={}, skipped={}",
                records.size(), result.size(), skipped);
        return result;
    }

    public List<NormalizedOutboundCall> normalizeOutbound(List<OutboundCallRecord> records, DataQualityLog issues) {
        List<NormalizedOutboundCall> result = new ArrayList<>();
        if (records == null) {
            return result;
        }
        int skipped = 0;
        for (int i = 0; i < records.size(); i++) {
            OutboundCallRecord r = records.get(i);
            if (r == null) {
                // JSON 提交时可能混入 null 元素
                skipped++;
                log.warn("Skip null {} record at position {}", CallSource.OUTBOUND_DIALER, i);
                continue;
            }
            CallSource source = CallSource.OUTBOUND_DIALER;
            String phone = fieldNormalizer.normalizePhone(r.getPhone(), source, r.getRowNumber(), issues);
            if (phone == null) {
                skipped++;
                continue;
            }
            LocalDateTime callTime = fieldNormalizer.normalizeTimestamp(r.getCallTime(), source, r.getRowNumber(), issues);
            if (callTime == null) {
                skipped++;
                continue;
            }
            result.add(new NormalizedOutboundCall(r, phone, callTime, fieldNormalizer.businessDate(callTime)));
        }
        log.info("Normalized outbound records: total={}, valid={}, skipped={}",
                records.size(), result.size(), skipped);
        return result;
    }
}
