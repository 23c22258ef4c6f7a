package com.abandonflow.analyzer.correlate;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.NormalizedInboundCall;
import com.abandonflow.analyzer.model.NormalizedOutboundCall;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import com.abandonflow.analyzer.model.QueueOutcome;
import com.abandonflow.analyzer.model.RecoveryAttempt;
import com.abandonflow.analyzer.model.RecoveryDirection;
import com.abandonflow.analyzer.model.ResolutionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 为每个放弃号码查找首次放弃之后的回访接触，原地更新聚合的状态。
 *
 * 查找顺序：
 *   1. 先扫完呼入日志（客户自己打回来且被接通）
 *   2. 呼入没有成功时再扫外呼日志（人工外呼且接通）
 * 遇到第一条成功处置即 RECOVERED 并停止；未成功的接触只保留第一条（ATTEMPTED）。
 * 不设时间上限，回拨可能排在几天之后。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecoveryMatcher {

    private final AbandonAnalysisProperties properties;

    public void match(Map<String, PhoneAbandonAggregate> aggregates,
                      List<NormalizedInboundCall> inbound,
                      List<NormalizedOutboundCall> outbound) {
        if (aggregates.isEmpty()) {
            log.info("No abandon phone numbers to search recovery for");
            return;
        }

        PhoneCallIndex<NormalizedInboundCall> inboundIndex = new PhoneCallIndex<>(inbound, NormalizedInboundCall::getPhone);
        PhoneCallIndex<NormalizedOutboundCall> outboundIndex = new PhoneCallIndex<>(outbound, NormalizedOutboundCall::getPhone);
        Set<String> successful = new HashSet<>(properties.getSuccessfulDispositions());

        int recovered = 0;
        int attempted = 0;
        for (PhoneAbandonAggregate aggregate : aggregates.values()) {
            matchPhone(aggregate, inboundIndex.callsFor(aggregate.getPhone()),
                    outboundIndex.callsFor(aggregate.getPhone()), successful);
            if (aggregate.getRecoveryStatus() == ResolutionStatus.RECOVERED) {
                recovered++;
            } else if (aggregate.getRecoveryStatus() == ResolutionStatus.ATTEMPTED) {
                attempted++;
            }
        }
        log.info("Found recovery calls for {} phone numbers, attempted without success={}, needs outbound={}",
                recovered, attempted, aggregates.size() - recovered - attempted);
    }

    private void matchPhone(PhoneAbandonAggregate aggregate,
                            List<NormalizedInboundCall> inboundCalls,
                            List<NormalizedOutboundCall> outboundCalls,
                            Set<String> successful) {
        LocalDateTime firstAbandon = aggregate.getFirstAbandonTime();

        for (NormalizedInboundCall call : inboundCalls) {
            if (call.getOutcome() != QueueOutcome.ANSWERED || !call.getCallTime().isAfter(firstAbandon)) {
                continue;
            }
            InboundCallRecord r = call.getRecord();
            RecoveryAttempt attempt = attempt(RecoveryDirection.INBOUND, call.getCallTime(), r.getCallTime(),
                    call.getBusinessDate(), r.getDispositionCode(), r.getUsername(), r.getTalkTime(), successful);
            if (apply(aggregate, attempt)) {
                return;
            }
        }

        for (NormalizedOutboundCall call : outboundCalls) {
            OutboundCallRecord r = call.getRecord();
            if (!isManualConnected(r) || !call.getCallTime().isAfter(firstAbandon)) {
                continue;
            }
            RecoveryAttempt attempt = attempt(RecoveryDirection.OUTBOUND, call.getCallTime(), r.getCallTime(),
                    call.getBusinessDate(), r.getDispositionCode(), r.getUserName(), r.getTalkTime(), successful);
            if (apply(aggregate, attempt)) {
                return;
            }
        }
    }

    /** @return true 表示已找到成功接触，停止扫描该号码 */
    private boolean apply(PhoneAbandonAggregate aggregate, RecoveryAttempt attempt) {
        if (attempt.isSuccessful()) {
            aggregate.markRecovered(attempt);
            log.debug("Phone {} recovered by {} contact at {} ({})", aggregate.getPhone(),
                    attempt.getDirection(), attempt.getContactTime(), attempt.getDisposition());
            return true;
        }
        aggregate.recordTentativeAttempt(attempt);
        return false;
    }

    private boolean isManualConnected(OutboundCallRecord r) {
        return equalsTrimmed(r.getCallType(), properties.getOutbound().getManualDialCallType())
                && equalsTrimmed(r.getSystemDisposition(), properties.getOutbound().getConnectedStatus());
    }

    private static RecoveryAttempt attempt(RecoveryDirection direction,
                                           LocalDateTime contactTime,
                                           String contactTimeText,
                                           LocalDate businessDate,
                                           String disposition,
                                           String agent,
                                           String talkTime,
                                           Set<String> successful) {
        String code = disposition == null ? "" : disposition.trim();
        RecoveryAttempt a = new RecoveryAttempt();
        a.setDirection(direction);
        a.setContactTime(contactTime);
        a.setContactTimeText(contactTimeText);
        a.setBusinessDate(businessDate);
        a.setDisposition(code);
        a.setAgent(agent == null ? "" : agent);
        a.setTalkTime(talkTime == null || talkTime.isBlank() ? "00:00:00" : talkTime);
        a.setSuccessful(successful.contains(code));
        return a;
    }

    private static boolean equalsTrimmed(String value, String expected) {
        return value != null && value.trim().equalsIgnoreCase(expected);
    }
}
