package com.abandonflow.analyzer;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import com.abandonflow.analyzer.parser.FieldNormalizer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 测试共用：固定时钟（2025-09-01 12:00 UTC）和记录构造。
 */
public final class TestFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-09-01T12:00:00Z"), ZoneOffset.UTC);

    private static int rowCounter = 1;

    private TestFixtures() {
    }

    public static AbandonAnalysisProperties properties() {
        return new AbandonAnalysisProperties();
    }

    public static FieldNormalizer fieldNormalizer() {
        return new FieldNormalizer(properties(), FIXED_CLOCK);
    }

    public static InboundCallRecord hungup(String phone, String callTime, String waitTime) {
        return inbound(phone, "HUNGUP", callTime, waitTime, "");
    }

    public static InboundCallRecord answered(String phone, String callTime, String disposition) {
        return inbound(phone, "ANSWERED", callTime, "00:00:10", disposition);
    }

    public static InboundCallRecord inbound(String phone, String answeredHungup, String callTime,
                                            String waitTime, String disposition) {
        return InboundCallRecord.builder()
                .rowNumber(++rowCounter)
                .phone(phone)
                .answeredHungup(answeredHungup)
                .waitTime(waitTime)
                .callTime(callTime)
                .queueName("Q_MAIN")
                .username("agent.one")
                .dispositionCode(disposition)
                .talkTime("00:03:00")
                .build();
    }

    public static OutboundCallRecord manualConnected(String phone, String callTime, String disposition) {
        return outbound(phone, "outbound.manual.dial", "CONNECTED", callTime, disposition);
    }

    public static OutboundCallRecord outbound(String phone, String callType, String systemDisposition,
                                              String callTime, String disposition) {
        return OutboundCallRecord.builder()
                .rowNumber(++rowCounter)
                .phone(phone)
                .callType(callType)
                .systemDisposition(systemDisposition)
                .callTime(callTime)
                .dispositionCode(disposition)
                .userName("agent.two")
                .talkTime("00:02:00")
                .build();
    }
}
