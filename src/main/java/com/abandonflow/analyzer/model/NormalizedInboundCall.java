package com.abandonflow.analyzer.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 号码和时间都校验通过的呼入记录。后续所有统计都只看这个类型。
 */
@Value
public class NormalizedInboundCall {

    InboundCallRecord record;

    /** 10 位号码 */
    String phone;

    LocalDateTime callTime;

    LocalDate businessDate;

    QueueOutcome outcome;

    int waitSeconds;
}
