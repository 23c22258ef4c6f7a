package com.abandonflow.analyzer.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Value
public class NormalizedOutboundCall {

    OutboundCallRecord record;

    String phone;

    LocalDateTime callTime;

    LocalDate businessDate;
}
