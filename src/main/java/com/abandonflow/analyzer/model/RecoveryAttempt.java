package com.abandonflow.analyzer.model;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 首次放弃之后与该号码的一次接触。
 */
@Data
public class RecoveryAttempt {
    private RecoveryDirection direction;
    private LocalDateTime contactTime;
    private String contactTimeText;
    private LocalDate businessDate;
    private String disposition;
    private String agent;
    private String talkTime;
    private boolean successful;
}
