package com.abandonflow.analyzer.model;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 一次被判定为放弃的呼入（HUNGUP 且等待超过阈值）。
 */
@Data
public class AbandonEvent {
    private LocalDateTime callTime;
    private String callTimeText;       // 原始时间文本，报表展示用
    private LocalDate businessDate;
    private int waitSeconds;
    private String waitTimeText;
    private String queueName;
    private String agent;
    private String disposition;
}
