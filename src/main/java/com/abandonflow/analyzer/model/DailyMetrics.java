package com.abandonflow.analyzer.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 单个业务日的指标。
 * 号码类指标按号码的“首次放弃业务日”归属，多日重复放弃的号码只计在第一天。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DailyMetrics extends SummaryMetrics {
    private LocalDate businessDate;

    /** 各呼叫数占当天有效呼叫数的百分比 */
    private double answeredPercent;
    private double hungupPercent;
    private double quickDropPercent;
    private double abandonPercent;
}
