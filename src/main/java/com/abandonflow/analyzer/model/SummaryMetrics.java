package com.abandonflow.analyzer.model;

import lombok.Data;

/**
 * 全量汇总指标。各字段之间的算术关系由 ConsistencyValidator 复核。
 */
@Data
public class SummaryMetrics {
    private int validCalls;
    private int answeredCalls;
    private int hungupCalls;
    private int quickDrops;             // 挂机且等待 <= 阈值
    private int abandonCalls;           // 挂机且等待 > 阈值
    private int uniqueAbandonPhones;
    private int recoveredPhones;
    private int needingOutboundPhones;  // 含 ATTEMPTED
    private double abandonmentRate;     // 百分比，保留一位小数
}
