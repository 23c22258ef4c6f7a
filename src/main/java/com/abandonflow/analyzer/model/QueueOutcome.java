package com.abandonflow.analyzer.model;

/**
 * Answered/Hungup 列归一化后的结果。
 */
public enum QueueOutcome {
    ANSWERED,
    HUNGUP,
    /** 其它取值或空值：计入有效呼叫，但既不算接通也不算挂机 */
    OTHER
}
