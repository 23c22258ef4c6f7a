package com.abandonflow.analyzer.model;

public enum RecoveryDirection {
    /** 客户自己再次呼入并被接通 */
    INBOUND,
    /** 坐席人工外呼并接通 */
    OUTBOUND
}
