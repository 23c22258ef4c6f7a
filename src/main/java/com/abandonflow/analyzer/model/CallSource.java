package com.abandonflow.analyzer.model;

public enum CallSource {
    /** ACD 呼入排队日志 */
    INBOUND_QUEUE,
    /** 外呼拨号日志 */
    OUTBOUND_DIALER
}
