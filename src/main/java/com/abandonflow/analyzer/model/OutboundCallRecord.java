package com.abandonflow.analyzer.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 外呼拨号日志中的一行，字段保持原始文本。
 */
@Value
@Builder
@Jacksonized
public class OutboundCallRecord {

    int rowNumber;

    String phone;

    /** 例如 outbound.manual.dial */
    String callType;

    /** 例如 CONNECTED */
    String systemDisposition;

    String callTime;

    String dispositionCode;

    String userName;

    String talkTime;

    public CallSource getSource() {
        return CallSource.OUTBOUND_DIALER;
    }
}
