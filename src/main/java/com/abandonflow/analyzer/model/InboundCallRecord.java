package com.abandonflow.analyzer.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * ACD 呼入日志中的一行，字段保持原始文本，不做任何解析。
 */
@Value
@Builder
@Jacksonized
public class InboundCallRecord {

    /** 源文件中的行号（Excel 行号，表头为第 1 行），0 表示未知 */
    int rowNumber;

    String phone;

    /** Answered/Hungup */
    String answeredHungup;

    /** Wait Time at ACD，HH:MM:SS */
    String waitTime;

    String callTime;

    String queueName;

    String username;

    /** User Disposition Code */
    String dispositionCode;

    /** User Talk Time，HH:MM:SS */
    String talkTime;

    public CallSource getSource() {
        return CallSource.INBOUND_QUEUE;
    }
}
