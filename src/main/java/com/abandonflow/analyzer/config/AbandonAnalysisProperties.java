package com.abandonflow.analyzer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 放弃呼叫分析的业务常量。
 * 默认值即生产口径，application.yml 只在需要时覆盖。
 */
@Data
@ConfigurationProperties(prefix = "abandon.analysis")
public class AbandonAnalysisProperties {

    /** 排队等待超过该秒数后挂机才算放弃；小于等于该值视为 quick drop */
    private int quickDropThresholdSeconds = 27;

    /** 业务日起始小时：早于该小时的呼叫归入前一个业务日（6AM-6AM） */
    private int businessDayStartHour = 6;

    /** 时间戳允许的最早时间 = now - pastDays */
    private int timestampPastDays = 730;

    /** 时间戳允许的最晚时间 = now + futureDays */
    private int timestampFutureDays = 365;

    /** 视为“已解决”的坐席处置码（精确匹配） */
    private List<String> successfulDispositions = new ArrayList<>(List.of(
            "Others", "MI", "PQC", "AE", "AE MI", "AE PQC", "Non-case", "Test",
            "AE PQC MI", "PQC MI", "Inbound Follow-up", "Translation AE"
    ));

    private Inbound inbound = new Inbound();

    private Outbound outbound = new Outbound();

    private FollowUp followUp = new FollowUp();

    private Workbook workbook = new Workbook();

    @Data
    public static class Inbound {
        /** Answered/Hungup 列的取值 */
        private String answeredMarker = "ANSWERED";
        private String hungupMarker = "HUNGUP";
    }

    @Data
    public static class Outbound {
        /** 只有人工外呼才算回拨尝试 */
        private String manualDialCallType = "outbound.manual.dial";
        private String connectedStatus = "CONNECTED";
    }

    @Data
    public static class FollowUp {
        /** 放弃次数大于该值为 HIGH */
        private int highPriorityAbove = 2;
        /** 放弃次数大于该值为 MEDIUM */
        private int mediumPriorityAbove = 1;
    }

    @Data
    public static class Workbook {
        /** 读取第几个 sheet（从 0 开始） */
        private int sheetIndex = 0;
    }
}
