package com.abandonflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Diagnosis {
    private String type;        // 例如 CALL_TOTALS, HUNGUP_SPLIT, PHONE_RESOLUTION, RATE_RANGE
    private String severity;    // INFO / ERROR
    private String title;       // 人类可读标题
    private String detail;      // 实际参与校验的数值

    public boolean isPassed() {
        return !"ERROR".equals(severity);
    }
}
