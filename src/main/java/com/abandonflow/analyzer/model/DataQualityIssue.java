package com.abandonflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条数据质量问题。出问题的记录会被排除，但分析继续进行。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataQualityIssue {
    private DataQualityIssueType type;
    private CallSource source;   // 可能为 null（与具体日志无关的问题）
    private int rowNumber;       // 0 表示不针对某一行
    private String rawValue;
    private String detail;
}
