package com.abandonflow.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单次分析内收集数据质量问题，随结果一起返回，不在单例组件上累积。
 */
public class DataQualityLog {

    private final List<DataQualityIssue> issues = new ArrayList<>();

    public void add(DataQualityIssueType type, CallSource source, int rowNumber, String rawValue, String detail) {
        issues.add(new DataQualityIssue(type, source, rowNumber, rawValue, detail));
    }

    public List<DataQualityIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public Map<DataQualityIssueType, Integer> countsByType() {
        Map<DataQualityIssueType, Integer> counts = new EnumMap<>(DataQualityIssueType.class);
        for (DataQualityIssue issue : issues) {
            counts.merge(issue.getType(), 1, Integer::sum);
        }
        return counts;
    }
}
