package com.abandonflow.analyzer.model;

public enum DataQualityIssueType {
    INVALID_PHONE,
    INVALID_TIMESTAMP,
    INVALID_DURATION,
    MISSING_COLUMN,
    EMPTY_DATASET
}
