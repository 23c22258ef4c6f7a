package com.abandonflow.analyzer.model;

/** 声明顺序即排序顺序 */
public enum FollowUpPriority {
    HIGH,
    MEDIUM,
    NORMAL
}
