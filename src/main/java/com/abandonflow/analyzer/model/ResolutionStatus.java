package com.abandonflow.analyzer.model;

/**
 * 每个放弃号码在回访匹配后的最终状态。
 *
 * 允许的迁移：
 * <pre>
 *   NEEDS_OUTBOUND -> ATTEMPTED
 *   NEEDS_OUTBOUND -> RECOVERED
 *   ATTEMPTED      -> RECOVERED
 * </pre>
 * RECOVERED 为终态。
 */
public enum ResolutionStatus {
    NEEDS_OUTBOUND,
    ATTEMPTED,
    RECOVERED;

    public boolean canTransitionTo(ResolutionStatus target) {
        return switch (this) {
            case NEEDS_OUTBOUND -> target == ATTEMPTED || target == RECOVERED;
            case ATTEMPTED -> target == RECOVERED;
            case RECOVERED -> false;
        };
    }
}
