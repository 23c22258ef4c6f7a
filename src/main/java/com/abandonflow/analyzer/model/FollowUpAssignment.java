package com.abandonflow.analyzer.model;

import lombok.Data;

import java.time.LocalDate;

/**
 * 给组长分派的待回拨号码。
 */
@Data
public class FollowUpAssignment {
    private String phone;
    private FollowUpPriority priority;
    private int totalAbandonCalls;
    private String firstAbandonTime;
    private LocalDate firstAbandonBusinessDate;
    private ResolutionStatus recoveryStatus;
    private String notes;
}
