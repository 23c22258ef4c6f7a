package com.abandonflow.analyzer.metrics;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.FollowUpAssignment;
import com.abandonflow.analyzer.model.FollowUpPriority;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 组长分派清单：所有未挽回（NEEDS_OUTBOUND / ATTEMPTED）的号码，
 * 按优先级、放弃次数倒序排列。
 */
@Component
@RequiredArgsConstructor
public class FollowUpPlanner {

    private final AbandonAnalysisProperties properties;

    public List<FollowUpAssignment> plan(Map<String, PhoneAbandonAggregate> aggregates) {
        List<FollowUpAssignment> result = new ArrayList<>();
        for (PhoneAbandonAggregate a : aggregates.values()) {
            if (a.isRecovered()) {
                continue;
            }
            FollowUpPriority priority = priorityOf(a.getTotalAbandonCalls());
            FollowUpAssignment f = new FollowUpAssignment();
            f.setPhone(a.getPhone());
            f.setPriority(priority);
            f.setTotalAbandonCalls(a.getTotalAbandonCalls());
            f.setFirstAbandonTime(a.getFirstAbandonTimeText());
            f.setFirstAbandonBusinessDate(a.getFirstAbandonBusinessDate());
            f.setRecoveryStatus(a.getRecoveryStatus());
            f.setNotes(String.format("Customer with %d abandon calls - Priority: %s",
                    a.getTotalAbandonCalls(), priority));
            result.add(f);
        }
        result.sort(Comparator.comparing(FollowUpAssignment::getPriority)
                .thenComparing(FollowUpAssignment::getTotalAbandonCalls, Comparator.reverseOrder()));
        return result;
    }

    FollowUpPriority priorityOf(int abandonCalls) {
        if (abandonCalls > properties.getFollowUp().getHighPriorityAbove()) {
            return FollowUpPriority.HIGH;
        }
        if (abandonCalls > properties.getFollowUp().getMediumPriorityAbove()) {
            return FollowUpPriority.MEDIUM;
        }
        return FollowUpPriority.NORMAL;
    }
}
