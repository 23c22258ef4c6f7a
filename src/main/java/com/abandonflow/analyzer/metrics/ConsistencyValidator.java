package com.abandonflow.analyzer.metrics;

import com.abandonflow.analyzer.model.Diagnosis;
import com.abandonflow.analyzer.model.SummaryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 对汇总指标做四项算术自检，结果只用于展示，不阻断输出。
 */
@Component
@Slf4j
public class ConsistencyValidator {

    public static final String SEVERITY_OK = "INFO";
    public static final String SEVERITY_FAILED = "ERROR";

    public List<Diagnosis> validate(SummaryMetrics m) {
        List<Diagnosis> checks = new ArrayList<>();

        checks.add(check("CALL_TOTALS",
                m.getAnsweredCalls() + m.getHungupCalls() == m.getValidCalls(),
                "Answered + Hungup = Total Calls",
                "Answered + Hungup ≠ Total Calls",
                String.format("%d + %d vs %d", m.getAnsweredCalls(), m.getHungupCalls(), m.getValidCalls())));

        checks.add(check("HUNGUP_SPLIT",
                m.getQuickDrops() + m.getAbandonCalls() == m.getHungupCalls(),
                "Quick Drops + Abandons = Total Hungup",
                "Quick Drops + Abandons ≠ Total Hungup",
                String.format("%d + %d vs %d", m.getQuickDrops(), m.getAbandonCalls(), m.getHungupCalls())));

        checks.add(check("PHONE_RESOLUTION",
                m.getRecoveredPhones() + m.getNeedingOutboundPhones() == m.getUniqueAbandonPhones(),
                "Recovered + Needing Calls = Unique Abandons",
                "Recovered + Needing Calls ≠ Unique Abandons",
                String.format("%d + %d vs %d", m.getRecoveredPhones(), m.getNeedingOutboundPhones(), m.getUniqueAbandonPhones())));

        double rate = m.getAbandonmentRate();
        checks.add(check("RATE_RANGE",
                rate >= 0.0 && rate <= 100.0,
                "Abandonment rate within valid range",
                "Abandonment rate outside 0-100%",
                rate + "%"));

        for (Diagnosis d : checks) {
            if (d.isPassed()) {
                log.info("✅ {}", d.getTitle());
            } else {
                log.warn("❌ CRITICAL: {} ({})", d.getTitle(), d.getDetail());
            }
        }
        return checks;
    }

    private static Diagnosis check(String type, boolean passed, String okTitle, String failedTitle, String detail) {
        return new Diagnosis(type,
                passed ? SEVERITY_OK : SEVERITY_FAILED,
                passed ? okTitle : failedTitle,
                detail);
    }
}
