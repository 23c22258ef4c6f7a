package com.abandonflow.analyzer.metrics;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.AbandonEvent;
import com.abandonflow.analyzer.model.DailyMetrics;
import com.abandonflow.analyzer.model.NormalizedInboundCall;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import com.abandonflow.analyzer.model.QueueOutcome;
import com.abandonflow.analyzer.model.SummaryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 汇总指标与按业务日拆分的指标。
 * 呼叫类指标只看有效呼入记录，号码类指标来自放弃聚合。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MetricsAggregator {

    private final AbandonAnalysisProperties properties;

    /**
     * 放弃率 = (放弃呼叫数 - 已挽回号码的放弃呼叫数) / 有效呼叫数 × 100，保留一位小数。
     */
    public SummaryMetrics summarize(List<NormalizedInboundCall> calls, Map<String, PhoneAbandonAggregate> aggregates) {
        SummaryMetrics m = new SummaryMetrics();
        countCalls(calls, m);

        int recoveredPhones = 0;
        int recoveredAbandonCalls = 0;
        for (PhoneAbandonAggregate a : aggregates.values()) {
            if (a.isRecovered()) {
                recoveredPhones++;
                recoveredAbandonCalls += a.getTotalAbandonCalls();
            }
        }
        m.setUniqueAbandonPhones(aggregates.size());
        m.setRecoveredPhones(recoveredPhones);
        m.setNeedingOutboundPhones(aggregates.size() - recoveredPhones);
        m.setAbandonmentRate(rate(m.getAbandonCalls() - recoveredAbandonCalls, m.getValidCalls()));

        log.info("Summary: valid={}, answered={}, hungup={}, quickDrops={}, abandons={}, uniquePhones={}, recovered={}, rate={}%",
                m.getValidCalls(), m.getAnsweredCalls(), m.getHungupCalls(), m.getQuickDrops(),
                m.getAbandonCalls(), m.getUniqueAbandonPhones(), m.getRecoveredPhones(), m.getAbandonmentRate());
        return m;
    }

    /**
     * 按业务日拆分。号码类指标按首次放弃业务日归属；
     * 当天放弃率扣减的是已挽回号码落在当天的放弃呼叫。
     */
    public List<DailyMetrics> daily(List<NormalizedInboundCall> calls, Map<String, PhoneAbandonAggregate> aggregates) {
        Map<LocalDate, List<NormalizedInboundCall>> byDate = new TreeMap<>();
        for (NormalizedInboundCall call : calls) {
            byDate.computeIfAbsent(call.getBusinessDate(), k -> new ArrayList<>()).add(call);
        }

        Map<LocalDate, List<PhoneAbandonAggregate>> cohorts = new TreeMap<>();
        Map<LocalDate, Integer> recoveredAbandonsByDate = new TreeMap<>();
        for (PhoneAbandonAggregate a : aggregates.values()) {
            cohorts.computeIfAbsent(a.getFirstAbandonBusinessDate(), k -> new ArrayList<>()).add(a);
            if (a.isRecovered()) {
                for (AbandonEvent e : a.getAbandonEvents()) {
                    recoveredAbandonsByDate.merge(e.getBusinessDate(), 1, Integer::sum);
                }
            }
        }

        List<DailyMetrics> result = new ArrayList<>();
        for (Map.Entry<LocalDate, List<NormalizedInboundCall>> entry : byDate.entrySet()) {
            LocalDate date = entry.getKey();
            DailyMetrics d = new DailyMetrics();
            d.setBusinessDate(date);
            countCalls(entry.getValue(), d);

            Collection<PhoneAbandonAggregate> cohort = cohorts.getOrDefault(date, List.of());
            int recovered = (int) cohort.stream().filter(PhoneAbandonAggregate::isRecovered).count();
            d.setUniqueAbandonPhones(cohort.size());
            d.setRecoveredPhones(recovered);
            d.setNeedingOutboundPhones(cohort.size() - recovered);

            int total = d.getValidCalls();
            d.setAbandonmentRate(rate(d.getAbandonCalls() - recoveredAbandonsByDate.getOrDefault(date, 0), total));
            d.setAnsweredPercent(rate(d.getAnsweredCalls(), total));
            d.setHungupPercent(rate(d.getHungupCalls(), total));
            d.setQuickDropPercent(rate(d.getQuickDrops(), total));
            d.setAbandonPercent(rate(d.getAbandonCalls(), total));
            result.add(d);
        }
        log.info("Daily breakdown generated for {} business dates", result.size());
        return result;
    }

    private void countCalls(List<NormalizedInboundCall> calls, SummaryMetrics m) {
        int threshold = properties.getQuickDropThresholdSeconds();
        int answered = 0;
        int hungup = 0;
        int quickDrops = 0;
        int abandons = 0;
        for (NormalizedInboundCall call : calls) {
            if (call.getOutcome() == QueueOutcome.ANSWERED) {
                answered++;
            } else if (call.getOutcome() == QueueOutcome.HUNGUP) {
                hungup++;
                if (call.getWaitSeconds() <= threshold) {
                    quickDrops++;
                } else {
                    abandons++;
                }
            }
        }
        m.setValidCalls(calls.size());
        m.setAnsweredCalls(answered);
        m.setHungupCalls(hungup);
        m.setQuickDrops(quickDrops);
        m.setAbandonCalls(abandons);
    }

    /** numerator / denominator × 100，四舍五入到一位小数；分母为 0 时返回 0 */
    static double rate(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(numerator * 100.0 / denominator)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
