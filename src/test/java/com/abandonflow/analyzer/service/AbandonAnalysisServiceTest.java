package com.abandonflow.analyzer.service;

import com.abandonflow.analyzer.TestFixtures;
import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.correlate.AbandonDetector;
import com.abandonflow.analyzer.correlate.RecoveryMatcher;
import com.abandonflow.analyzer.metrics.ConsistencyValidator;
import com.abandonflow.analyzer.metrics.FollowUpPlanner;
import com.abandonflow.analyzer.metrics.MetricsAggregator;
import com.abandonflow.analyzer.model.AbandonAnalysisResult;
import com.abandonflow.analyzer.model.DailyMetrics;
import com.abandonflow.analyzer.model.DataQualityIssueType;
import com.abandonflow.analyzer.model.Diagnosis;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import com.abandonflow.analyzer.model.PhoneAbandonAggregate;
import com.abandonflow.analyzer.model.ResolutionStatus;
import com.abandonflow.analyzer.model.SummaryMetrics;
import com.abandonflow.analyzer.parser.CallLogWorkbookReader;
import com.abandonflow.analyzer.parser.CallRecordNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.abandonflow.analyzer.TestFixtures.answered;
import static com.abandonflow.analyzer.TestFixtures.hungup;
import static com.abandonflow.analyzer.TestFixtures.manualConnected;
import static org.assertj.core.api.Assertions.assertThat;

class AbandonAnalysisServiceTest {

    private static final String PHONE = "5551234567";

    private AbandonAnalysisService service;

    @BeforeEach
    void setUp() {
        AbandonAnalysisProperties props = TestFixtures.properties();
        service = new AbandonAnalysisService(
                new CallLogWorkbookReader(props),
                new CallRecordNormalizer(TestFixtures.fieldNormalizer()),
                new AbandonDetector(props),
                new RecoveryMatcher(props),
                new MetricsAggregator(props),
                new ConsistencyValidator(),
                new FollowUpPlanner(props));
    }

    @Test
    @DisplayName("45s hungup call becomes one abandon event awaiting outbound")
    void singleAbandon() {
        AbandonAnalysisResult result = service.analyze(
                List.of(hungup(PHONE, "2025-08-18 10:00:00", "00:00:45")), List.of());

        PhoneAbandonAggregate a = result.getAggregates().get(PHONE);
        assertThat(a.getAbandonEvents()).hasSize(1);
        assertThat(a.getFirstAbandonBusinessDate()).isEqualTo(LocalDate.of(2025, 8, 18));
        assertThat(a.getRecoveryStatus()).isEqualTo(ResolutionStatus.NEEDS_OUTBOUND);
        assertThat(result.getSummary().getNeedingOutboundPhones()).isEqualTo(1);
        assertThat(result.getFollowUps()).singleElement()
                .satisfies(f -> assertThat(f.getPhone()).isEqualTo(PHONE));
    }

    @Test
    @DisplayName("later answered call with a successful disposition recovers the phone")
    void recoveredByInboundCall() {
        List<InboundCallRecord> inbound = List.of(hungup(PHONE, "2025-08-18 10:00:00", "00:00:45"));
        SummaryMetrics before = service.analyze(inbound, List.of()).getSummary();

        List<InboundCallRecord> withRecovery = new ArrayList<>(inbound);
        withRecovery.add(answered(PHONE, "2025-08-18 11:00:00", "MI"));
        AbandonAnalysisResult after = service.analyze(withRecovery, List.of());

        assertThat(after.getAggregates().get(PHONE).getRecoveryStatus()).isEqualTo(ResolutionStatus.RECOVERED);
        assertThat(after.getSummary().getRecoveredPhones()).isEqualTo(before.getRecoveredPhones() + 1);
        assertThat(after.getSummary().getNeedingOutboundPhones()).isEqualTo(before.getNeedingOutboundPhones() - 1);
        assertThat(after.getFollowUps()).isEmpty();
        assertThat(after.getSummary().getAbandonmentRate()).isZero();
    }

    @Test
    @DisplayName("20s hungup call is a quick drop and never aggregated")
    void quickDrop() {
        AbandonAnalysisResult result = service.analyze(
                List.of(hungup(PHONE, "2025-08-18 10:00:00", "00:00:20")), List.of());

        assertThat(result.getAggregates()).isEmpty();
        assertThat(result.getSummary().getQuickDrops()).isEqualTo(1);
        assertThat(result.getSummary().getAbandonCalls()).isZero();
    }

    @Test
    @DisplayName("timestamp three years old is excluded from every count")
    void staleTimestamp() {
        AbandonAnalysisResult result = service.analyze(List.of(
                hungup(PHONE, "2022-08-18 10:00:00", "00:00:45"),
                answered("5550000001", "2025-08-18 10:00:00", "MI")), List.of());

        SummaryMetrics m = result.getSummary();
        assertThat(m.getValidCalls()).isEqualTo(1);
        assertThat(m.getHungupCalls()).isZero();
        assertThat(result.getAggregates()).isEmpty();
        assertThat(result.getIssueCounts()).containsEntry(DataQualityIssueType.INVALID_TIMESTAMP, 1);
        assertThat(result.getDaily()).extracting(DailyMetrics::getBusinessDate)
                .containsExactly(LocalDate.of(2025, 8, 18));
    }

    @Test
    @DisplayName("repeat abandoner is attributed to the earlier business date only")
    void multiDayAbandoner() {
        AbandonAnalysisResult result = service.analyze(List.of(
                hungup(PHONE, "2025-08-19 10:00:00", "00:00:45"),
                hungup(PHONE, "2025-08-18 10:00:00", "00:00:45")), List.of());

        assertThat(result.getAggregates().get(PHONE).getFirstAbandonBusinessDate())
                .isEqualTo(LocalDate.of(2025, 8, 18));
        assertThat(result.getDaily()).hasSize(2);
        assertThat(result.getDaily().get(0).getUniqueAbandonPhones()).isEqualTo(1);
        assertThat(result.getDaily().get(1).getUniqueAbandonPhones()).isZero();
        assertThat(result.getFollowUps().get(0).getNotes()).contains("2 abandon calls");
    }

    @Test
    void outboundCallbackRecovers() {
        AbandonAnalysisResult result = service.analyze(
                List.of(hungup(PHONE, "2025-08-18 10:00:00", "00:01:00")),
                List.of(manualConnected("1" + PHONE, "2025-08-21 15:00:00", "PQC MI")));

        assertThat(result.getAggregates().get(PHONE).getRecoveryStatus()).isEqualTo(ResolutionStatus.RECOVERED);
    }

    @Test
    void mixedDatasetPassesAllConsistencyChecks() {
        List<InboundCallRecord> inbound = List.of(
                hungup("5550000001", "2025-08-18 07:00:00", "00:01:00"),
                hungup("5550000001", "2025-08-18 08:00:00", "00:02:00"),
                hungup("5550000002", "2025-08-18 09:00:00", "00:00:10"),
                answered("5550000003", "2025-08-18 09:30:00", "Others"),
                hungup("5550000004", "2025-08-19 02:00:00", "00:00:50"),
                answered("5550000004", "2025-08-19 10:00:00", "Voicemail"),
                hungup("5550000005", "2025-08-19 11:00:00", "00:00:40"),
                hungup("bad", "2025-08-19 11:00:00", "00:00:40"));
        List<OutboundCallRecord> outbound = List.of(
                manualConnected("5550000001", "2025-08-18 12:00:00", "AE"),
                manualConnected("5550000005", "2025-08-19 12:00:00", "No Answer"));

        AbandonAnalysisResult result = service.analyze(inbound, outbound);

        assertThat(result.getConsistencyChecks()).hasSize(4).allMatch(Diagnosis::isPassed);
        assertThat(result.getAggregates().get("5550000001").getRecoveryStatus()).isEqualTo(ResolutionStatus.RECOVERED);
        assertThat(result.getAggregates().get("5550000004").getRecoveryStatus()).isEqualTo(ResolutionStatus.ATTEMPTED);
        assertThat(result.getAggregates().get("5550000005").getRecoveryStatus()).isEqualTo(ResolutionStatus.ATTEMPTED);

        SummaryMetrics m = result.getSummary();
        assertThat(m.getValidCalls()).isEqualTo(7);
        assertThat(m.getAbandonCalls()).isEqualTo(4);
        assertThat(m.getUniqueAbandonPhones()).isEqualTo(3);
        assertThat(m.getRecoveredPhones()).isEqualTo(1);
        assertThat(m.getNeedingOutboundPhones()).isEqualTo(2);
        // (4 - 2) / 7 = 28.57...
        assertThat(m.getAbandonmentRate()).isEqualTo(28.6);
        assertThat(result.getIssueCounts()).containsEntry(DataQualityIssueType.INVALID_PHONE, 1);
    }

    @Test
    void rerunOnSameInputIsIdentical() {
        List<InboundCallRecord> inbound = List.of(
                hungup("5550000001", "2025-08-18 07:00:00", "00:01:00"),
                answered("5550000001", "2025-08-18 09:00:00", "Voicemail"),
                hungup("5550000002", "2025-08-18 09:00:00", "00:00:50"));
        List<OutboundCallRecord> outbound = List.of(manualConnected("5550000002", "2025-08-18 12:00:00", "MI"));

        AbandonAnalysisResult first = service.analyze(inbound, outbound);
        AbandonAnalysisResult second = service.analyze(inbound, outbound);

        assertThat(second.getSummary()).isEqualTo(first.getSummary());
        assertThat(second.getDaily()).isEqualTo(first.getDaily());
        assertThat(second.getAggregates().keySet()).containsExactlyElementsOf(first.getAggregates().keySet());
        first.getAggregates().forEach((phone, a) -> {
            PhoneAbandonAggregate b = second.getAggregates().get(phone);
            assertThat(b.getRecoveryStatus()).isEqualTo(a.getRecoveryStatus());
            assertThat(b.getRecoveryAttempt()).isEqualTo(a.getRecoveryAttempt());
            assertThat(b.getAbandonEvents()).isEqualTo(a.getAbandonEvents());
        });
    }

    @Test
    void emptyInboundReportsEmptyDataset() {
        AbandonAnalysisResult result = service.analyze(List.of(), List.of());

        assertThat(result.getAggregates()).isEmpty();
        assertThat(result.getDaily()).isEmpty();
        assertThat(result.getSummary().getValidCalls()).isZero();
        assertThat(result.getIssueCounts()).containsEntry(DataQualityIssueType.EMPTY_DATASET, 1);
        assertThat(result.getConsistencyChecks()).hasSize(4).allMatch(Diagnosis::isPassed);
    }

    @Test
    void nullRecordsAreSkippedWithoutAbortingTheRun() {
        List<InboundCallRecord> inbound = Arrays.asList(
                hungup(PHONE, "2025-08-18 10:00:00", "00:01:00"),
                null,
                answered("5559876543", "2025-08-18 11:00:00", "MI"));
        List<OutboundCallRecord> outbound = Arrays.asList(
                null,
                manualConnected(PHONE, "2025-08-18 12:00:00", "AE"));

        AbandonAnalysisResult result = service.analyze(inbound, outbound);

        assertThat(result.getSummary().getValidCalls()).isEqualTo(2);
        assertThat(result.getSummary().getAbandonCalls()).isEqualTo(1);
        assertThat(result.getAggregates().get(PHONE).getRecoveryStatus()).isEqualTo(ResolutionStatus.RECOVERED);
        assertThat(result.getConsistencyChecks()).allMatch(Diagnosis::isPassed);
    }

    @Test
    void nullOutboundIsTreatedAsEmpty() {
        AbandonAnalysisResult result = service.analyze(
                List.of(hungup(PHONE, "2025-08-18 10:00:00", "00:01:00")), null);

        assertThat(result.getAggregates().get(PHONE).getRecoveryStatus()).isEqualTo(ResolutionStatus.NEEDS_OUTBOUND);
    }
}
