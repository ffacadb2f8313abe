package com.cementtracker.delivery.sync;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduplicatorTest {
    private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

    private final Deduplicator deduplicator = new Deduplicator();
    private final RecordBuilder builder = new RecordBuilder();

    @Test
    void laterReceivedReportShouldWinRegardlessOfOrder() {
        CandidateReport morning = candidate(DAY, 100, LocalDateTime.of(2024, 1, 5, 9, 0));
        CandidateReport afternoon = candidate(DAY, 150, LocalDateTime.of(2024, 1, 5, 14, 0));

        for (List<CandidateReport> order : List.of(List.of(morning, afternoon), List.of(afternoon, morning))) {
            Reconciliation out = deduplicator.reconcile(order);

            assertEquals(1, out.records().size());
            assertEquals(150, out.records().get(DAY).shortKg);
            assertEquals(1, out.supersededCount());
            assertTrue(out.isSuperseded(morning));
        }
    }

    @Test
    void equalTimestampsShouldKeepFirstSeen() {
        LocalDateTime same = LocalDateTime.of(2024, 1, 5, 9, 0);
        CandidateReport first = candidate(DAY, 100, same);
        CandidateReport second = candidate(DAY, 200, same);

        Reconciliation out = deduplicator.reconcile(List.of(first, second));

        assertEquals(100, out.records().get(DAY).shortKg);
        assertSame(second, out.superseded().get(0));
    }

    @Test
    void missingTimestampShouldLoseToKnownOne() {
        CandidateReport unknown = candidate(DAY, 1, null);
        CandidateReport known = candidate(DAY, 2, LocalDateTime.of(2020, 1, 1, 0, 0));

        assertEquals(2, deduplicator.reconcile(List.of(unknown, known)).records().get(DAY).shortKg);
        assertEquals(2, deduplicator.reconcile(List.of(known, unknown)).records().get(DAY).shortKg);
    }

    @Test
    void failedCandidatesShouldBeCountedAndRecordsSortedByDate() {
        List<CandidateReport> input = List.of(
                candidate(DAY.plusDays(2), 3, LocalDateTime.of(2024, 1, 8, 9, 0)),
                CandidateReport.failed(CauseCode.TABLE_NOT_FOUND, "broken", null),
                candidate(DAY, 1, LocalDateTime.of(2024, 1, 5, 9, 0)));

        Reconciliation out = deduplicator.reconcile(input);

        assertEquals(1, out.failedCount());
        assertEquals(List.of(DAY, DAY.plusDays(2)), List.copyOf(out.records().keySet()));
    }

    private CandidateReport candidate(LocalDate date, int shortKg, LocalDateTime receivedAt) {
        ReportRecord record = builder.build(date, shortKg, 0, 0.01, "Weigh Bridge Report", receivedAt);
        return CandidateReport.parsed(record);
    }
}
