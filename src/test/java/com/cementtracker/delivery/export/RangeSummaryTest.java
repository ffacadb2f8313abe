package com.cementtracker.delivery.export;

import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RangeSummaryTest {
    private final RecordBuilder builder = new RecordBuilder();

    @Test
    void totalsShouldCoverOnlyRecordsInRange() {
        List<ReportRecord> records = List.of(
                builder.build(LocalDate.of(2024, 1, 4), 1000, 1000, 1.0),
                builder.build(LocalDate.of(2024, 1, 5), 320, 2070, -0.04),
                builder.build(LocalDate.of(2024, 1, 6), 180, 30, 0.02),
                builder.build(LocalDate.of(2024, 1, 7), 50, 0, Double.NaN));

        RangeSummary summary = RangeSummary.of(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 7), records);

        assertEquals(3, summary.recordCount);
        assertEquals(550, summary.totalShortKg);
        assertEquals(2100, summary.totalExcessKg);
        assertEquals(1550, summary.netKg());
        assertEquals(-0.01, summary.averagePerBagShortExcess, 1e-12);
        assertEquals(50.01, summary.averageBagWeightKg, 1e-9);
        assertTrue(summary.toDisplayString().contains("records=3"));
    }

    @Test
    void emptyRangeShouldHaveNoAverages() {
        RangeSummary summary = RangeSummary.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29), List.of());

        assertEquals(0, summary.recordCount);
        assertTrue(Double.isNaN(summary.averagePerBagShortExcess));
        assertTrue(Double.isNaN(summary.averageBagWeightKg));
    }
}
