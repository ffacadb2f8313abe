package com.cementtracker.delivery.export;

import com.cementtracker.delivery.model.ReportRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Totals and averages over the records of a date range. Averages skip missing values and are
 * {@code NaN} when nothing is left.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RangeSummary {
    public final LocalDate from;
    public final LocalDate to;
    public final int recordCount;
    public final long totalShortKg;
    public final long totalExcessKg;
    public final double averagePerBagShortExcess;
    public final double averageBagWeightKg;

    public static RangeSummary of(LocalDate from, LocalDate to, List<ReportRecord> records) {
        long totalShort = 0L;
        long totalExcess = 0L;
        double perBagSum = 0.0;
        int perBagCount = 0;
        double bagWeightSum = 0.0;
        int bagWeightCount = 0;
        int count = 0;
        for (ReportRecord record : records) {
            if (record.date.isBefore(from) || record.date.isAfter(to)) {
                continue;
            }
            count++;
            totalShort += record.shortKg;
            totalExcess += record.excessKg;
            if (Double.isFinite(record.perBagShortExcess)) {
                perBagSum += record.perBagShortExcess;
                perBagCount++;
            }
            if (Double.isFinite(record.bagWeightKg)) {
                bagWeightSum += record.bagWeightKg;
                bagWeightCount++;
            }
        }
        return RangeSummary.builder()
                .from(from)
                .to(to)
                .recordCount(count)
                .totalShortKg(totalShort)
                .totalExcessKg(totalExcess)
                .averagePerBagShortExcess(perBagCount == 0 ? Double.NaN : perBagSum / perBagCount)
                .averageBagWeightKg(bagWeightCount == 0 ? Double.NaN : bagWeightSum / bagWeightCount)
                .build();
    }

    public long netKg() {
        return totalExcessKg - totalShortKg;
    }

    public String toDisplayString() {
        return String.format(Locale.US,
                "%s..%s records=%d total_short=%d kg total_excess=%d kg net=%d kg avg_per_bag=%.4f kg avg_bag_weight=%.4f kg",
                from, to, recordCount, totalShortKg, totalExcessKg, netKg(),
                averagePerBagShortExcess, averageBagWeightKg);
    }
}
