package com.cementtracker.delivery.parse;

import com.cementtracker.delivery.model.ReportRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Builds {@link ReportRecord}s and derives the bag weight from the per-bag short/excess value.
 * <p>
 * Bag weight is {@code nominal - perBag}: a positive per-bag value means the bags came in short.
 */
public final class RecordBuilder {
    private final double nominalBagWeight;

    public RecordBuilder() {
        this(ReportRecord.NOMINAL_BAG_WEIGHT_KG);
    }

    public RecordBuilder(double nominalBagWeight) {
        if (!Double.isFinite(nominalBagWeight) || nominalBagWeight <= 0.0) {
            throw new IllegalArgumentException("nominal bag weight must be positive: " + nominalBagWeight);
        }
        this.nominalBagWeight = nominalBagWeight;
    }

    public double nominalBagWeight() {
        return nominalBagWeight;
    }

    public double bagWeightFor(double perBagShortExcess) {
        return nominalBagWeight - perBagShortExcess;
    }

    /**
     * Record without mail provenance, used for manual corrections.
     */
    public ReportRecord build(LocalDate date, int shortKg, int excessKg, double perBagShortExcess) {
        return build(date, shortKg, excessKg, perBagShortExcess, "", null);
    }

    public ReportRecord build(
            LocalDate date,
            int shortKg,
            int excessKg,
            double perBagShortExcess,
            String sourceSubject,
            LocalDateTime sourceReceivedAt
    ) {
        return ReportRecord.builder()
                .date(date)
                .shortKg(shortKg)
                .excessKg(excessKg)
                .perBagShortExcess(perBagShortExcess)
                .bagWeightKg(bagWeightFor(perBagShortExcess))
                .sourceSubject(sourceSubject == null ? "" : sourceSubject)
                .sourceReceivedAt(sourceReceivedAt)
                .build();
    }
}
