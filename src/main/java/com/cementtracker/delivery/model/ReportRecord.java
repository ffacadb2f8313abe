package com.cementtracker.delivery.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Authoritative short/excess figures for one calendar day.
 * <p>
 * {@code bagWeightKg} is derived from {@code perBagShortExcess}; only {@code RecordBuilder}
 * and the schema backfill compute it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ReportRecord {
    public static final double NOMINAL_BAG_WEIGHT_KG = 50.0;
    public static final double DERIVED_TOLERANCE = 1e-9;

    public final LocalDate date;
    public final int shortKg;
    public final int excessKg;
    public final double perBagShortExcess;
    public final double bagWeightKg;
    public final String sourceSubject;
    public final LocalDateTime sourceReceivedAt;

    public boolean hasConsistentBagWeight(double nominalBagWeight) {
        return Math.abs(bagWeightKg - (nominalBagWeight - perBagShortExcess)) <= DERIVED_TOLERANCE;
    }
}
