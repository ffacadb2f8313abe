package com.cementtracker.delivery.parse;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Numbers read from the daily delivery table plus the per-bag deviation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DeliveryFigures {
    public final long totalDelivery;
    public final long bagWeightTotal;
    public final long physicalWeight;
    public final int shortKg;
    public final int excessKg;
    public final double perBagShortExcess;
    public final String tableStrategy;
}
