package com.cementtracker.delivery.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One {@code delivery_reports} row as stored: dates as {@code yyyy-MM-dd} text, nullable figures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReportRow {
    private String date;
    private Integer shortKg;
    private Integer excessKg;
    private Double perBagShortExcess;
    private Double bagWeight;
    private String emailSubject;
    private String emailReceived;
}
