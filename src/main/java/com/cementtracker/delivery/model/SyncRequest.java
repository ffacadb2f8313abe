package com.cementtracker.delivery.model;

import java.time.LocalDate;

/**
 * Inclusive calendar window of received messages to synchronize.
 */
public record SyncRequest(LocalDate fromDate, LocalDate toDate) {
    public SyncRequest {
        if (fromDate == null || toDate == null) {
            throw new IllegalArgumentException("fromDate and toDate are required");
        }
        if (toDate.isBefore(fromDate)) {
            throw new IllegalArgumentException("toDate " + toDate + " is before fromDate " + fromDate);
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(fromDate) && !date.isAfter(toDate);
    }
}
