package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.ReportRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * One winning record per date, plus what lost or never parsed.
 */
public record Reconciliation(
        SortedMap<LocalDate, ReportRecord> records,
        List<CandidateReport> superseded,
        int failedCount
) {
    public int supersededCount() {
        return superseded.size();
    }

    public boolean isSuperseded(CandidateReport candidate) {
        for (CandidateReport loser : superseded) {
            if (loser == candidate) {
                return true;
            }
        }
        return false;
    }
}
