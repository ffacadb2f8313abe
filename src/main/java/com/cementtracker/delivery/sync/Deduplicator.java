package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.ReportRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps the most recently received report per report date.
 * <p>
 * A candidate replaces the current one only when it was received strictly later, so on ties the
 * first one seen stays. A missing receive time never wins against a known one.
 */
public final class Deduplicator {

    public Reconciliation reconcile(List<CandidateReport> candidates) {
        Map<LocalDate, CandidateReport> winners = new HashMap<>();
        List<CandidateReport> superseded = new ArrayList<>();
        int failed = 0;

        for (CandidateReport candidate : candidates) {
            if (candidate == null || !candidate.isParsed()) {
                failed++;
                continue;
            }
            LocalDate date = candidate.record.date;
            CandidateReport current = winners.get(date);
            if (current == null) {
                winners.put(date, candidate);
            } else if (isNewer(candidate.sourceReceivedAt, current.sourceReceivedAt)) {
                winners.put(date, candidate);
                superseded.add(current);
            } else {
                superseded.add(candidate);
            }
        }

        TreeMap<LocalDate, ReportRecord> records = new TreeMap<>();
        for (Map.Entry<LocalDate, CandidateReport> entry : winners.entrySet()) {
            records.put(entry.getKey(), entry.getValue().record);
        }
        return new Reconciliation(
                Collections.unmodifiableSortedMap(records),
                Collections.unmodifiableList(superseded),
                failed
        );
    }

    static boolean isNewer(LocalDateTime candidate, LocalDateTime current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }
}
