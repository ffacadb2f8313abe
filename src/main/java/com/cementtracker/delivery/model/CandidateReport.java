package com.cementtracker.delivery.model;

import com.cementtracker.core.diagnostics.CauseCode;

import java.time.LocalDateTime;

/**
 * Parse result of one inbound message, before reconciliation. Never persisted.
 */
public final class CandidateReport {
    public final ReportRecord record;
    public final CauseCode failure;
    public final String sourceSubject;
    public final LocalDateTime sourceReceivedAt;

    private CandidateReport(ReportRecord record, CauseCode failure, String sourceSubject, LocalDateTime sourceReceivedAt) {
        this.record = record;
        this.failure = failure == null ? CauseCode.NONE : failure;
        this.sourceSubject = sourceSubject == null ? "" : sourceSubject;
        this.sourceReceivedAt = sourceReceivedAt;
    }

    public static CandidateReport parsed(ReportRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        return new CandidateReport(record, CauseCode.NONE, record.sourceSubject, record.sourceReceivedAt);
    }

    public static CandidateReport failed(CauseCode failure, String sourceSubject, LocalDateTime sourceReceivedAt) {
        if (failure == null || failure == CauseCode.NONE) {
            throw new IllegalArgumentException("failed candidate needs a cause");
        }
        return new CandidateReport(null, failure, sourceSubject, sourceReceivedAt);
    }

    public boolean isParsed() {
        return record != null;
    }
}
