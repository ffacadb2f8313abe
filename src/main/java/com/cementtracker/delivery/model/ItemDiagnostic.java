package com.cementtracker.delivery.model;

import com.cementtracker.core.diagnostics.CauseCode;

import java.time.LocalDateTime;

/**
 * What happened to one message of a session.
 */
public record ItemDiagnostic(String subject, LocalDateTime receivedAt, Outcome outcome, CauseCode reason) {

    public enum Outcome {
        EXCLUDED,
        PARSE_FAILED,
        SUPERSEDED,
        SYNCED,
        STORE_FAILED,
        NOT_PERSISTED
    }

    public ItemDiagnostic {
        subject = subject == null ? "" : subject;
        reason = reason == null ? CauseCode.NONE : reason;
    }
}
