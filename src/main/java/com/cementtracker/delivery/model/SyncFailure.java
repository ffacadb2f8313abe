package com.cementtracker.delivery.model;

import com.cementtracker.core.diagnostics.CauseCode;

/**
 * A message that produced no stored record, with the reason.
 */
public record SyncFailure(String subject, CauseCode reason) {
    public SyncFailure {
        subject = subject == null ? "" : subject;
        reason = reason == null ? CauseCode.RUNTIME_ERROR : reason;
    }
}
