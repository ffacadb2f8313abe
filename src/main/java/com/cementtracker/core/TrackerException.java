package com.cementtracker.core;

import com.cementtracker.core.diagnostics.CauseCode;

/**
 * Base of the failures that abort a whole sync session.
 */
public class TrackerException extends Exception {
    private final CauseCode causeCode;

    public TrackerException(CauseCode causeCode, String message) {
        super(message);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    public TrackerException(CauseCode causeCode, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    public CauseCode causeCode() {
        return causeCode;
    }
}
