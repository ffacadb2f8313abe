package com.cementtracker.core;

import com.cementtracker.core.diagnostics.CauseCode;

/**
 * The mailbox or message directory could not be read at all.
 */
public class SourceUnavailableException extends TrackerException {
    public SourceUnavailableException(String message) {
        super(CauseCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(CauseCode.SOURCE_UNAVAILABLE, message, cause);
    }
}
