package com.cementtracker.core;

import com.cementtracker.core.diagnostics.CauseCode;

/**
 * The database could not be reached; single rejected rows use {@code STORE_REJECTED} instead.
 */
public class StoreUnavailableException extends TrackerException {
    public StoreUnavailableException(String message) {
        super(CauseCode.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(CauseCode.STORE_UNAVAILABLE, message, cause);
    }
}
