package com.cementtracker.core;

import com.cementtracker.core.diagnostics.CauseCode;

/**
 * Schema upgrade of the report store failed. Upserts stay blocked until a later start succeeds.
 */
public class SchemaMigrationException extends TrackerException {
    public SchemaMigrationException(String message) {
        super(CauseCode.SCHEMA_MIGRATION_FAILED, message);
    }

    public SchemaMigrationException(String message, Throwable cause) {
        super(CauseCode.SCHEMA_MIGRATION_FAILED, message, cause);
    }
}
