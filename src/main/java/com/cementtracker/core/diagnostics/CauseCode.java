package com.cementtracker.core.diagnostics;

/**
 * Reason codes attached to every message that does not end up as a stored record.
 */
public enum CauseCode {
    NONE("none"),
    EMPTY_BODY("empty_body"),
    DATE_NOT_FOUND("date_not_found"),
    SECTION_NOT_FOUND("section_not_found"),
    TABLE_NOT_FOUND("table_not_found"),
    PER_BAG_VALUE_NOT_FOUND("per_bag_value_not_found"),
    SENDER_MISMATCH("sender_mismatch"),
    SUBJECT_MISMATCH("subject_mismatch"),
    STORE_REJECTED("store_rejected"),
    SOURCE_UNAVAILABLE("source_unavailable"),
    STORE_UNAVAILABLE("store_unavailable"),
    SCHEMA_MIGRATION_FAILED("schema_migration_failed"),
    RUNTIME_ERROR("runtime_error");

    private final String label;

    CauseCode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isParseFailure() {
        return this == EMPTY_BODY
                || this == DATE_NOT_FOUND
                || this == SECTION_NOT_FOUND
                || this == TABLE_NOT_FOUND
                || this == PER_BAG_VALUE_NOT_FOUND
                || this == RUNTIME_ERROR;
    }

    public boolean isExclusion() {
        return this == SENDER_MISMATCH || this == SUBJECT_MISMATCH;
    }

    public static CauseCode fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        String target = raw.trim().toLowerCase();
        for (CauseCode code : values()) {
            if (code.label.equals(target) || code.name().equalsIgnoreCase(target)) {
                return code;
            }
        }
        return RUNTIME_ERROR;
    }
}
