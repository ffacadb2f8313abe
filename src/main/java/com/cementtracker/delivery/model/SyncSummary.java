package com.cementtracker.delivery.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of one completed sync session.
 * <p>
 * {@code skippedCount} is {@code excludedCount + parseFailedCount}; filter exclusions and parse
 * failures are also reported apart.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SyncSummary {
    public final SyncRequest request;
    public final SyncState state;
    public final int processedCount;
    public final int excludedCount;
    public final int parseFailedCount;
    public final int skippedCount;
    public final int supersededCount;
    public final int syncedCount;
    public final int storeFailedCount;
    public final boolean cancelled;
    @Singular
    public final List<SyncFailure> failures;
    @Singular
    public final List<ItemDiagnostic> diagnostics;
    public final String telemetry;

    public String toLogLine() {
        return "processed=" + processedCount
                + ", skipped=" + skippedCount
                + " (excluded=" + excludedCount + ", parse_failed=" + parseFailedCount + ")"
                + ", superseded=" + supersededCount
                + ", synced=" + syncedCount
                + ", store_failed=" + storeFailedCount
                + ", cancelled=" + cancelled;
    }
}
