package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.model.SyncSummary;

import java.sql.SQLException;
import java.time.Instant;

/**
 * Records finished sync sessions for later inspection.
 */
public interface SyncJournal {
    void record(SyncSummary summary, String trigger, Instant startedAt, Instant finishedAt) throws SQLException;
}
