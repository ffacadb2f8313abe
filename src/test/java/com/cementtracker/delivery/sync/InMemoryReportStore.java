package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.db.ReportStore;
import com.cementtracker.delivery.model.ReportRecord;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Map-backed store with switches for the failure modes of a real database.
 */
final class InMemoryReportStore implements ReportStore {
    final TreeMap<LocalDate, ReportRecord> rows = new TreeMap<>();
    final Set<LocalDate> rejectedDates = new HashSet<>();
    boolean derivedColumn = true;
    boolean unavailable;
    boolean failMigration;
    int upsertCalls;
    int migrationCalls;

    @Override
    public void ensureSchema() throws SQLException {
        checkAvailable();
    }

    @Override
    public boolean hasDerivedColumn() throws SQLException {
        checkAvailable();
        return derivedColumn;
    }

    @Override
    public int addDerivedColumnAndBackfill(DoubleUnaryOperator bagWeightFormula) throws SQLException {
        checkAvailable();
        migrationCalls++;
        if (failMigration) {
            throw new SQLException("ALTER TABLE refused");
        }
        derivedColumn = true;
        int updated = 0;
        for (ReportRecord record : new ArrayList<>(rows.values())) {
            if (Double.isFinite(record.perBagShortExcess)) {
                rows.put(record.date, record.toBuilder()
                        .bagWeightKg(bagWeightFormula.applyAsDouble(record.perBagShortExcess))
                        .build());
                updated++;
            }
        }
        return updated;
    }

    @Override
    public List<ReportRecord> getAll() throws SQLException {
        checkAvailable();
        return new ArrayList<>(rows.values());
    }

    @Override
    public List<ReportRecord> findRange(LocalDate from, LocalDate to) throws SQLException {
        checkAvailable();
        return new ArrayList<>(rows.subMap(from, true, to, true).values());
    }

    @Override
    public Optional<ReportRecord> findByDate(LocalDate date) throws SQLException {
        checkAvailable();
        return Optional.ofNullable(rows.get(date));
    }

    @Override
    public void upsertByKey(LocalDate date, ReportRecord record) throws SQLException {
        checkAvailable();
        upsertCalls++;
        if (rejectedDates.contains(date)) {
            throw new SQLException("constraint failed for " + date);
        }
        rows.put(date, record);
    }

    @Override
    public boolean deleteByKey(LocalDate date) throws SQLException {
        checkAvailable();
        return rows.remove(date) != null;
    }

    private void checkAvailable() throws SQLException {
        if (unavailable) {
            throw new SQLNonTransientConnectionException("connection refused");
        }
    }
}
