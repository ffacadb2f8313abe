package com.cementtracker.delivery.db;

import com.cementtracker.delivery.model.ReportRecord;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Keyed record store, one row per report date.
 * <p>
 * Connection-level failures surface as {@link java.sql.SQLNonTransientConnectionException} or
 * {@link java.sql.SQLTransientConnectionException}; any other {@link SQLException} concerns the
 * single statement that raised it.
 */
public interface ReportStore {

    void ensureSchema() throws SQLException;

    boolean hasDerivedColumn() throws SQLException;

    /**
     * Adds the bag weight column and fills it for every row with a per-bag value, atomically.
     *
     * @return number of rows backfilled
     */
    int addDerivedColumnAndBackfill(DoubleUnaryOperator bagWeightFormula) throws SQLException;

    List<ReportRecord> getAll() throws SQLException;

    List<ReportRecord> findRange(LocalDate from, LocalDate to) throws SQLException;

    Optional<ReportRecord> findByDate(LocalDate date) throws SQLException;

    void upsertByKey(LocalDate date, ReportRecord record) throws SQLException;

    boolean deleteByKey(LocalDate date) throws SQLException;
}
