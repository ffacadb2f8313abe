package com.cementtracker.delivery.sync;

import com.cementtracker.core.SchemaMigrationException;
import com.cementtracker.core.StoreUnavailableException;
import com.cementtracker.delivery.db.ReportStore;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Brings the store schema up to date once, then writes reconciled records by date.
 * <p>
 * Upserts are refused until {@link #initialize()} has succeeded.
 */
public final class StoreSynchronizer {
    private static final Logger LOG = LogManager.getLogger(StoreSynchronizer.class);

    private final ReportStore store;
    private final RecordBuilder recordBuilder;
    private volatile boolean ready;

    public StoreSynchronizer(ReportStore store, RecordBuilder recordBuilder) {
        this.store = store;
        this.recordBuilder = recordBuilder;
    }

    public record SchemaStatus(boolean derivedColumnAdded, int rowsBackfilled) {
    }

    /**
     * Creates the schema if needed and adds the bag_weight column, backfilling it in the same transaction.
     *
     * @throws StoreUnavailableException when the database cannot be reached
     * @throws SchemaMigrationException when the column cannot be added or backfilled; nothing is committed then
     */
    public synchronized SchemaStatus initialize() throws SchemaMigrationException, StoreUnavailableException {
        try {
            store.ensureSchema();
            if (store.hasDerivedColumn()) {
                ready = true;
                return new SchemaStatus(false, 0);
            }
            int backfilled = store.addDerivedColumnAndBackfill(recordBuilder::bagWeightFor);
            LOG.info("Added bag_weight column and backfilled {} row(s) with nominal {}",
                    backfilled, recordBuilder.nominalBagWeight());
            ready = true;
            return new SchemaStatus(true, backfilled);
        } catch (SQLException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("store unreachable: " + e.getMessage(), e);
            }
            throw new SchemaMigrationException("bag_weight migration failed: " + e.getMessage(), e);
        }
    }

    public void ensureInitialized() throws SchemaMigrationException, StoreUnavailableException {
        if (!ready) {
            initialize();
        }
    }

    public boolean isReady() {
        return ready;
    }

    /**
     * Writes every record, replacing any stored row with the same date. A rejected row does not stop the others.
     */
    public UpsertResult upsert(Map<LocalDate, ReportRecord> records)
            throws SchemaMigrationException, StoreUnavailableException {
        if (!ready) {
            throw new SchemaMigrationException("store schema not initialized; refusing to write");
        }
        List<UpsertResult.Item> items = new ArrayList<>();
        int written = 0;
        for (Map.Entry<LocalDate, ReportRecord> entry : records.entrySet()) {
            LocalDate date = entry.getKey();
            ReportRecord record = entry.getValue();
            String problem = validate(date, record);
            if (problem != null) {
                LOG.warn("Rejected record {}: {}", date, problem);
                items.add(UpsertResult.Item.rejected(date, problem));
                continue;
            }
            ReportRecord normalized = record.toBuilder()
                    .bagWeightKg(recordBuilder.bagWeightFor(record.perBagShortExcess))
                    .build();
            try {
                store.upsertByKey(date, normalized);
                items.add(UpsertResult.Item.ok(date));
                written++;
            } catch (SQLException e) {
                if (isUnavailable(e)) {
                    throw new StoreUnavailableException("store unreachable while writing " + date, e);
                }
                LOG.warn("Store rejected record {}: {}", date, e.getMessage());
                items.add(UpsertResult.Item.rejected(date, e.getMessage()));
            }
        }
        return new UpsertResult(written, items);
    }

    /**
     * Dates whose stored bag weight disagrees with the per-bag value.
     */
    public List<LocalDate> auditDerivedField() throws StoreUnavailableException {
        List<LocalDate> mismatches = new ArrayList<>();
        try {
            for (ReportRecord record : store.getAll()) {
                if (!record.hasConsistentBagWeight(recordBuilder.nominalBagWeight())) {
                    mismatches.add(record.date);
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("audit read failed: " + e.getMessage(), e);
        }
        return mismatches;
    }

    static boolean isUnavailable(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException || e instanceof SQLTransientConnectionException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private String validate(LocalDate date, ReportRecord record) {
        if (record == null) {
            return "missing record";
        }
        if (!date.equals(record.date)) {
            return "key " + date + " does not match record date " + record.date;
        }
        if (record.shortKg < 0 || record.excessKg < 0) {
            return "negative short/excess";
        }
        if (!Double.isFinite(record.perBagShortExcess)) {
            return "per-bag value is not a number";
        }
        return null;
    }
}
