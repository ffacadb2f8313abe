package com.cementtracker.delivery.sync;

import com.cementtracker.core.StoreUnavailableException;
import com.cementtracker.delivery.db.ReportStore;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Manual edits of stored records, outside of any sync session.
 */
public final class RecordCorrectionService {
    private static final Logger LOG = LogManager.getLogger(RecordCorrectionService.class);

    private final ReportStore store;
    private final RecordBuilder recordBuilder;

    public RecordCorrectionService(ReportStore store, RecordBuilder recordBuilder) {
        this.store = store;
        this.recordBuilder = recordBuilder;
    }

    /**
     * Overwrites the figures of an existing date and recomputes its bag weight. The subject and
     * receive time of the original mail are kept.
     *
     * @return false when no record exists for {@code date}
     */
    public boolean updateRecord(LocalDate date, int shortKg, int excessKg, double perBagShortExcess)
            throws StoreUnavailableException {
        if (shortKg < 0 || excessKg < 0) {
            throw new IllegalArgumentException("short and excess must not be negative");
        }
        if (!Double.isFinite(perBagShortExcess)) {
            throw new IllegalArgumentException("per-bag value must be a number");
        }
        try {
            Optional<ReportRecord> existing = store.findByDate(date);
            if (existing.isEmpty()) {
                LOG.warn("No record for {}; nothing updated", date);
                return false;
            }
            ReportRecord previous = existing.get();
            ReportRecord updated = recordBuilder.build(
                    date, shortKg, excessKg, perBagShortExcess,
                    previous.sourceSubject, previous.sourceReceivedAt);
            store.upsertByKey(date, updated);
            LOG.info("Updated {}: short={} excess={} per_bag={} bag_weight={}",
                    date, shortKg, excessKg, perBagShortExcess, updated.bagWeightKg);
            return true;
        } catch (SQLException e) {
            throw new StoreUnavailableException("update of " + date + " failed: " + e.getMessage(), e);
        }
    }

    public boolean deleteRecord(LocalDate date) throws StoreUnavailableException {
        try {
            boolean deleted = store.deleteByKey(date);
            if (deleted) {
                LOG.info("Deleted record {}", date);
            } else {
                LOG.warn("No record for {}; nothing deleted", date);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreUnavailableException("delete of " + date + " failed: " + e.getMessage(), e);
        }
    }
}
