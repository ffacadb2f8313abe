package com.cementtracker.delivery.sync;

import com.cementtracker.core.SchemaMigrationException;
import com.cementtracker.core.StoreUnavailableException;
import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreSynchronizerTest {
    private static final LocalDate DAY = LocalDate.of(2024, 1, 5);

    private final RecordBuilder builder = new RecordBuilder();

    @Test
    void initializeShouldBackfillLegacyRowsOnceOnly() throws Exception {
        InMemoryReportStore store = new InMemoryReportStore();
        store.derivedColumn = false;
        store.rows.put(DAY, legacy(DAY, -0.0414));
        store.rows.put(DAY.plusDays(1), legacy(DAY.plusDays(1), 0.02));
        StoreSynchronizer synchronizer = new StoreSynchronizer(store, builder);

        StoreSynchronizer.SchemaStatus first = synchronizer.initialize();

        assertTrue(first.derivedColumnAdded());
        assertEquals(2, first.rowsBackfilled());
        assertEquals(50.0414, store.rows.get(DAY).bagWeightKg, 1e-9);
        assertEquals(49.98, store.rows.get(DAY.plusDays(1)).bagWeightKg, 1e-9);

        StoreSynchronizer.SchemaStatus second = new StoreSynchronizer(store, builder).initialize();

        assertFalse(second.derivedColumnAdded());
        assertEquals(1, store.migrationCalls);
    }

    @Test
    void failedMigrationShouldBlockUpserts() {
        InMemoryReportStore store = new InMemoryReportStore();
        store.derivedColumn = false;
        store.failMigration = true;
        StoreSynchronizer synchronizer = new StoreSynchronizer(store, builder);

        assertThrows(SchemaMigrationException.class, synchronizer::initialize);
        assertFalse(synchronizer.isReady());
        assertThrows(SchemaMigrationException.class,
                () -> synchronizer.upsert(Map.of(DAY, builder.build(DAY, 1, 2, 0.1))));
        assertEquals(0, store.upsertCalls);
    }

    @Test
    void rejectedRowShouldNotStopTheBatch() throws Exception {
        InMemoryReportStore store = new InMemoryReportStore();
        store.rejectedDates.add(DAY);
        StoreSynchronizer synchronizer = new StoreSynchronizer(store, builder);
        synchronizer.initialize();

        TreeMap<LocalDate, ReportRecord> records = new TreeMap<>();
        records.put(DAY, builder.build(DAY, 1, 2, 0.1));
        records.put(DAY.plusDays(1), builder.build(DAY.plusDays(1), 3, 4, 0.2));
        UpsertResult result = synchronizer.upsert(records);

        assertEquals(1, result.insertedOrReplaced());
        assertEquals(1, result.failedCount());
        assertEquals(CauseCode.STORE_REJECTED, result.itemFor(DAY).cause());
        assertTrue(result.itemFor(DAY.plusDays(1)).ok());
        assertTrue(store.rows.containsKey(DAY.plusDays(1)));
    }

    @Test
    void lostConnectionShouldBeFatal() throws Exception {
        InMemoryReportStore store = new InMemoryReportStore();
        StoreSynchronizer synchronizer = new StoreSynchronizer(store, builder);
        synchronizer.initialize();
        store.unavailable = true;

        assertThrows(StoreUnavailableException.class,
                () -> synchronizer.upsert(Map.of(DAY, builder.build(DAY, 1, 2, 0.1))));
    }

    @Test
    void upsertShouldRecomputeBagWeightAndRejectNegativeFigures() throws Exception {
        InMemoryReportStore store = new InMemoryReportStore();
        StoreSynchronizer synchronizer = new StoreSynchronizer(store, builder);
        synchronizer.initialize();
        ReportRecord drifted = builder.build(DAY, 1, 2, 0.5).toBuilder().bagWeightKg(12.0).build();
        ReportRecord negative = builder.build(DAY.plusDays(1), -1, 2, 0.5);

        TreeMap<LocalDate, ReportRecord> records = new TreeMap<>();
        records.put(DAY, drifted);
        records.put(DAY.plusDays(1), negative);
        UpsertResult result = synchronizer.upsert(records);

        assertEquals(49.5, store.rows.get(DAY).bagWeightKg, 1e-9);
        assertFalse(result.itemFor(DAY.plusDays(1)).ok());
        assertFalse(store.rows.containsKey(DAY.plusDays(1)));
    }

    @Test
    void auditShouldListInconsistentDates() throws Exception {
        InMemoryReportStore store = new InMemoryReportStore();
        store.rows.put(DAY, builder.build(DAY, 1, 2, 0.5));
        store.rows.put(DAY.plusDays(1), builder.build(DAY.plusDays(1), 1, 2, 0.5).toBuilder().bagWeightKg(50.0).build());
        store.rows.put(DAY.plusDays(2), legacy(DAY.plusDays(2), 0.1));

        List<LocalDate> mismatches = new StoreSynchronizer(store, builder).auditDerivedField();

        assertEquals(List.of(DAY.plusDays(1), DAY.plusDays(2)), mismatches);
    }

    private ReportRecord legacy(LocalDate date, double perBag) {
        return ReportRecord.builder()
                .date(date)
                .shortKg(10)
                .excessKg(20)
                .perBagShortExcess(perBag)
                .bagWeightKg(Double.NaN)
                .sourceSubject("Weigh Bridge Report")
                .build();
    }
}
