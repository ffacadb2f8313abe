package com.cementtracker.core;

import com.cementtracker.core.SyncTelemetry.Stage;
import com.cementtracker.core.diagnostics.CauseCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncTelemetryTest {

    @Test
    void funnelShouldBreakDownDropsPerStage() {
        SyncTelemetry telemetry = new SyncTelemetry(" ", Instant.parse("2024-01-07T10:00:00Z"));
        telemetry.enter(Stage.FETCH);
        telemetry.leave(Stage.FETCH, 7);
        telemetry.enter(Stage.FILTER, 7);
        telemetry.drop(Stage.FILTER, CauseCode.SENDER_MISMATCH.label());
        telemetry.drop(Stage.FILTER, CauseCode.SUBJECT_MISMATCH.label());
        telemetry.drop(Stage.FILTER, CauseCode.SENDER_MISMATCH.label());
        telemetry.leave(Stage.FILTER, 4);
        telemetry.enter(Stage.PARSE, 4);
        telemetry.drop(Stage.PARSE, CauseCode.TABLE_NOT_FOUND.label());
        telemetry.leave(Stage.PARSE, 3);
        telemetry.finish();

        String rendered = telemetry.render();

        assertTrue(rendered.startsWith("trigger=manual started_at=2024-01-07T10:00:00Z"));
        assertTrue(rendered.contains("FETCH     in=- out=7"));
        assertTrue(rendered.contains("FILTER    in=7 out=4 dropped: sender_mismatch=2 subject_mismatch=1"));
        assertTrue(rendered.contains("PARSE     in=4 out=3 dropped: table_not_found=1"));
        assertFalse(rendered.contains("PERSIST"));
        assertEquals(2, telemetry.dropped(Stage.FILTER, "sender_mismatch"));
        assertEquals(3, telemetry.passed(Stage.PARSE));
    }

    @Test
    void abortShouldMarkStageAndIgnoreEmptyDrops() {
        SyncTelemetry telemetry = new SyncTelemetry("cli", Instant.now());
        telemetry.enter(Stage.RECONCILE, 2);
        telemetry.drop(Stage.RECONCILE, SyncTelemetry.DROP_SUPERSEDED, 0);
        telemetry.leave(Stage.RECONCILE, 2);
        telemetry.enter(Stage.PERSIST, 2);
        telemetry.abort(Stage.PERSIST, CauseCode.STORE_UNAVAILABLE);

        String rendered = telemetry.render();

        assertTrue(rendered.contains("RECONCILE in=2 out=2 "));
        assertFalse(rendered.contains("superseded"));
        assertTrue(rendered.contains("PERSIST   in=2 out=0"));
        assertTrue(rendered.endsWith("ABORTED store_unavailable"));
        assertEquals(0, telemetry.dropped(Stage.PERSIST, "store_rejected"));
    }
}
