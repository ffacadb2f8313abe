package com.cementtracker.delivery.sync;

import com.cementtracker.core.SchemaMigrationException;
import com.cementtracker.core.SourceUnavailableException;
import com.cementtracker.core.StoreUnavailableException;
import com.cementtracker.core.SyncTelemetry;
import com.cementtracker.core.SyncTelemetry.Stage;
import com.cementtracker.core.TrackerException;
import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;
import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.InboundMessage;
import com.cementtracker.delivery.model.ItemDiagnostic;
import com.cementtracker.delivery.model.SyncFailure;
import com.cementtracker.delivery.model.SyncRequest;
import com.cementtracker.delivery.model.SyncState;
import com.cementtracker.delivery.model.SyncSummary;
import com.cementtracker.delivery.parse.ReportParser;
import com.cementtracker.delivery.source.MessageSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pass over a date window: fetch, filter, parse, reconcile, persist.
 * <p>
 * Re-running the same window against unchanged mail leaves the store unchanged.
 */
public final class SyncSession {
    private static final Logger LOG = LogManager.getLogger(SyncSession.class);

    private final MessageSource source;
    private final MessageFilter filter;
    private final ReportParser parser;
    private final Deduplicator deduplicator;
    private final StoreSynchronizer synchronizer;
    private final SyncJournal journal;
    private final String trigger;

    private volatile SyncState state = SyncState.IDLE;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public SyncSession(
            MessageSource source,
            MessageFilter filter,
            ReportParser parser,
            Deduplicator deduplicator,
            StoreSynchronizer synchronizer,
            SyncJournal journal,
            String trigger
    ) {
        this.source = source;
        this.filter = filter;
        this.parser = parser;
        this.deduplicator = deduplicator;
        this.synchronizer = synchronizer;
        this.journal = journal;
        this.trigger = trigger == null || trigger.isBlank() ? "manual" : trigger.trim();
    }

    public SyncState state() {
        return state;
    }

    /**
     * Asks a running session to stop after the current message. Candidates already parsed are still persisted.
     */
    public void cancel() {
        if (!state.isTerminal() && cancelRequested.compareAndSet(false, true)) {
            LOG.info("Cancellation requested in state {}", state);
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public synchronized SyncSummary run(SyncRequest request) throws TrackerException {
        if (state != SyncState.IDLE && !state.isTerminal()) {
            throw new IllegalStateException("session already running in state " + state);
        }
        if (state.isTerminal()) {
            cancelRequested.set(false);
            state = SyncState.IDLE;
        }
        Instant startedAt = Instant.now();
        SyncTelemetry telemetry = new SyncTelemetry(trigger, startedAt);
        LOG.info("Sync started: window={}..{} source={}", request.fromDate(), request.toDate(), source.describe());
        try {
            synchronizer.ensureInitialized();
            SyncSummary summary = execute(request, telemetry);
            state = SyncState.DONE;
            telemetry.finish();
            summary = summary.toBuilder().state(SyncState.DONE).telemetry(telemetry.render()).build();
            LOG.info("Sync finished: {}", summary.toLogLine());
            LOG.info("Telemetry:\n{}", summary.telemetry);
            journal(summary, startedAt, telemetry);
            return summary;
        } catch (TrackerException e) {
            state = SyncState.FAILED;
            telemetry.finish();
            LOG.error("Sync failed in window {}..{}: {} ({})",
                    request.fromDate(), request.toDate(), e.getMessage(), e.causeCode().label());
            journal(failedSummary(request, e, telemetry), startedAt, telemetry);
            throw e;
        }
    }

    private SyncSummary execute(SyncRequest request, SyncTelemetry telemetry)
            throws SourceUnavailableException, StoreUnavailableException, SchemaMigrationException {
        state = SyncState.FETCHING;
        telemetry.enter(Stage.FETCH);
        List<InboundMessage> messages;
        try {
            messages = source.fetch(request.fromDate(), request.toDate());
        } catch (SourceUnavailableException e) {
            telemetry.abort(Stage.FETCH, e.causeCode());
            throw e;
        }
        telemetry.leave(Stage.FETCH, messages.size());
        LOG.info("Fetched {} message(s)", messages.size());

        SyncSummary.SyncSummaryBuilder summary = SyncSummary.builder().request(request);
        int processed = 0;
        int excluded = 0;

        state = SyncState.FILTERING;
        telemetry.enter(Stage.FILTER, messages.size());
        List<InboundMessage> accepted = new ArrayList<>();
        for (InboundMessage message : messages) {
            if (cancelRequested.get()) {
                break;
            }
            processed++;
            Outcome<InboundMessage> verdict = filter.evaluate(message);
            if (verdict.success) {
                accepted.add(message);
            } else {
                excluded++;
                telemetry.drop(Stage.FILTER, verdict.causeCode.label());
                LOG.debug("Excluded '{}': {}", message.subject, verdict.causeCode.label());
                summary.diagnostic(new ItemDiagnostic(
                        message.subject, message.receivedAt, ItemDiagnostic.Outcome.EXCLUDED, verdict.causeCode));
            }
        }
        telemetry.drop(Stage.FILTER, SyncTelemetry.DROP_CANCELLED, messages.size() - processed);
        telemetry.leave(Stage.FILTER, accepted.size());

        state = SyncState.PARSING;
        telemetry.enter(Stage.PARSE, accepted.size());
        List<CandidateReport> candidates = new ArrayList<>();
        int parseFailed = 0;
        for (InboundMessage message : accepted) {
            if (cancelRequested.get()) {
                break;
            }
            LOG.info("Processing '{}' received {}", message.subject, message.receivedAt);
            CandidateReport candidate = parseSafely(message);
            candidates.add(candidate);
            if (!candidate.isParsed()) {
                parseFailed++;
                telemetry.drop(Stage.PARSE, candidate.failure.label());
                summary.failure(new SyncFailure(candidate.sourceSubject, candidate.failure));
                summary.diagnostic(new ItemDiagnostic(candidate.sourceSubject, candidate.sourceReceivedAt,
                        ItemDiagnostic.Outcome.PARSE_FAILED, candidate.failure));
            }
        }
        telemetry.drop(Stage.PARSE, SyncTelemetry.DROP_CANCELLED, accepted.size() - candidates.size());
        telemetry.leave(Stage.PARSE, candidates.size() - parseFailed);

        state = SyncState.RECONCILING;
        telemetry.enter(Stage.RECONCILE, candidates.size() - parseFailed);
        Reconciliation reconciliation = deduplicator.reconcile(candidates);
        telemetry.drop(Stage.RECONCILE, SyncTelemetry.DROP_SUPERSEDED, reconciliation.supersededCount());
        telemetry.leave(Stage.RECONCILE, reconciliation.records().size());

        state = SyncState.PERSISTING;
        telemetry.enter(Stage.PERSIST, reconciliation.records().size());
        UpsertResult upserted;
        try {
            upserted = synchronizer.upsert(reconciliation.records());
        } catch (StoreUnavailableException | SchemaMigrationException e) {
            telemetry.abort(Stage.PERSIST, e.causeCode());
            throw e;
        }
        for (UpsertResult.Item item : upserted.items()) {
            if (!item.ok()) {
                telemetry.drop(Stage.PERSIST, item.cause().label());
            }
        }
        telemetry.leave(Stage.PERSIST, upserted.insertedOrReplaced());

        for (CandidateReport candidate : candidates) {
            if (!candidate.isParsed()) {
                continue;
            }
            if (reconciliation.isSuperseded(candidate)) {
                summary.diagnostic(new ItemDiagnostic(candidate.sourceSubject, candidate.sourceReceivedAt,
                        ItemDiagnostic.Outcome.SUPERSEDED, CauseCode.NONE));
                continue;
            }
            UpsertResult.Item item = upserted.itemFor(candidate.record.date);
            if (item == null) {
                summary.diagnostic(new ItemDiagnostic(candidate.sourceSubject, candidate.sourceReceivedAt,
                        ItemDiagnostic.Outcome.NOT_PERSISTED, CauseCode.NONE));
            } else if (item.ok()) {
                summary.diagnostic(new ItemDiagnostic(candidate.sourceSubject, candidate.sourceReceivedAt,
                        ItemDiagnostic.Outcome.SYNCED, CauseCode.NONE));
            } else {
                summary.failure(new SyncFailure(candidate.sourceSubject, item.cause()));
                summary.diagnostic(new ItemDiagnostic(candidate.sourceSubject, candidate.sourceReceivedAt,
                        ItemDiagnostic.Outcome.STORE_FAILED, item.cause()));
            }
        }

        return summary
                .processedCount(processed)
                .excludedCount(excluded)
                .parseFailedCount(parseFailed)
                .skippedCount(excluded + parseFailed)
                .supersededCount(reconciliation.supersededCount())
                .syncedCount(upserted.insertedOrReplaced())
                .storeFailedCount(upserted.failedCount())
                .cancelled(cancelRequested.get())
                .build();
    }

    private CandidateReport parseSafely(InboundMessage message) {
        try {
            return parser.parse(message);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error parsing '{}'", message.subject, e);
            return CandidateReport.failed(CauseCode.RUNTIME_ERROR, message.subject, message.receivedAt);
        }
    }

    private SyncSummary failedSummary(SyncRequest request, TrackerException e, SyncTelemetry telemetry) {
        return SyncSummary.builder()
                .request(request)
                .state(SyncState.FAILED)
                .cancelled(cancelRequested.get())
                .failure(new SyncFailure(e.getMessage(), e.causeCode()))
                .telemetry(telemetry.render())
                .build();
    }

    private void journal(SyncSummary summary, Instant startedAt, SyncTelemetry telemetry) {
        if (journal == null) {
            return;
        }
        try {
            journal.record(summary, trigger, startedAt, telemetry.finishedAt());
        } catch (SQLException e) {
            LOG.warn("Could not journal sync run: {}", e.getMessage());
        }
    }
}
