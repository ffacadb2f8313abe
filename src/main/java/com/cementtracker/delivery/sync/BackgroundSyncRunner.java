package com.cementtracker.delivery.sync;

import com.cementtracker.delivery.model.SyncRequest;
import com.cementtracker.delivery.model.SyncSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs sync sessions on a single daemon worker so the caller stays responsive.
 * At most one session is in flight; further submissions are rejected until it ends.
 */
public final class BackgroundSyncRunner implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(BackgroundSyncRunner.class);

    private final ExecutorService worker;
    private final AtomicReference<SyncSession> inFlight = new AtomicReference<>();

    public BackgroundSyncRunner() {
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sync-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public Future<SyncSummary> submit(SyncSession session, SyncRequest request) {
        if (!inFlight.compareAndSet(null, session)) {
            throw new RejectedExecutionException("a sync session is already running");
        }
        try {
            return worker.submit(() -> {
                try {
                    return session.run(request);
                } finally {
                    inFlight.set(null);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.set(null);
            throw e;
        }
    }

    public boolean isBusy() {
        return inFlight.get() != null;
    }

    public boolean cancelCurrent() {
        SyncSession session = inFlight.get();
        if (session == null) {
            return false;
        }
        session.cancel();
        return true;
    }

    @Override
    public void close() {
        cancelCurrent();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Sync worker did not stop within 30s");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
