package com.cementtracker.core;

import com.cementtracker.core.diagnostics.CauseCode;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Message funnel of one sync session.
 * <p>
 * Each stage records how many items came in, how many went on to the next stage, and why the rest dropped
 * out. A session that stops on a fatal error records the stage and cause it stopped at.
 */
public final class SyncTelemetry {
    public enum Stage {
        FETCH,
        FILTER,
        PARSE,
        RECONCILE,
        PERSIST
    }

    public static final String DROP_CANCELLED = "cancelled";
    public static final String DROP_SUPERSEDED = "superseded";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private Stage abortedIn;
    private CauseCode abortCause = CauseCode.NONE;

    private final Map<Stage, Funnel> funnels = new EnumMap<>(Stage.class);

    public SyncTelemetry(String trigger, Instant startedAt) {
        this.trigger = trigger == null || trigger.isBlank() ? "manual" : trigger.trim();
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    /**
     * Starts a stage whose input size is not known up front, such as fetching.
     */
    public synchronized void enter(Stage stage) {
        startClock(funnel(stage));
    }

    public synchronized void enter(Stage stage, int items) {
        Funnel funnel = funnel(stage);
        funnel.entered = Math.max(0, items);
        startClock(funnel);
    }

    public synchronized void drop(Stage stage, String reason) {
        drop(stage, reason, 1);
    }

    public synchronized void drop(Stage stage, String reason, int count) {
        if (count <= 0) {
            return;
        }
        String key = reason == null || reason.isBlank() ? CauseCode.NONE.label() : reason;
        funnel(stage).drops.merge(key, count, Integer::sum);
    }

    public synchronized void leave(Stage stage, int passed) {
        Funnel funnel = funnel(stage);
        funnel.passed = Math.max(0, passed);
        stopClock(funnel);
    }

    /**
     * Marks the stage the session stopped at; later stages stay unrecorded.
     */
    public synchronized void abort(Stage stage, CauseCode cause) {
        stopClock(funnel(stage));
        abortedIn = stage;
        abortCause = cause == null ? CauseCode.RUNTIME_ERROR : cause;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized int passed(Stage stage) {
        Funnel funnel = funnels.get(stage);
        return funnel == null ? 0 : funnel.passed;
    }

    public synchronized int dropped(Stage stage, String reason) {
        Funnel funnel = funnels.get(stage);
        return funnel == null ? 0 : funnel.drops.getOrDefault(reason, 0);
    }

    /**
     * One header line, then one line per recorded stage in pipeline order.
     */
    public synchronized String render() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("trigger=").append(trigger)
                .append(" started_at=").append(ISO.format(startedAt))
                .append(" elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis()));
        for (Map.Entry<Stage, Funnel> entry : funnels.entrySet()) {
            Funnel funnel = entry.getValue();
            sb.append('\n').append(String.format(Locale.US, "%-9s", entry.getKey().name()));
            sb.append(" in=").append(funnel.entered < 0 ? "-" : String.valueOf(funnel.entered));
            sb.append(" out=").append(funnel.passed);
            if (!funnel.drops.isEmpty()) {
                sb.append(" dropped:");
                funnel.drops.forEach((reason, count) -> sb.append(' ').append(reason).append('=').append(count));
            }
            sb.append(' ').append(funnel.elapsedMs).append(" ms");
            if (entry.getKey() == abortedIn) {
                sb.append(" ABORTED ").append(abortCause.label());
            }
        }
        return sb.toString();
    }

    private Funnel funnel(Stage stage) {
        return funnels.computeIfAbsent(stage, ignored -> new Funnel());
    }

    private static void startClock(Funnel funnel) {
        funnel.startNanos = System.nanoTime();
        funnel.running = true;
    }

    private static void stopClock(Funnel funnel) {
        if (funnel.running) {
            funnel.elapsedMs += Math.max(0L, (System.nanoTime() - funnel.startNanos) / 1_000_000L);
            funnel.running = false;
        }
    }

    private static final class Funnel {
        private int entered = -1;
        private int passed;
        private long elapsedMs;
        private long startNanos;
        private boolean running;
        private final Map<String, Integer> drops = new LinkedHashMap<>();
    }
}
