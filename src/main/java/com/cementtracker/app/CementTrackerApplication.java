package com.cementtracker.app;

import com.cementtracker.core.TrackerException;
import com.cementtracker.delivery.config.Config;
import com.cementtracker.delivery.db.Database;
import com.cementtracker.delivery.db.DeliveryReportDao;
import com.cementtracker.delivery.db.SyncRunDao;
import com.cementtracker.delivery.db.mybatis.SyncRunRow;
import com.cementtracker.delivery.export.CsvExporter;
import com.cementtracker.delivery.export.RangeSummary;
import com.cementtracker.delivery.model.ItemDiagnostic;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.model.SyncFailure;
import com.cementtracker.delivery.model.SyncRequest;
import com.cementtracker.delivery.model.SyncSummary;
import com.cementtracker.delivery.parse.RecordBuilder;
import com.cementtracker.delivery.parse.ReportParser;
import com.cementtracker.delivery.source.EmlDirectoryMessageSource;
import com.cementtracker.delivery.source.ImapMessageSource;
import com.cementtracker.delivery.source.MessageSource;
import com.cementtracker.delivery.sync.BackgroundSyncRunner;
import com.cementtracker.delivery.sync.Deduplicator;
import com.cementtracker.delivery.sync.MessageFilter;
import com.cementtracker.delivery.sync.RecordCorrectionService;
import com.cementtracker.delivery.sync.StoreSynchronizer;
import com.cementtracker.delivery.sync.SyncSession;
import com.cementtracker.delivery.sync.SyncSettings;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line entry point.
 * <p>
 * One command per invocation: migrate, sync, update, delete, list, summary, export, audit or history.
 * Exit code is 0 on success, 1 when the command fails or finds nothing to act on, 2 on bad arguments.
 */
public final class CementTrackerApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new CementTrackerApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("cement-tracker", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("cement-tracker", options);
            return 0;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            Database database = new Database(
                    readDbUrl(config),
                    readDbUser(config),
                    readDbPass(config),
                    config.getString("db.schema", "cement"),
                    config.getBoolean("db.sql_log.enabled", false)
            );
            System.out.println("DB dialect=" + database.dialect() + ", url=" + database.maskedJdbcUrl());

            SyncSettings settings = SyncSettings.fromConfig(config);
            RecordBuilder recordBuilder = new RecordBuilder(settings.nominalBagWeight);
            DeliveryReportDao reportDao = new DeliveryReportDao(database);
            StoreSynchronizer synchronizer = new StoreSynchronizer(reportDao, recordBuilder);
            StoreSynchronizer.SchemaStatus status = synchronizer.initialize();
            if (status.derivedColumnAdded()) {
                System.out.println("bag_weight column added, rows backfilled=" + status.rowsBackfilled());
            }

            if (cmd.hasOption("migrate")) {
                System.out.println("Schema is up to date.");
                return 0;
            }
            if (cmd.hasOption("sync")) {
                return runSync(cmd, config, settings, recordBuilder, synchronizer, new SyncRunDao(database));
            }
            if (cmd.hasOption("update")) {
                return runUpdate(cmd, new RecordCorrectionService(reportDao, recordBuilder));
            }
            if (cmd.hasOption("delete")) {
                LocalDate date = parseDate(cmd.getOptionValue("delete"));
                boolean deleted = new RecordCorrectionService(reportDao, recordBuilder).deleteRecord(date);
                System.out.println(deleted ? "Deleted " + date : "No record for " + date);
                return deleted ? 0 : 1;
            }
            if (cmd.hasOption("list")) {
                printRecords(selectRecords(cmd, reportDao));
                return 0;
            }
            if (cmd.hasOption("summary")) {
                List<ReportRecord> records = selectRecords(cmd, reportDao);
                LocalDate from = cmd.hasOption("from") ? parseDate(cmd.getOptionValue("from")) : firstDate(records);
                LocalDate to = cmd.hasOption("to") ? parseDate(cmd.getOptionValue("to")) : lastDate(records);
                System.out.println(RangeSummary.of(from, to, records).toDisplayString());
                return 0;
            }
            if (cmd.hasOption("export")) {
                String raw = cmd.getOptionValue("export");
                Path target = raw == null || raw.isBlank()
                        ? config.getPath("export.path")
                        : workingDir.resolve(raw.trim()).normalize();
                int count = new CsvExporter().export(reportDao.getAll(), target);
                System.out.println("Exported " + count + " record(s) to " + target);
                return 0;
            }
            if (cmd.hasOption("audit")) {
                List<LocalDate> mismatches = synchronizer.auditDerivedField();
                if (mismatches.isEmpty()) {
                    System.out.println("bag_weight consistent for all records");
                    return 0;
                }
                System.out.println("bag_weight mismatches: " + mismatches);
                return 1;
            }
            if (cmd.hasOption("history")) {
                for (SyncRunRow row : new SyncRunDao(database).listRecent(20)) {
                    System.out.println(String.format(Locale.US, "#%d %s %s %s..%s processed=%d synced=%d skipped=%d cancelled=%s",
                            row.getId(), row.getStartedAt(), row.getStatus(), row.getWindowFrom(), row.getWindowTo(),
                            nz(row.getProcessed()), nz(row.getSynced()),
                            nz(row.getExcluded()) + nz(row.getParseFailed()), nz(row.getCancelled()) == 1));
                }
                return 0;
            }
            new HelpFormatter().printHelp("cement-tracker", options);
            return 2;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (TrackerException e) {
            System.err.println("FATAL [" + e.causeCode().label() + "]: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runSync(
            CommandLine cmd,
            Config config,
            SyncSettings settings,
            RecordBuilder recordBuilder,
            StoreSynchronizer synchronizer,
            SyncRunDao journal
    ) throws Exception {
        LocalDate today = LocalDate.now(zone(config));
        int windowDays = Math.max(1, config.getInt("sync.default_window_days", 7));
        LocalDate to = cmd.hasOption("to") ? parseDate(cmd.getOptionValue("to")) : today;
        LocalDate from = cmd.hasOption("from") ? parseDate(cmd.getOptionValue("from")) : to.minusDays(windowDays);
        SyncRequest request = new SyncRequest(from, to);

        SyncSession session = new SyncSession(
                buildSource(cmd, config),
                new MessageFilter(settings),
                new ReportParser(recordBuilder),
                new Deduplicator(),
                synchronizer,
                journal,
                "cli"
        );

        try (BackgroundSyncRunner runner = new BackgroundSyncRunner()) {
            Future<SyncSummary> future = runner.submit(session, request);
            Thread hook = new Thread(() -> {
                if (runner.cancelCurrent()) {
                    awaitQuietly(future);
                }
            }, "sync-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            SyncSummary summary;
            try {
                summary = future.get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof Exception) {
                    throw (Exception) e.getCause();
                }
                throw e;
            } finally {
                removeHookQuietly(hook);
            }
            printSummary(summary);
            return 0;
        }
    }

    private int runUpdate(CommandLine cmd, RecordCorrectionService corrections) throws TrackerException {
        if (!cmd.hasOption("short") || !cmd.hasOption("excess") || !cmd.hasOption("per-bag")) {
            throw new IllegalArgumentException("--update requires --short, --excess and --per-bag");
        }
        LocalDate date = parseDate(cmd.getOptionValue("update"));
        boolean updated = corrections.updateRecord(
                date,
                Integer.parseInt(cmd.getOptionValue("short").trim()),
                Integer.parseInt(cmd.getOptionValue("excess").trim()),
                Double.parseDouble(cmd.getOptionValue("per-bag").trim())
        );
        System.out.println(updated ? "Updated " + date : "No record for " + date);
        return updated ? 0 : 1;
    }

    private MessageSource buildSource(CommandLine cmd, Config config) {
        String type = cmd.getOptionValue("source", config.getString("source.type", "imap")).trim().toLowerCase(Locale.ROOT);
        if ("eml".equals(type)) {
            Path dir = cmd.hasOption("eml-dir")
                    ? config.workingDir().resolve(cmd.getOptionValue("eml-dir").trim()).normalize()
                    : config.getPath("source.eml_dir");
            return new EmlDirectoryMessageSource(dir, zone(config));
        }
        if ("imap".equals(type)) {
            return new ImapMessageSource(ImapMessageSource.loadSettings(config));
        }
        throw new IllegalArgumentException("unknown source type: " + type + " (expected imap or eml)");
    }

    private List<ReportRecord> selectRecords(CommandLine cmd, DeliveryReportDao dao) throws Exception {
        if (cmd.hasOption("from") || cmd.hasOption("to")) {
            LocalDate from = cmd.hasOption("from") ? parseDate(cmd.getOptionValue("from")) : LocalDate.of(1970, 1, 1);
            LocalDate to = cmd.hasOption("to") ? parseDate(cmd.getOptionValue("to")) : LocalDate.of(9999, 12, 31);
            return dao.findRange(from, to);
        }
        return dao.getAll();
    }

    private void printRecords(List<ReportRecord> records) {
        System.out.println(String.format(Locale.US, "%-10s %8s %8s %10s %10s  %s",
                "date", "short", "excess", "per_bag", "bag_wt", "subject"));
        for (ReportRecord r : records) {
            System.out.println(String.format(Locale.US, "%-10s %8d %8d %10.4f %10.4f  %s",
                    r.date, r.shortKg, r.excessKg, r.perBagShortExcess, r.bagWeightKg, r.sourceSubject));
        }
        System.out.println(records.size() + " record(s)");
    }

    private void printSummary(SyncSummary summary) {
        System.out.println("Sync " + summary.state + ": " + summary.toLogLine());
        for (SyncFailure failure : summary.failures) {
            System.out.println("  failed: " + failure.reason().label() + " - " + failure.subject());
        }
        for (ItemDiagnostic item : summary.diagnostics) {
            if (item.outcome() == ItemDiagnostic.Outcome.SUPERSEDED) {
                System.out.println("  superseded: " + item.subject() + " (" + item.receivedAt() + ")");
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("sync").desc("fetch report mails in the window and store daily figures").build());
        options.addOption(Option.builder().longOpt("from").hasArg().argName("yyyy-MM-dd").desc("window start (inclusive)").build());
        options.addOption(Option.builder().longOpt("to").hasArg().argName("yyyy-MM-dd").desc("window end (inclusive), default today").build());
        options.addOption(Option.builder().longOpt("source").hasArg().argName("imap|eml").desc("message source, default from config source.type").build());
        options.addOption(Option.builder().longOpt("eml-dir").hasArg().argName("dir").desc("directory of .eml files for --source eml").build());
        options.addOption(Option.builder().longOpt("list").desc("print stored records, optionally limited by --from/--to").build());
        options.addOption(Option.builder().longOpt("summary").desc("print totals and averages, optionally limited by --from/--to").build());
        options.addOption(Option.builder().longOpt("update").hasArg().argName("yyyy-MM-dd").desc("correct a stored record; needs --short --excess --per-bag").build());
        options.addOption(Option.builder().longOpt("short").hasArg().argName("kg").desc("short kg for --update").build());
        options.addOption(Option.builder().longOpt("excess").hasArg().argName("kg").desc("excess kg for --update").build());
        options.addOption(Option.builder().longOpt("per-bag").hasArg().argName("kg").desc("per-bag short/excess for --update").build());
        options.addOption(Option.builder().longOpt("delete").hasArg().argName("yyyy-MM-dd").desc("delete the record of a date").build());
        options.addOption(Option.builder().longOpt("export").optionalArg(true).hasArg().argName("path").desc("export all records to CSV").build());
        options.addOption(Option.builder().longOpt("audit").desc("check stored bag_weight against per-bag values").build());
        options.addOption(Option.builder().longOpt("history").desc("show recent sync runs").build());
        options.addOption(Option.builder().longOpt("migrate").desc("bring the database schema up to date, then exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (CementTrackerApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("cement.log.dir", logDir.toAbsolutePath().toString());

                // Console appenders must bind to the real streams before they are replaced.
                LogManager.getLogger(CementTrackerApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private String readDbUrl(Config config) {
        return firstNonBlank(System.getenv("CEMENT_DB_URL"), config.getString("db.url"));
    }

    private String readDbUser(Config config) {
        return firstNonBlank(System.getenv("CEMENT_DB_USER"), config.getString("db.user"));
    }

    private String readDbPass(Config config) {
        return firstNonBlank(System.getenv("CEMENT_DB_PASS"), config.getString("db.pass"));
    }

    private ZoneId zone(Config config) {
        String raw = config.getString("app.zone", "");
        return raw.isBlank() ? ZoneId.systemDefault() : ZoneId.of(raw.trim());
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("date value is required (yyyy-MM-dd)");
        }
        return LocalDate.parse(raw.trim());
    }

    private static LocalDate firstDate(List<ReportRecord> records) {
        return records.isEmpty() ? LocalDate.now() : records.get(0).date;
    }

    private static LocalDate lastDate(List<ReportRecord> records) {
        return records.isEmpty() ? LocalDate.now() : records.get(records.size() - 1).date;
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }

    private static void awaitQuietly(Future<?> future) {
        try {
            future.get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            System.err.println("WARN: sync did not finish cleanly on shutdown: " + e.getMessage());
        }
    }

    private static void removeHookQuietly(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running.
            return;
        }
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }
}
