package com.cementtracker.delivery.export;

import com.cementtracker.delivery.model.ReportRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes stored records as RFC 4180 CSV, oldest date first.
 */
public final class CsvExporter {
    private static final Logger LOG = LogManager.getLogger(CsvExporter.class);
    static final String HEADER = "date,short,excess,per_bag_short_excess,email_subject,email_received";
    private static final DateTimeFormatter RECEIVED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Writes all records to {@code target}, creating parent directories. Returns the number of data rows.
     */
    public int export(List<ReportRecord> records, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int written;
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            written = write(records, writer);
        }
        LOG.info("Exported {} record(s) to {}", written, target.toAbsolutePath());
        return written;
    }

    // Rows sorted by date, CRLF line ends.
    public int write(List<ReportRecord> records, Writer writer) throws IOException {
        List<ReportRecord> ordered = records.stream()
                .sorted(Comparator.comparing((ReportRecord r) -> r.date))
                .collect(Collectors.toList());
        writer.write(HEADER);
        writer.write("\r\n");
        for (ReportRecord record : ordered) {
            writer.write(String.join(",",
                    record.date.toString(),
                    Integer.toString(record.shortKg),
                    Integer.toString(record.excessKg),
                    number(record.perBagShortExcess),
                    quote(record.sourceSubject),
                    record.sourceReceivedAt == null ? "" : RECEIVED_FORMAT.format(record.sourceReceivedAt)));
            writer.write("\r\n");
        }
        writer.flush();
        return ordered.size();
    }

    static String quote(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String number(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        if (value == Math.rint(value)) {
            return String.format(Locale.US, "%.1f", value);
        }
        return Double.toString(value);
    }
}
