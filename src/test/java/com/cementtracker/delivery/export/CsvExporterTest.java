package com.cementtracker.delivery.export;

import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.parse.RecordBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvExporterTest {
    private final RecordBuilder builder = new RecordBuilder();

    @Test
    void rowsShouldBeOrderedByDateWithQuotedSubjects() throws Exception {
        ReportRecord later = builder.build(LocalDate.of(2024, 1, 6), 0, 15, 0.5,
                "Weigh Bridge Report, \"final\"", LocalDateTime.of(2024, 1, 6, 8, 30));
        ReportRecord earlier = builder.build(LocalDate.of(2024, 1, 5), 320, 2070, -0.0414,
                "Weigh Bridge Report", LocalDateTime.of(2024, 1, 5, 14, 0));
        StringWriter out = new StringWriter();

        int written = new CsvExporter().write(List.of(later, earlier), out);

        assertEquals(2, written);
        assertEquals(CsvExporter.HEADER + "\r\n"
                + "2024-01-05,320,2070,-0.0414,Weigh Bridge Report,2024-01-05 14:00:00\r\n"
                + "2024-01-06,0,15,0.5,\"Weigh Bridge Report, \"\"final\"\"\",2024-01-06 08:30:00\r\n",
                out.toString());
    }

    @Test
    void missingValuesShouldBeEmptyCells() throws Exception {
        ReportRecord record = builder.build(LocalDate.of(2024, 1, 5), 1, 2, Double.NaN);
        StringWriter out = new StringWriter();

        new CsvExporter().write(List.of(record), out);

        assertEquals("2024-01-05,1,2,,,", out.toString().split("\r\n")[1]);
    }

    @Test
    void exportShouldCreateParentDirectories(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("outputs/cement_delivery_data.csv");

        new CsvExporter().export(List.of(builder.build(LocalDate.of(2024, 1, 5), 1, 2, 2.0)), target);

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("2024-01-05,1,2,2.0,,", lines.get(1));
    }

    @Test
    void quoteShouldLeavePlainTextAlone() {
        assertEquals("plain", CsvExporter.quote("plain"));
        assertEquals("\"two\nlines\"", CsvExporter.quote("two\nlines"));
        assertEquals("", CsvExporter.quote(null));
    }
}
