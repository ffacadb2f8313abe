package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.delivery.ReportFixtures;
import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.InboundMessage;
import com.cementtracker.delivery.model.ReportRecord;
import com.cementtracker.delivery.source.MimeMessageReader;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportParserTest {
    private static final LocalDateTime RECEIVED = LocalDateTime.of(2024, 1, 5, 18, 30);

    private final ReportParser parser = new ReportParser(new RecordBuilder());

    @Test
    void singleSectionReportShouldYieldDailyRecord() {
        String body = ReportFixtures.singleSection("05-Jan-2024", "31517 1575850 1577600 320 2070", "-0.0414");

        CandidateReport candidate = parser.parse(ReportFixtures.message("Weigh Bridge Report", body, RECEIVED));

        assertTrue(candidate.isParsed());
        ReportRecord record = candidate.record;
        assertEquals(LocalDate.of(2024, 1, 5), record.date);
        assertEquals(320, record.shortKg);
        assertEquals(2070, record.excessKg);
        assertEquals(-0.0414, record.perBagShortExcess, 1e-12);
        assertEquals(50.0414, record.bagWeightKg, 1e-9);
        assertEquals("Weigh Bridge Report", record.sourceSubject);
        assertEquals(RECEIVED, record.sourceReceivedAt);
    }

    @Test
    void twoSectionReportsShouldNeverReadMonthlyFigures() {
        String monthlyRow = "150,000 7,500,000 7,510,000 1,200 11,200";
        String[] bodies = {
                ReportFixtures.dailyAndMonthly("05-Jan-2024", "31517 1575850 1577600 320 2070", "-0.0414", monthlyRow, "0.0667"),
                ReportFixtures.repeatedHeader("05-Jan-2024", "31517 1575850 1577600 320 2070", "-0.0414", monthlyRow, "0.0667")
        };
        for (String body : bodies) {
            CandidateReport candidate = parser.parse(ReportFixtures.message("Weigh Bridge Report", body, RECEIVED));

            assertTrue(candidate.isParsed());
            assertEquals(320, candidate.record.shortKg);
            assertEquals(2070, candidate.record.excessKg);
            assertEquals(-0.0414, candidate.record.perBagShortExcess, 1e-12);
        }
    }

    @Test
    void sideBySideReportShouldReadDailyColumnsOfSharedRow() {
        String plain = ReportFixtures.sideBySide("05-Jan-2024",
                "31517 1575850 1577600 320 2070", "-0.0414",
                "150000 7500000 7510000 1200 11200", "0.0667");
        String html = MimeMessageReader.htmlToText("<html><body>"
                + "<p>Date: 05-Jan-2024</p>"
                + "<p>Delivery Information: Bag Cement</p>"
                + "<table>"
                + "<tr><td colspan=\"5\">Daily Report</td><td colspan=\"5\">Monthly to Date Report</td></tr>"
                + "<tr>" + headerCells() + headerCells() + "</tr>"
                + "<tr>" + cells("31517", "1575850", "1577600", "320", "2070")
                + cells("150000", "7500000", "7510000", "1200", "11200") + "</tr>"
                + "</table>"
                + "<p>Per Bag Short/Excess: -0.0414</p>"
                + "<p>Per Bag Short/Excess: 0.0667</p>"
                + "</body></html>");

        for (String body : new String[]{plain, html}) {
            CandidateReport candidate = parser.parse(ReportFixtures.message("Weigh Bridge Report", body, RECEIVED));

            assertTrue(candidate.isParsed(), body);
            assertEquals(LocalDate.of(2024, 1, 5), candidate.record.date);
            assertEquals(320, candidate.record.shortKg);
            assertEquals(2070, candidate.record.excessKg);
            assertEquals(-0.0414, candidate.record.perBagShortExcess, 1e-12);
            assertEquals(50.0414, candidate.record.bagWeightKg, 1e-9);
        }
    }

    @Test
    void dateShouldFallBackToSubject() {
        String body = String.join("\n", ReportFixtures.HEADER, "31517 1575850 1577600 0 15", "Per Bag Short: 0.0005");

        CandidateReport candidate = parser.parse(ReportFixtures.message("Weigh Bridge Report 12-Feb-2024", body, RECEIVED));

        assertTrue(candidate.isParsed());
        assertEquals(LocalDate.of(2024, 2, 12), candidate.record.date);
    }

    @Test
    void failuresShouldCarryCauseAndProvenance() {
        InboundMessage noDate = ReportFixtures.message("Weigh Bridge Report", "Short Excess\n1 2 3 4 5", RECEIVED);
        InboundMessage noTable = ReportFixtures.message("Weigh Bridge Report", "Date: 05-Jan-2024\nno deliveries", RECEIVED);
        InboundMessage empty = ReportFixtures.message("Weigh Bridge Report", "  ", RECEIVED);

        CandidateReport dateFailure = parser.parse(noDate);
        assertFalse(dateFailure.isParsed());
        assertNull(dateFailure.record);
        assertEquals(CauseCode.DATE_NOT_FOUND, dateFailure.failure);
        assertEquals(RECEIVED, dateFailure.sourceReceivedAt);

        assertEquals(CauseCode.SECTION_NOT_FOUND, parser.parse(noTable).failure);
        assertEquals(CauseCode.EMPTY_BODY, parser.parse(empty).failure);
    }

    @Test
    void customNominalWeightShouldDriveBagWeight() {
        ReportParser heavy = new ReportParser(new RecordBuilder(40.0));
        String body = ReportFixtures.singleSection("05-Jan-2024", "1 2 3 4 5", "0.5");

        CandidateReport candidate = heavy.parse(ReportFixtures.message("Weigh Bridge Report", body, RECEIVED));

        assertEquals(39.5, candidate.record.bagWeightKg, 1e-9);
        assertTrue(candidate.record.hasConsistentBagWeight(40.0));
    }

    private static String headerCells() {
        return "<th>Total Delivery</th><th>Bag Weight</th><th>Physical Weight</th><th>Short</th><th>Excess</th>";
    }

    private static String cells(String... values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            sb.append("<td>").append(value).append("</td>");
        }
        return sb.toString();
    }
}
