package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;
import com.cementtracker.delivery.model.CandidateReport;
import com.cementtracker.delivery.model.InboundMessage;
import com.cementtracker.delivery.model.ReportRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;

/**
 * Turns one accepted message into a candidate report: date, daily section, figures, record.
 */
public final class ReportParser {
    private static final Logger LOG = LogManager.getLogger(ReportParser.class);

    private final DateResolver dateResolver;
    private final SectionLocator sectionLocator;
    private final FieldExtractor fieldExtractor;
    private final RecordBuilder recordBuilder;

    public ReportParser(RecordBuilder recordBuilder) {
        this(new DateResolver(), new SectionLocator(), new FieldExtractor(), recordBuilder);
    }

    public ReportParser(
            DateResolver dateResolver,
            SectionLocator sectionLocator,
            FieldExtractor fieldExtractor,
            RecordBuilder recordBuilder
    ) {
        this.dateResolver = dateResolver;
        this.sectionLocator = sectionLocator;
        this.fieldExtractor = fieldExtractor;
        this.recordBuilder = recordBuilder;
    }

    public CandidateReport parse(InboundMessage message) {
        String subject = message.subject == null ? "" : message.subject;
        String body = message.body == null ? "" : message.body;
        if (body.isBlank()) {
            return CandidateReport.failed(CauseCode.EMPTY_BODY, subject, message.receivedAt);
        }

        Outcome<LocalDate> date = dateResolver.resolve(body);
        if (!date.success) {
            date = dateResolver.resolve(subject);
        }
        if (!date.success) {
            LOG.info("  date not found in body or subject");
            return CandidateReport.failed(date.causeCode, subject, message.receivedAt);
        }

        Outcome<TextSpan> section = sectionLocator.locateDailySection(body);
        if (!section.success) {
            LOG.info("  daily section not found");
            return CandidateReport.failed(section.causeCode, subject, message.receivedAt);
        }

        Outcome<DeliveryFigures> figures = fieldExtractor.extract(section.value);
        if (!figures.success) {
            LOG.info("  extraction failed: {} layout={}", figures.causeCode.label(), section.value.layout());
            return CandidateReport.failed(figures.causeCode, subject, message.receivedAt);
        }

        DeliveryFigures f = figures.value;
        ReportRecord record = recordBuilder.build(
                date.value,
                f.shortKg,
                f.excessKg,
                f.perBagShortExcess,
                subject,
                message.receivedAt
        );
        LOG.info("  parsed date={} short={} excess={} per_bag={} bag_weight={} layout={} table={}",
                record.date, record.shortKg, record.excessKg, record.perBagShortExcess,
                record.bagWeightKg, section.value.layout(), f.tableStrategy);
        return CandidateReport.parsed(record);
    }
}
