package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the daily part of a report body so that month-to-date figures are never read.
 * <p>
 * Layouts are tried in order; the first one that yields a span containing a table header wins.
 */
public final class SectionLocator {
    private static final String OWNER = "section_locator";

    static final Pattern DAILY_MARKER = Pattern.compile("Daily\\s+Report", Pattern.CASE_INSENSITIVE);
    static final Pattern MONTHLY_MARKER = Pattern.compile("Monthly\\s+to\\s+Date(?:\\s+Report)?", Pattern.CASE_INSENSITIVE);
    static final Pattern DELIVERY_INFO_LABEL = Pattern.compile(
            "Delivery\\s+Information\\s*:\\s*Bag\\s+Cement", Pattern.CASE_INSENSITIVE);
    static final Pattern FULL_HEADER = Pattern.compile(
            "Total\\s+Delivery\\s+Bag\\s+Weight\\s+Physical\\s+Weight\\s+Short\\s+Excess", Pattern.CASE_INSENSITIVE);
    static final Pattern SHORT_EXCESS_HEADER = Pattern.compile("Short\\s+Excess", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final List<Function<String, Optional<TextSpan>>> strategies = List.of(
            SectionLocator::betweenDailyAndMonthlyMarkers,
            SectionLocator::beforeSecondHeader,
            SectionLocator::afterDailyMarker,
            SectionLocator::wholeBody
    );

    public Outcome<TextSpan> locateDailySection(String fullText) {
        if (fullText == null || fullText.isBlank()) {
            return Outcome.failure(CauseCode.SECTION_NOT_FOUND, OWNER, Map.of("reason", "empty_text"));
        }
        for (Function<String, Optional<TextSpan>> strategy : strategies) {
            Optional<TextSpan> span = strategy.apply(fullText);
            if (span.isPresent()) {
                return Outcome.success(span.get(), OWNER, Map.of("layout", span.get().layout().name()));
            }
        }
        return Outcome.failure(CauseCode.SECTION_NOT_FOUND, OWNER);
    }

    static Optional<TextSpan> betweenDailyAndMonthlyMarkers(String text) {
        Matcher daily = DAILY_MARKER.matcher(text);
        if (!daily.find()) {
            return Optional.empty();
        }
        Matcher monthly = MONTHLY_MARKER.matcher(text);
        if (!monthly.find(daily.end())) {
            return Optional.empty();
        }
        TextSpan span = new TextSpan(text, daily.end(), monthly.start(), TextSpan.Layout.DAILY_MONTHLY_MARKERS);
        // Two-column mails put both markers on one line; the span then has no table.
        return containsHeader(span) ? Optional.of(span) : Optional.empty();
    }

    static Optional<TextSpan> beforeSecondHeader(String text) {
        int from = 0;
        Matcher label = DELIVERY_INFO_LABEL.matcher(text);
        if (label.find()) {
            from = label.end();
        }
        Matcher header = FULL_HEADER.matcher(text);
        header.region(from, text.length());
        if (!header.find()) {
            return Optional.empty();
        }
        int firstStart = header.start();
        int firstEnd = header.end();
        if (!header.find()) {
            return Optional.empty();
        }
        if (DIGIT.matcher(text).region(firstEnd, header.start()).find()) {
            // The span keeps the first header so the anchored table strategy still applies.
            return Optional.of(new TextSpan(text, firstStart, header.start(), TextSpan.Layout.REPEATED_HEADER));
        }
        // Headers side by side: the shared row opens with the daily columns.
        return Optional.of(new TextSpan(text, firstStart, sideBySideEnd(text, header.end()),
                TextSpan.Layout.SIDE_BY_SIDE_HEADER));
    }

    /**
     * End of the first per-bag value after the headers, or of the first data line when there is none.
     */
    private static int sideBySideEnd(String text, int headersEnd) {
        Matcher perBag = FieldExtractor.PER_BAG.matcher(text);
        if (perBag.find(headersEnd)) {
            return perBag.end();
        }
        Matcher digit = DIGIT.matcher(text);
        if (!digit.find(headersEnd)) {
            return text.length();
        }
        int lineEnd = text.indexOf('\n', digit.start());
        return lineEnd < 0 ? text.length() : lineEnd;
    }

    static Optional<TextSpan> afterDailyMarker(String text) {
        Matcher daily = DAILY_MARKER.matcher(text);
        if (!daily.find()) {
            return Optional.empty();
        }
        Matcher monthly = MONTHLY_MARKER.matcher(text);
        int end = monthly.find(daily.end()) ? monthly.start() : text.length();
        TextSpan span = new TextSpan(text, daily.end(), end, TextSpan.Layout.DAILY_MARKER_ONLY);
        return containsHeader(span) ? Optional.of(span) : Optional.empty();
    }

    static Optional<TextSpan> wholeBody(String text) {
        TextSpan span = TextSpan.whole(text);
        return containsHeader(span) ? Optional.of(span) : Optional.empty();
    }

    private static boolean containsHeader(TextSpan span) {
        return SHORT_EXCESS_HEADER.matcher(span.source()).region(span.start(), span.end()).find();
    }
}
