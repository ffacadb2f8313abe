package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves day / month-name / year triples such as {@code 05-Jan-2024}, {@code 5/JAN/24} or
 * {@code 05 January 2024}. The {@code Date:} labelled form wins over a bare triple.
 */
public final class DateResolver {
    private static final String OWNER = "date_resolver";
    private static final String SEP = "(?:\\s*[-/]\\s*|\\s+)";
    private static final String TRIPLE = "(\\d{1,2})" + SEP + "([A-Za-z]{3,9})\\.?" + SEP + "(\\d{2,4})(?!\\d)";

    static final Pattern LABELLED = Pattern.compile("Date\\s*:\\s*" + TRIPLE, Pattern.CASE_INSENSITIVE);
    static final Pattern BARE = Pattern.compile("(?<!\\d)" + TRIPLE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3),
            Map.entry("apr", 4), Map.entry("may", 5), Map.entry("jun", 6),
            Map.entry("jul", 7), Map.entry("aug", 8), Map.entry("sep", 9),
            Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    public Outcome<LocalDate> resolve(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure(CauseCode.DATE_NOT_FOUND, OWNER, Map.of("reason", "empty_text"));
        }
        LocalDate labelled = firstValid(LABELLED.matcher(text));
        if (labelled != null) {
            return Outcome.success(labelled, OWNER, Map.of("form", "labelled"));
        }
        LocalDate bare = firstValid(BARE.matcher(text));
        if (bare != null) {
            return Outcome.success(bare, OWNER, Map.of("form", "bare"));
        }
        return Outcome.failure(CauseCode.DATE_NOT_FOUND, OWNER);
    }

    /**
     * Maps a month token to 1..12 by its first three letters, or -1.
     */
    static int monthNumber(String token) {
        if (token == null || token.length() < 3) {
            return -1;
        }
        Integer month = MONTHS.get(token.substring(0, 3).toLowerCase(Locale.ROOT));
        return month == null ? -1 : month;
    }

    private LocalDate firstValid(Matcher matcher) {
        while (matcher.find()) {
            LocalDate date = toDate(matcher.group(1), matcher.group(2), matcher.group(3));
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private LocalDate toDate(String dayToken, String monthToken, String yearToken) {
        int month = monthNumber(monthToken);
        if (month < 0) {
            return null;
        }
        int year;
        if (yearToken.length() == 4) {
            year = Integer.parseInt(yearToken);
        } else if (yearToken.length() == 2) {
            year = 2000 + Integer.parseInt(yearToken);
        } else {
            return null;
        }
        try {
            return LocalDate.of(year, month, Integer.parseInt(dayToken));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
