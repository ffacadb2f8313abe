package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the five-column delivery row and the per-bag short/excess value from a daily section.
 * <p>
 * Row columns are positional: total delivery, bag weight, physical weight, short, excess.
 */
public final class FieldExtractor {
    private static final String OWNER = "field_extractor";
    private static final String INT = "(\\d{1,3}(?:,\\d{3})+|\\d+)";

    static final Pattern ANCHORED_HEADER = Pattern.compile(
            "Physical\\s+Weight\\s+Short\\s+Excess", Pattern.CASE_INSENSITIVE);
    static final Pattern SHORT_EXCESS_HEADER = Pattern.compile("Short\\s+Excess", Pattern.CASE_INSENSITIVE);
    static final Pattern FIVE_INTEGERS = Pattern.compile(
            "(?<![\\d.,])" + INT + "\\s+" + INT + "\\s+" + INT + "\\s+" + INT + "\\s+" + INT + "(?!\\d|[.,]\\d)");
    static final Pattern PER_BAG = Pattern.compile(
            "Per\\s+Bags?\\s+Short(?:\\s*/\\s*Excess)?(?:\\s*\\(\\s*kg\\s*\\))?\\s*:\\s*([-+]?(?:\\d+(?:\\.\\d+)?|\\.\\d+))",
            Pattern.CASE_INSENSITIVE);

    private final List<TableStrategy> tableStrategies = List.of(
            new TableStrategy("anchored", ANCHORED_HEADER),
            new TableStrategy("header_relative", SHORT_EXCESS_HEADER)
    );

    public Outcome<DeliveryFigures> extract(TextSpan dailySection) {
        if (dailySection == null) {
            return Outcome.failure(CauseCode.SECTION_NOT_FOUND, OWNER);
        }
        Outcome<DeliveryFigures> table = extractTable(dailySection.text());
        if (!table.success) {
            return table;
        }
        Optional<Double> perBag = extractPerBag(dailySection);
        if (perBag.isEmpty()) {
            return Outcome.failure(CauseCode.PER_BAG_VALUE_NOT_FOUND, OWNER,
                    Map.of("layout", dailySection.layout().name()));
        }
        DeliveryFigures figures = table.value.toBuilder()
                .perBagShortExcess(perBag.get())
                .build();
        return Outcome.success(figures, OWNER, Map.of("table_strategy", figures.tableStrategy));
    }

    /**
     * Table figures only; {@code perBagShortExcess} of the result is 0.
     */
    public Outcome<DeliveryFigures> extractTable(String sectionText) {
        if (sectionText == null || sectionText.isBlank()) {
            return Outcome.failure(CauseCode.TABLE_NOT_FOUND, OWNER, Map.of("reason", "empty_section"));
        }
        for (TableStrategy strategy : tableStrategies) {
            Optional<DeliveryFigures> figures = strategy.apply(sectionText);
            if (figures.isPresent()) {
                return Outcome.success(figures.get(), OWNER);
            }
        }
        return Outcome.failure(CauseCode.TABLE_NOT_FOUND, OWNER);
    }

    /**
     * First per-bag value inside the section, else the first one before the section end.
     */
    public Optional<Double> extractPerBag(TextSpan dailySection) {
        Optional<Double> inside = firstPerBag(dailySection.text());
        if (inside.isPresent()) {
            return inside;
        }
        return firstPerBag(dailySection.textUpToEnd());
    }

    private Optional<Double> firstPerBag(String text) {
        Matcher matcher = PER_BAG.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static final class TableStrategy {
        private final String name;
        private final Pattern header;

        private TableStrategy(String name, Pattern header) {
            this.name = name;
            this.header = header;
        }

        private Optional<DeliveryFigures> apply(String text) {
            Matcher headerMatch = header.matcher(text);
            if (!headerMatch.find()) {
                return Optional.empty();
            }
            Matcher row = FIVE_INTEGERS.matcher(text);
            if (!row.find(headerMatch.end())) {
                return Optional.empty();
            }
            try {
                return Optional.of(DeliveryFigures.builder()
                        .totalDelivery(parseLong(row.group(1)))
                        .bagWeightTotal(parseLong(row.group(2)))
                        .physicalWeight(parseLong(row.group(3)))
                        .shortKg(Math.toIntExact(parseLong(row.group(4))))
                        .excessKg(Math.toIntExact(parseLong(row.group(5))))
                        .tableStrategy(name)
                        .build());
            } catch (ArithmeticException | NumberFormatException e) {
                return Optional.empty();
            }
        }

        private static long parseLong(String token) {
            return Long.parseLong(token.replace(",", ""));
        }
    }
}
