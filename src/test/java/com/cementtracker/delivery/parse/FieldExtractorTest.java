package com.cementtracker.delivery.parse;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldExtractorTest {
    private final FieldExtractor extractor = new FieldExtractor();

    @Test
    void anchoredRowShouldMapColumnsPositionally() {
        Outcome<DeliveryFigures> out = extractor.extractTable(
                "Total Delivery Bag Weight Physical Weight Short Excess\n31517 1575850 1577600 320 2070\n");

        assertTrue(out.success);
        assertEquals(31517L, out.value.totalDelivery);
        assertEquals(1575850L, out.value.bagWeightTotal);
        assertEquals(1577600L, out.value.physicalWeight);
        assertEquals(320, out.value.shortKg);
        assertEquals(2070, out.value.excessKg);
        assertEquals("anchored", out.value.tableStrategy);
    }

    @Test
    void thousandsSeparatorsShouldBeAccepted() {
        Outcome<DeliveryFigures> out = extractor.extractTable(
                "Physical Weight Short Excess\n31,517 1,575,850 1,577,600 1,320 2,070");

        assertTrue(out.success);
        assertEquals(1320, out.value.shortKg);
        assertEquals(2070, out.value.excessKg);
    }

    @Test
    void shortenedHeaderShouldUseHeaderRelativeStrategy() {
        Outcome<DeliveryFigures> out = extractor.extractTable("Qty Bags Weight Short Excess\n10 500 505 0 5");

        assertTrue(out.success);
        assertEquals("header_relative", out.value.tableStrategy);
        assertEquals(5, out.value.excessKg);
    }

    @Test
    void decimalNumbersShouldNotFormRow() {
        Outcome<DeliveryFigures> out = extractor.extractTable("Physical Weight Short Excess\n1 2 3 4 5.5");

        assertFalse(out.success);
        assertEquals(CauseCode.TABLE_NOT_FOUND, out.causeCode);
    }

    @Test
    void missingPerBagValueShouldFailExtraction() {
        String text = "Physical Weight Short Excess\n31517 1575850 1577600 320 2070";

        Outcome<DeliveryFigures> out = extractor.extract(TextSpan.whole(text));

        assertFalse(out.success);
        assertEquals(CauseCode.PER_BAG_VALUE_NOT_FOUND, out.causeCode);
    }

    @Test
    void perBagBeforeSectionShouldBeFoundButNotAfterIt() {
        String source = "Per Bags Short/Excess (kg): +0.25\nDaily Report\nrows\nMonthly to Date\nPer Bag Short: 9.9";
        int start = source.indexOf("rows");
        int end = source.indexOf("Monthly");
        TextSpan span = new TextSpan(source, start, end, TextSpan.Layout.DAILY_MONTHLY_MARKERS);

        Optional<Double> perBag = extractor.extractPerBag(span);

        assertEquals(Optional.of(0.25), perBag);
    }
}
