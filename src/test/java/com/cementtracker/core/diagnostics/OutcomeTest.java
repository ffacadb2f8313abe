package com.cementtracker.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void failureShouldDropNullDetails() {
        Map<String, Object> details = new HashMap<>();
        details.put("sender", "someone@example.com");
        details.put("alias", null);

        Outcome<String> outcome = Outcome.failure(CauseCode.SENDER_MISMATCH, "message_filter", details);

        assertFalse(outcome.success);
        assertNull(outcome.value);
        assertEquals(Map.of("sender", "someone@example.com"), outcome.details);
        assertTrue(outcome.toString().contains("sender_mismatch"));
    }

    @Test
    void successShouldCarryNoCause() {
        Outcome<String> outcome = Outcome.success("report", "parser", Map.of("layout", "WHOLE_BODY"));

        assertTrue(outcome.success);
        assertEquals(CauseCode.NONE, outcome.causeCode);
        assertEquals("WHOLE_BODY", outcome.details.get("layout"));
        assertTrue(outcome.toString().contains("owner=parser"));
    }
}
