package com.cementtracker.delivery.sync;

import com.cementtracker.core.diagnostics.CauseCode;
import com.cementtracker.core.diagnostics.Outcome;
import com.cementtracker.delivery.model.InboundMessage;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sender and subject predicates applied before any parsing.
 */
public final class MessageFilter {
    private static final String OWNER = "message_filter";

    private final SyncSettings settings;

    public MessageFilter(SyncSettings settings) {
        this.settings = settings;
    }

    public Outcome<InboundMessage> evaluate(InboundMessage message) {
        String sender = senderIdentity(message);
        if (!senderMatches(sender)) {
            return Outcome.failure(CauseCode.SENDER_MISMATCH, OWNER, Map.of("sender", sender));
        }
        if (!subjectMatches(message.subject)) {
            return Outcome.failure(CauseCode.SUBJECT_MISMATCH, OWNER);
        }
        return Outcome.success(message, OWNER);
    }

    /**
     * Mail systems expose the sender inconsistently: prefer whichever field holds an address.
     */
    public String senderIdentity(InboundMessage message) {
        String address = safe(message.senderAddress);
        if (address.contains("@")) {
            return address;
        }
        String display = safe(message.senderDisplayName);
        if (display.contains("@")) {
            return display;
        }
        return address.isEmpty() ? display : address;
    }

    public boolean senderMatches(String sender) {
        String value = safe(sender).toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return false;
        }
        String expected = safe(settings.expectedSender).toLowerCase(Locale.ROOT);
        if (!expected.isEmpty() && value.contains(expected)) {
            return true;
        }
        for (String alias : settings.senderAliases) {
            if (!alias.isEmpty() && value.contains(alias)) {
                return true;
            }
        }
        return false;
    }

    public boolean subjectMatches(String subject) {
        String value = safe(subject).toLowerCase(Locale.ROOT);
        return matchesAnyGroup(value, settings.topicKeywords) && matchesAnyGroup(value, settings.kindKeywords);
    }

    private boolean matchesAnyGroup(String value, List<List<String>> groups) {
        if (groups == null || groups.isEmpty()) {
            return true;
        }
        for (List<String> group : groups) {
            boolean all = true;
            for (String term : group) {
                if (!value.contains(term)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
