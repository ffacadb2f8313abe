package com.cementtracker.delivery.source;

import com.cementtracker.core.SourceUnavailableException;
import com.cementtracker.delivery.model.InboundMessage;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only supplier of received messages.
 */
public interface MessageSource {

    /**
     * Messages received on any day from {@code from} through {@code to}, inclusive. Never modifies the mailbox.
     */
    List<InboundMessage> fetch(LocalDate from, LocalDate to) throws SourceUnavailableException;

    String describe();
}
