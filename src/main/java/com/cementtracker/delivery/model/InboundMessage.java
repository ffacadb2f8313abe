package com.cementtracker.delivery.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One mail as the sync pipeline sees it, independent of where it was read from.
 * <p>
 * {@code body} is plain text; HTML bodies are flattened by the source before this is built.
 * {@code receivedAt} is local time and may be null for files without a date header.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class InboundMessage {
    public final String senderAddress;
    public final String senderDisplayName;
    public final String subject;
    public final String body;
    public final LocalDateTime receivedAt;
}
