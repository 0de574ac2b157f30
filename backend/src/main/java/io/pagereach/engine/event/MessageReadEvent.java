package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

/** Read receipt: every message sent to the contact at or before {@code watermark} was read. */
public record MessageReadEvent(UUID contactId, Instant watermark, Instant occurredAt)
    implements InboundEvent {}
