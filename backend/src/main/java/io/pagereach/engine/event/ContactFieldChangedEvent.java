package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

public record ContactFieldChangedEvent(UUID contactId, String fieldKey, Instant occurredAt)
    implements InboundEvent {}
