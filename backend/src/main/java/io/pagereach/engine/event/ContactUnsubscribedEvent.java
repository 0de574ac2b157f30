package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

public record ContactUnsubscribedEvent(UUID contactId, Instant occurredAt)
    implements InboundEvent {}
