package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

public record ContactCreatedEvent(UUID contactId, Instant occurredAt) implements InboundEvent {}
