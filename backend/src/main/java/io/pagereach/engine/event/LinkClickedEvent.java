package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

public record LinkClickedEvent(UUID campaignId, UUID contactId, Instant occurredAt)
    implements InboundEvent {}
