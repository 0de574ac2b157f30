package io.pagereach.engine.event;

import java.time.Instant;
import java.util.List;

/** Delivery receipt listing the platform message ids it covers. */
public record MessageDeliveredEvent(List<String> platformMessageIds, Instant occurredAt)
    implements InboundEvent {}
