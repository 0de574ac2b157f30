package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

/** A tag was added to ({@code added}) or removed from a contact. */
public record ContactTagChangedEvent(
    UUID contactId, String tagName, boolean added, Instant occurredAt) implements InboundEvent {}
