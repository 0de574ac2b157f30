package io.pagereach.engine.event;

import java.time.Instant;

/**
 * Signals produced by webhook ingestion upstream of the engine. The engine consumes them; it never
 * publishes them itself outside tests.
 */
public sealed interface InboundEvent
    permits MessageDeliveredEvent,
        MessageReadEvent,
        ContactRepliedEvent,
        LinkClickedEvent,
        ContactUnsubscribedEvent,
        RecurringOptOutEvent,
        ContactCreatedEvent,
        ContactTagChangedEvent,
        ContactFieldChangedEvent {

  Instant occurredAt();
}
