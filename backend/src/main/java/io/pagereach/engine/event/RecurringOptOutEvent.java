package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

/** {@code STOP_NOTIFICATIONS} from the user; a null topic stops every topic on the page. */
public record RecurringOptOutEvent(UUID contactId, UUID pageId, String topic, Instant occurredAt)
    implements InboundEvent {}
