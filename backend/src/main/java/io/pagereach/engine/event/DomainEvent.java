package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for engine events published via Spring ApplicationEventPublisher. All
 * implementations are records with primitive/UUID fields only, no JPA entity references, so they
 * stay valid after the publishing transaction commits.
 */
public sealed interface DomainEvent
    permits CampaignStatusChangedEvent, CampaignDispatchRequestedEvent {

  String eventType();

  UUID campaignId();

  Instant occurredAt();
}
