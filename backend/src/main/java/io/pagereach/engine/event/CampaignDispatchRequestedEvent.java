package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

/** Published when a run starts or resumes; dispatch begins once the transaction commits. */
public record CampaignDispatchRequestedEvent(
    String eventType, UUID campaignId, int runNumber, Instant occurredAt)
    implements DomainEvent {}
