package io.pagereach.engine.event;

import java.time.Instant;
import java.util.UUID;

public record CampaignStatusChangedEvent(
    String eventType,
    UUID campaignId,
    String oldStatus,
    String newStatus,
    int runNumber,
    Instant occurredAt)
    implements DomainEvent {}
