package io.pagereach.engine.trigger;

import java.util.UUID;

/**
 * @param totalTriggered firings over the campaign's life
 * @param uniqueContacts distinct contacts the campaign fired for
 */
public record TriggerStats(
    UUID campaignId,
    boolean active,
    long totalTriggered,
    long uniqueContacts,
    int sent,
    int failed,
    int blocked) {}
