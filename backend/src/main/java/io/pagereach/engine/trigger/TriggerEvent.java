package io.pagereach.engine.trigger;

import io.pagereach.engine.stats.EngagementType;
import java.util.UUID;

/**
 * Something that happened to a contact, as seen by trigger evaluation.
 *
 * @param tagName set for TAG_ADDED and TAG_REMOVED
 * @param engagement set for ENGAGEMENT_CHANGE
 */
public record TriggerEvent(
    UUID contactId, TriggerEventType type, String tagName, EngagementType engagement) {

  public static TriggerEvent of(UUID contactId, TriggerEventType type) {
    return new TriggerEvent(contactId, type, null, null);
  }

  public static TriggerEvent tag(UUID contactId, String tagName, boolean added) {
    var type = added ? TriggerEventType.TAG_ADDED : TriggerEventType.TAG_REMOVED;
    return new TriggerEvent(contactId, type, tagName, null);
  }

  public static TriggerEvent engagement(UUID contactId, EngagementType engagement) {
    return new TriggerEvent(contactId, TriggerEventType.ENGAGEMENT_CHANGE, null, engagement);
  }
}
