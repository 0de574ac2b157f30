package io.pagereach.engine.trigger;

import io.pagereach.engine.segment.filter.FilterOperator;

/**
 * One condition of a trigger campaign.
 *
 * @param field custom field key for CUSTOM_FIELD_MATCH
 * @param operator comparison for CUSTOM_FIELD_MATCH
 * @param value expected custom field value, or the engagement name for ENGAGEMENT_CHANGE (null
 *     matches any engagement)
 * @param tagName tag for TAG_ADDED and TAG_REMOVED
 * @param inactivityDays days without an inbound message for INACTIVITY; defaults to 7
 */
public record TriggerCondition(
    TriggerEventType type,
    String field,
    FilterOperator operator,
    Object value,
    String tagName,
    Integer inactivityDays) {

  public static final int DEFAULT_INACTIVITY_DAYS = 7;

  public static TriggerCondition of(TriggerEventType type) {
    return new TriggerCondition(type, null, null, null, null, null);
  }

  public static TriggerCondition tag(TriggerEventType type, String tagName) {
    return new TriggerCondition(type, null, null, null, tagName, null);
  }

  public static TriggerCondition customField(String field, FilterOperator operator, Object value) {
    return new TriggerCondition(
        TriggerEventType.CUSTOM_FIELD_MATCH, field, operator, value, null, null);
  }

  public static TriggerCondition inactivity(int days) {
    return new TriggerCondition(TriggerEventType.INACTIVITY, null, null, null, null, days);
  }

  public int effectiveInactivityDays() {
    return inactivityDays != null && inactivityDays > 0 ? inactivityDays : DEFAULT_INACTIVITY_DAYS;
  }
}
