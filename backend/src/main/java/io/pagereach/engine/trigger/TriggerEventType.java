package io.pagereach.engine.trigger;

public enum TriggerEventType {
  NEW_CONTACT,
  TAG_ADDED,
  TAG_REMOVED,
  ENGAGEMENT_CHANGE,
  CUSTOM_FIELD_MATCH,
  INACTIVITY;

  /** Conditions on the contact's current state rather than on something that just happened. */
  public boolean isStateCondition() {
    return this == CUSTOM_FIELD_MATCH || this == INACTIVITY;
  }
}
