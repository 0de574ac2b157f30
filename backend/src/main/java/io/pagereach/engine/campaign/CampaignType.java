package io.pagereach.engine.campaign;

public enum CampaignType {
  ONE_TIME,
  SCHEDULED,
  RECURRING,
  DRIP,
  /**
   * Activated rather than launched; sends to one contact at a time whenever a contact event
   * matches its trigger conditions. Never launched by the scheduler.
   */
  TRIGGER
}
