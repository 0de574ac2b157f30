package io.pagereach.engine.stats;

/** Receipts that arrive after a send. Each is counted at most once per ledger row. */
public enum EngagementType {
  DELIVERED,
  OPENED,
  CLICKED,
  REPLIED,
  UNSUBSCRIBED
}
