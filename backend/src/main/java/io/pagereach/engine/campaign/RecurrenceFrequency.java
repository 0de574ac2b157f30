package io.pagereach.engine.campaign;

public enum RecurrenceFrequency {
  DAILY,
  WEEKLY,
  MONTHLY
}
