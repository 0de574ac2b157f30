package io.pagereach.engine.compliance;

import java.time.Duration;

/** Minimum gap between two sends on one recurring subscription. */
public enum RecurringFrequency {
  DAILY(Duration.ofHours(24)),
  WEEKLY(Duration.ofDays(7)),
  MONTHLY(Duration.ofDays(30));

  private final Duration interval;

  RecurringFrequency(Duration interval) {
    this.interval = interval;
  }

  public Duration interval() {
    return interval;
  }
}
