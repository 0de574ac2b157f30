package io.pagereach.engine.campaign;

import java.time.Instant;
import java.util.List;

/**
 * When a recurring campaign runs.
 *
 * @param daysOfWeek WEEKLY only, 0 = Sunday through 6 = Saturday
 * @param dayOfMonth MONTHLY only, 1-31, clamped to the month's last day
 * @param time local time of day, {@code HH:mm}, in the campaign's timezone
 * @param endsAt no run starts at or after this instant; null runs forever
 */
public record RecurringPattern(
    RecurrenceFrequency frequency,
    List<Integer> daysOfWeek,
    Integer dayOfMonth,
    String time,
    Instant endsAt) {

  public RecurringPattern {
    daysOfWeek = daysOfWeek != null ? List.copyOf(daysOfWeek) : List.of();
  }
}
