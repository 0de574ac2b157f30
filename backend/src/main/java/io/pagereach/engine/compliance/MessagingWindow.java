package io.pagereach.engine.compliance;

import java.time.Duration;
import java.time.Instant;

/** Platform messaging windows measured from the recipient's last inbound message. */
public final class MessagingWindow {

  public static final Duration STANDARD = Duration.ofHours(24);

  /** Human-agent replies remain allowed for seven days after the last inbound message. */
  public static final Duration HUMAN_AGENT = Duration.ofDays(7);

  private MessagingWindow() {}

  public static boolean isOpen(Instant lastInbound, Instant now) {
    return isWithin(lastInbound, now, STANDARD);
  }

  public static boolean isWithin(Instant lastInbound, Instant now, Duration window) {
    if (lastInbound == null) {
      return false;
    }
    return Duration.between(lastInbound, now).compareTo(window) <= 0;
  }
}
