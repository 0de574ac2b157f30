package io.pagereach.engine.compliance;

import java.time.Duration;

/**
 * Policy-restricted message tags. A tag may only be used for its narrow purpose and only when the
 * campaign declares it explicitly. The cooldown is the minimum gap between two sends of the same
 * tag to the same contact.
 */
public enum MessageTag {
  CONFIRMED_EVENT_UPDATE(Duration.ofHours(24)),
  POST_PURCHASE_UPDATE(Duration.ofHours(24)),
  ACCOUNT_UPDATE(Duration.ofHours(12)),
  HUMAN_AGENT(Duration.ofDays(7));

  private final Duration cooldown;

  MessageTag(Duration cooldown) {
    this.cooldown = cooldown;
  }

  public Duration cooldown() {
    return cooldown;
  }

  public BypassMethod bypassMethod() {
    return switch (this) {
      case CONFIRMED_EVENT_UPDATE -> BypassMethod.MESSAGE_TAG_CONFIRMED_EVENT_UPDATE;
      case POST_PURCHASE_UPDATE -> BypassMethod.MESSAGE_TAG_POST_PURCHASE_UPDATE;
      case ACCOUNT_UPDATE -> BypassMethod.MESSAGE_TAG_ACCOUNT_UPDATE;
      case HUMAN_AGENT -> BypassMethod.MESSAGE_TAG_HUMAN_AGENT;
    };
  }
}
