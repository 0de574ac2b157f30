package io.pagereach.engine.compliance;

/**
 * How a message is allowed to reach a recipient. Declaration order is the resolution priority:
 * cheapest and least restrictive first, {@link #BLOCKED} last.
 */
public enum BypassMethod {
  WITHIN_WINDOW,
  OTN_TOKEN,
  RECURRING_NOTIFICATION,
  MESSAGE_TAG_CONFIRMED_EVENT_UPDATE,
  MESSAGE_TAG_POST_PURCHASE_UPDATE,
  MESSAGE_TAG_ACCOUNT_UPDATE,
  MESSAGE_TAG_HUMAN_AGENT,
  SPONSORED_MESSAGE,
  BLOCKED;

  public boolean isMessageTag() {
    return messageTag() != null;
  }

  /** The tag carried by a {@code MESSAGE_TAG_*} method, or null for every other method. */
  public MessageTag messageTag() {
    return switch (this) {
      case MESSAGE_TAG_CONFIRMED_EVENT_UPDATE -> MessageTag.CONFIRMED_EVENT_UPDATE;
      case MESSAGE_TAG_POST_PURCHASE_UPDATE -> MessageTag.POST_PURCHASE_UPDATE;
      case MESSAGE_TAG_ACCOUNT_UPDATE -> MessageTag.ACCOUNT_UPDATE;
      case MESSAGE_TAG_HUMAN_AGENT -> MessageTag.HUMAN_AGENT;
      default -> null;
    };
  }

  /** Whether sending with this method consumes or advances a persisted artifact. */
  public boolean usesArtifact() {
    return this == OTN_TOKEN || this == RECURRING_NOTIFICATION;
  }
}
