package io.pagereach.engine.dispatch;

import io.pagereach.engine.compliance.BypassPreference;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.integration.messaging.MessageContent;
import java.util.UUID;

/**
 * One recipient handed to the dispatcher. Bypass resolution happens right before the attempt, so
 * the target carries the campaign's preference rather than a resolved method.
 */
public record DispatchTarget(
    UUID campaignId,
    UUID workspaceId,
    int runNumber,
    int sequence,
    ContactRef contact,
    MessageContent content,
    BypassPreference preference,
    String variantName) {

  /** Stable key for artifact reservations; identical across retries of the same recipient. */
  public String reservationKey() {
    return campaignId + ":" + runNumber + ":" + contact.contactId();
  }

  public UUID pageId() {
    return contact.pageId();
  }

  public SendRateLimiter.SendSlot slot() {
    return new SendRateLimiter.SendSlot(contact.pageId(), workspaceId, contact.contactId());
  }
}
