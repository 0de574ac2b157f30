package io.pagereach.engine.compliance;

import io.pagereach.engine.audit.AuditEventBuilder;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.event.RecurringOptOutEvent;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecurringSubscriptionService {

  private static final Logger log = LoggerFactory.getLogger(RecurringSubscriptionService.class);

  private final RecurringSubscriptionRepository subscriptionRepository;
  private final AuditService auditService;
  private final Clock clock;

  public RecurringSubscriptionService(
      RecurringSubscriptionRepository subscriptionRepository,
      AuditService auditService,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Cancels the contact's active subscriptions on the page. A null topic cancels every topic.
   *
   * @return number of subscriptions cancelled
   */
  @Transactional
  public int optOut(UUID contactId, UUID pageId, String topic) {
    var active =
        subscriptionRepository.findByContactIdAndPageIdAndStatus(
            contactId, pageId, SubscriptionStatus.ACTIVE);
    int cancelled = 0;
    for (var subscription : active) {
      if (topic != null && !topic.equals(subscription.getTopic())) {
        continue;
      }
      subscription.cancel(clock.instant());
      subscriptionRepository.save(subscription);
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("recurring_subscription.cancelled")
              .entityType("recurring_subscription")
              .entityId(subscription.getId())
              .actorType("WEBHOOK")
              .source("WEBHOOK")
              .details(Map.of("topic", String.valueOf(subscription.getTopic())))
              .build());
      cancelled++;
    }
    log.info(
        "Opt-out for contact {} on page {}: {} subscription(s) cancelled",
        contactId,
        pageId,
        cancelled);
    return cancelled;
  }

  @EventListener
  @Transactional
  public void onOptOut(RecurringOptOutEvent event) {
    optOut(event.contactId(), event.pageId(), event.topic());
  }
}
