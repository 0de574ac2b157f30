package io.pagereach.engine.stats;

import io.pagereach.engine.event.ContactRepliedEvent;
import io.pagereach.engine.event.ContactUnsubscribedEvent;
import io.pagereach.engine.event.LinkClickedEvent;
import io.pagereach.engine.event.MessageDeliveredEvent;
import io.pagereach.engine.event.MessageReadEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Feeds receipts from webhook ingestion into the stats aggregator. */
@Component
public class EngagementEventHandler {

  private static final Logger log = LoggerFactory.getLogger(EngagementEventHandler.class);

  private final CampaignStatsService statsService;

  public EngagementEventHandler(CampaignStatsService statsService) {
    this.statsService = statsService;
  }

  @EventListener
  public void onDelivered(MessageDeliveredEvent event) {
    int counted = statsService.recordDeliveryReceipts(event.platformMessageIds());
    log.debug(
        "Delivery receipt for {} message(s), {} newly counted",
        event.platformMessageIds().size(),
        counted);
  }

  @EventListener
  public void onRead(MessageReadEvent event) {
    int counted = statsService.recordRead(event.contactId(), event.watermark());
    log.debug("Read receipt from contact {}, {} newly counted", event.contactId(), counted);
  }

  @EventListener
  public void onReplied(ContactRepliedEvent event) {
    statsService.recordReply(event.contactId(), event.occurredAt());
  }

  @EventListener
  public void onClicked(LinkClickedEvent event) {
    if (!statsService.recordEngagement(
        event.campaignId(), event.contactId(), EngagementType.CLICKED)) {
      log.debug(
          "Click from contact {} on campaign {} not counted",
          event.contactId(),
          event.campaignId());
    }
  }

  @EventListener
  public void onUnsubscribed(ContactUnsubscribedEvent event) {
    statsService.recordUnsubscribe(event.contactId(), event.occurredAt());
  }
}
