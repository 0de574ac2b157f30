package io.pagereach.engine.trigger;

import io.pagereach.engine.event.ContactCreatedEvent;
import io.pagereach.engine.event.ContactFieldChangedEvent;
import io.pagereach.engine.event.ContactRepliedEvent;
import io.pagereach.engine.event.ContactTagChangedEvent;
import io.pagereach.engine.event.LinkClickedEvent;
import io.pagereach.engine.event.MessageReadEvent;
import io.pagereach.engine.stats.EngagementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Turns contact events from webhook ingestion into trigger evaluations. */
@Component
public class TriggerEventHandler {

  private static final Logger log = LoggerFactory.getLogger(TriggerEventHandler.class);

  private final TriggerCampaignService triggerService;

  public TriggerEventHandler(TriggerCampaignService triggerService) {
    this.triggerService = triggerService;
  }

  @EventListener
  public void onContactCreated(ContactCreatedEvent event) {
    evaluate(TriggerEvent.of(event.contactId(), TriggerEventType.NEW_CONTACT));
  }

  @EventListener
  public void onTagChanged(ContactTagChangedEvent event) {
    evaluate(TriggerEvent.tag(event.contactId(), event.tagName(), event.added()));
  }

  @EventListener
  public void onFieldChanged(ContactFieldChangedEvent event) {
    evaluate(TriggerEvent.of(event.contactId(), TriggerEventType.CUSTOM_FIELD_MATCH));
  }

  @EventListener
  public void onReplied(ContactRepliedEvent event) {
    evaluate(TriggerEvent.engagement(event.contactId(), EngagementType.REPLIED));
  }

  @EventListener
  public void onClicked(LinkClickedEvent event) {
    evaluate(TriggerEvent.engagement(event.contactId(), EngagementType.CLICKED));
  }

  @EventListener
  public void onRead(MessageReadEvent event) {
    evaluate(TriggerEvent.engagement(event.contactId(), EngagementType.OPENED));
  }

  private void evaluate(TriggerEvent event) {
    var fired = triggerService.evaluateContactEvent(event);
    if (!fired.isEmpty()) {
      log.debug("{} for contact {} fired campaigns {}", event.type(), event.contactId(), fired);
    }
  }
}
