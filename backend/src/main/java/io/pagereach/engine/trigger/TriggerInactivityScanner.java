package io.pagereach.engine.trigger;

import io.pagereach.engine.campaign.Campaign;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignStatus;
import io.pagereach.engine.campaign.CampaignType;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Inactivity has no event of its own, so active trigger campaigns with an INACTIVITY condition are
 * swept periodically. A contact fires at most once per inactivity period: contacts the campaign
 * fired for since the period began are skipped.
 */
@Component
public class TriggerInactivityScanner {

  private static final Logger log = LoggerFactory.getLogger(TriggerInactivityScanner.class);

  private final CampaignRepository campaignRepository;
  private final ContactRepository contactRepository;
  private final TriggerCampaignService triggerService;
  private final Clock clock;
  private final int batchSize;

  public TriggerInactivityScanner(
      CampaignRepository campaignRepository,
      ContactRepository contactRepository,
      TriggerCampaignService triggerService,
      Clock clock,
      @Value("${engine.trigger.inactivity-batch-size:500}") int batchSize) {
    this.campaignRepository = campaignRepository;
    this.contactRepository = contactRepository;
    this.triggerService = triggerService;
    this.clock = clock;
    this.batchSize = batchSize;
  }

  @Scheduled(cron = "${engine.trigger.inactivity-cron:0 */15 * * * *}")
  public void scan() {
    int fired = 0;
    for (var campaign :
        campaignRepository.findByTypeAndStatus(CampaignType.TRIGGER, CampaignStatus.RUNNING)) {
      var config = campaign.getTriggerConfig();
      if (config == null || !config.hasCondition(TriggerEventType.INACTIVITY)) {
        continue;
      }
      try {
        fired += scan(campaign, config);
      } catch (Exception e) {
        log.error(
            "Inactivity scan of trigger campaign {} failed: {}",
            campaign.getId(),
            e.getMessage(),
            e);
      }
    }
    if (fired > 0) {
      log.info("Inactivity scan fired {} trigger messages", fired);
    }
  }

  int scan(Campaign campaign, TriggerConfig config) {
    int days =
        config.conditions().stream()
            .filter(c -> c.type() == TriggerEventType.INACTIVITY)
            .mapToInt(TriggerCondition::effectiveInactivityDays)
            .min()
            .orElse(TriggerCondition.DEFAULT_INACTIVITY_DAYS);
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    int fired = 0;
    int page = 0;
    List<Contact> candidates;
    do {
      // Fired contacts drop out of the result, so later pages may skip a few until the next sweep.
      candidates =
          contactRepository.findInactiveTriggerCandidates(
              campaign.getWorkspaceId(),
              campaign.getId(),
              cutoff,
              config.maxTriggersPerContact(),
              PageRequest.of(page++, batchSize));
      for (var contact : candidates) {
        var event = TriggerEvent.of(contact.getId(), TriggerEventType.INACTIVITY);
        if (triggerService.fireIfMatches(campaign, event, contact)) {
          fired++;
        }
      }
    } while (candidates.size() == batchSize);
    return fired;
  }
}
