package io.pagereach.engine.trigger;

import io.pagereach.engine.audit.AuditEventBuilder;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.campaign.Campaign;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.campaign.CampaignStatus;
import io.pagereach.engine.campaign.CampaignType;
import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.dispatch.DispatchSignals;
import io.pagereach.engine.event.CampaignDispatchRequestedEvent;
import io.pagereach.engine.event.CampaignStatusChangedEvent;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.exception.ResourceNotFoundException;
import io.pagereach.engine.segment.filter.FilterCondition;
import io.pagereach.engine.segment.filter.FilterEvaluator;
import io.pagereach.engine.segment.filter.FilterGroup;
import io.pagereach.engine.stats.CampaignRecipient;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs TRIGGER campaigns. An active trigger campaign is RUNNING and never completes; every contact
 * event is checked against the conditions of the workspace's active trigger campaigns.
 *
 * <p>Each firing is a one-recipient run of its own: the run number is the contact's firing count
 * for the campaign and the sequence continues the campaign-wide count, both allocated under a row
 * lock on the campaign. The row then goes through the same ledger, dispatcher and stats as any
 * other recipient. Cooldown and the per-contact limit are read from the contact's previous firing.
 */
@Service
public class TriggerCampaignService {

  private static final Logger log = LoggerFactory.getLogger(TriggerCampaignService.class);

  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final ContactRepository contactRepository;
  private final FilterEvaluator filterEvaluator;
  private final DispatchSignals dispatchSignals;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate txTemplate;
  private final Clock clock;

  public TriggerCampaignService(
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      ContactRepository contactRepository,
      FilterEvaluator filterEvaluator,
      DispatchSignals dispatchSignals,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager txManager,
      Clock clock) {
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.contactRepository = contactRepository;
    this.filterEvaluator = filterEvaluator;
    this.dispatchSignals = dispatchSignals;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  @Transactional
  public Campaign configure(UUID campaignId, TriggerConfig config) {
    var campaign = require(campaignId);
    campaign.configureTrigger(config);
    var saved = campaignRepository.save(campaign);
    log.info(
        "Configured trigger campaign {} with {} conditions",
        campaignId,
        config.conditions().size());
    return saved;
  }

  /**
   * Starts firing for matching contact events. Firings deferred before a deactivation get a new
   * dispatch pass once the activation commits.
   */
  @Transactional
  public Campaign activateTrigger(UUID campaignId) {
    var campaign = require(campaignId);
    if (campaign.getTriggerConfig() == null || campaign.getTriggerConfig().conditions().isEmpty()) {
      throw new InvalidStateException(
          "Invalid trigger", "Trigger campaign " + campaignId + " has no conditions");
    }
    var oldStatus = campaign.getStatus();
    Instant now = clock.instant();
    campaign.activateTrigger(now);
    var saved = campaignRepository.saveAndFlush(campaign);

    log.info("Trigger campaign {} activated", campaignId);
    audit("campaign.trigger_activated", saved);
    publishStatusChange(saved, oldStatus, now);
    eventPublisher.publishEvent(
        new CampaignDispatchRequestedEvent(
            "campaign.dispatch_requested", campaignId, saved.getRunNumber(), now));
    return saved;
  }

  /** Stops firing. The campaign is PAUSED; firings already recorded keep their outcomes. */
  @Transactional
  public Campaign deactivateTrigger(UUID campaignId) {
    var campaign = require(campaignId);
    if (campaign.getType() != CampaignType.TRIGGER) {
      throw new InvalidStateException(
          "Invalid campaign type", "Campaign " + campaignId + " is not a trigger campaign");
    }
    var oldStatus = campaign.getStatus();
    campaign.pause();
    var saved = campaignRepository.saveAndFlush(campaign);
    dispatchSignals.requestStop(campaignId);

    log.info("Trigger campaign {} deactivated", campaignId);
    audit("campaign.trigger_deactivated", saved);
    publishStatusChange(saved, oldStatus, clock.instant());
    return saved;
  }

  /**
   * Checks the event against every active trigger campaign of the contact's workspace and fires
   * those that match. Unknown or unsubscribed contacts fire nothing.
   *
   * @return ids of the campaigns that fired
   */
  public List<UUID> evaluateContactEvent(TriggerEvent event) {
    var contact = contactRepository.findById(event.contactId()).orElse(null);
    if (contact == null || !contact.isSubscribed()) {
      return List.of();
    }
    var campaigns =
        campaignRepository.findByWorkspaceIdAndTypeAndStatus(
            contact.getWorkspaceId(), CampaignType.TRIGGER, CampaignStatus.RUNNING);
    var triggered = new ArrayList<UUID>();
    for (var campaign : campaigns) {
      if (fireIfMatches(campaign, event, contact)) {
        triggered.add(campaign.getId());
      }
    }
    return triggered;
  }

  /** Fires one campaign for the contact when its conditions match the event. */
  public boolean fireIfMatches(Campaign campaign, TriggerEvent event, Contact contact) {
    var config = campaign.getTriggerConfig();
    if (config == null || !matches(config, event, contact, clock.instant())) {
      return false;
    }
    return fire(campaign.getId(), contact);
  }

  /**
   * A firing needs a condition of the event's type that holds. With {@code matchAll} every other
   * condition must hold as well; conditions on contact state are checked against the contact as
   * it is now, conditions on other events never hold.
   */
  boolean matches(TriggerConfig config, TriggerEvent event, Contact contact, Instant now) {
    var conditions = config.conditions();
    boolean eventMatched =
        conditions.stream()
            .anyMatch(c -> c.type() == event.type() && holds(c, event, contact, now));
    if (!eventMatched || !config.matchAll()) {
      return eventMatched;
    }
    return conditions.stream().allMatch(c -> holds(c, event, contact, now));
  }

  private boolean holds(
      TriggerCondition condition, TriggerEvent event, Contact contact, Instant now) {
    if (condition.type() == null) {
      return false;
    }
    return switch (condition.type()) {
      case NEW_CONTACT -> event.type() == TriggerEventType.NEW_CONTACT;
      case TAG_ADDED, TAG_REMOVED ->
          event.type() == condition.type()
              && condition.tagName() != null
              && condition.tagName().equals(event.tagName());
      case ENGAGEMENT_CHANGE ->
          event.type() == TriggerEventType.ENGAGEMENT_CHANGE
              && event.engagement() != null
              && (condition.value() == null
                  || event.engagement().name().equalsIgnoreCase(String.valueOf(condition.value())));
      case CUSTOM_FIELD_MATCH -> customFieldMatches(condition, contact);
      case INACTIVITY -> isInactive(condition, contact, now);
    };
  }

  private boolean customFieldMatches(TriggerCondition condition, Contact contact) {
    if (condition.field() == null || condition.operator() == null) {
      return false;
    }
    var filter =
        new FilterCondition(
            "customField", condition.field(), condition.operator(), condition.value(), false);
    return filterEvaluator.matches(FilterGroup.and(filter), contact);
  }

  static boolean isInactive(TriggerCondition condition, Contact contact, Instant now) {
    Instant last = contact.getLastMessageFromContactAt();
    return last == null
        || !last.isAfter(now.minus(Duration.ofDays(condition.effectiveInactivityDays())));
  }

  /**
   * Records a firing and requests its dispatch. Returns false when the campaign is no longer
   * active, the contact is within its cooldown or at its limit, or a concurrent firing for the
   * same contact won.
   */
  boolean fire(UUID campaignId, Contact contact) {
    try {
      return Boolean.TRUE.equals(txTemplate.execute(status -> recordFiring(campaignId, contact)));
    } catch (DataIntegrityViolationException e) {
      log.debug(
          "Concurrent firing of trigger campaign {} for contact {} already recorded",
          campaignId,
          contact.getId());
      return false;
    }
  }

  private boolean recordFiring(UUID campaignId, Contact contact) {
    var campaign = campaignRepository.findByIdForUpdate(campaignId).orElse(null);
    if (campaign == null
        || campaign.getType() != CampaignType.TRIGGER
        || campaign.getStatus() != CampaignStatus.RUNNING
        || campaign.getTriggerConfig() == null) {
      return false;
    }
    var config = campaign.getTriggerConfig();
    Instant now = clock.instant();
    var previous =
        recipientRepository
            .findFirstByCampaignIdAndContactIdOrderByRunNumberDesc(campaignId, contact.getId())
            .orElse(null);
    if (previous != null && !allowsAnotherFiring(config, previous, now)) {
      return false;
    }

    int runNumber = previous != null ? previous.getRunNumber() + 1 : 1;
    int sequence = campaign.getTotalRecipients() + 1;
    recipientRepository.saveAndFlush(
        new CampaignRecipient(
            campaignId, runNumber, sequence, contact.getId(), contact.getPageId(), null));
    campaignRepository.addRecipients(campaignId, 1);

    log.info(
        "Trigger campaign {} fired for contact {} (firing {})",
        campaignId,
        contact.getId(),
        runNumber);
    eventPublisher.publishEvent(
        new CampaignDispatchRequestedEvent(
            "campaign.dispatch_requested", campaignId, runNumber, now));
    return true;
  }

  static boolean allowsAnotherFiring(
      TriggerConfig config, CampaignRecipient previous, Instant now) {
    if (config.maxTriggersPerContact() > 0
        && previous.getRunNumber() >= config.maxTriggersPerContact()) {
      return false;
    }
    return config.cooldownMinutes() <= 0
        || !previous
            .getCreatedAt()
            .plus(Duration.ofMinutes(config.cooldownMinutes()))
            .isAfter(now);
  }

  @Transactional(readOnly = true)
  public TriggerStats getTriggerStats(UUID campaignId) {
    var campaign = require(campaignId);
    if (campaign.getType() != CampaignType.TRIGGER) {
      throw new InvalidStateException(
          "Invalid campaign type", "Campaign " + campaignId + " is not a trigger campaign");
    }
    return new TriggerStats(
        campaignId,
        campaign.getStatus() == CampaignStatus.RUNNING,
        recipientRepository.countByCampaignId(campaignId),
        recipientRepository.countDistinctContacts(campaignId),
        campaign.getSentCount(),
        campaign.getFailedCount(),
        campaign.getBlockedCount());
  }

  private void audit(String eventType, Campaign campaign) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("campaign")
            .entityId(campaign.getId())
            .details(Map.of("total_triggered", campaign.getTotalRecipients()))
            .build());
  }

  private void publishStatusChange(Campaign campaign, CampaignStatus oldStatus, Instant now) {
    eventPublisher.publishEvent(
        new CampaignStatusChangedEvent(
            "campaign.status_changed",
            campaign.getId(),
            oldStatus.name(),
            campaign.getStatus().name(),
            campaign.getRunNumber(),
            now));
  }

  private Campaign require(UUID campaignId) {
    return campaignRepository
        .findById(campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
  }
}
