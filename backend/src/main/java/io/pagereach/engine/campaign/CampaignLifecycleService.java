package io.pagereach.engine.campaign;

import io.pagereach.engine.audience.AudienceResolver;
import io.pagereach.engine.audit.AuditEventBuilder;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.dispatch.DispatchSignals;
import io.pagereach.engine.event.CampaignDispatchRequestedEvent;
import io.pagereach.engine.event.CampaignStatusChangedEvent;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.exception.ResourceConflictException;
import io.pagereach.engine.exception.ResourceNotFoundException;
import io.pagereach.engine.stats.CampaignRecipient;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import io.pagereach.engine.stats.EngagementType;
import io.pagereach.engine.stats.RecipientOutcome;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The campaign state machine.
 *
 * <p>Starting a run snapshots the audience into the recipient ledger, adds the snapshot size to
 * {@code totalRecipients} and publishes a dispatch request that the {@link
 * CampaignDispatchCoordinator} picks up after commit. Pause and cancel raise the dispatcher's stop
 * flag; attempts already in flight finish and are still counted. A run ends through {@link
 * #completeRunIfFinished}, which moves the campaign to COMPLETED, or back to SCHEDULED when a
 * recurring or drip campaign has another run ahead.
 */
@Service
public class CampaignLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(CampaignLifecycleService.class);

  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final AudienceResolver audienceResolver;
  private final VariantAssigner variantAssigner;
  private final RunPlanner runPlanner;
  private final DispatchSignals dispatchSignals;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public CampaignLifecycleService(
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      AudienceResolver audienceResolver,
      VariantAssigner variantAssigner,
      RunPlanner runPlanner,
      DispatchSignals dispatchSignals,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.audienceResolver = audienceResolver;
    this.variantAssigner = variantAssigner;
    this.runPlanner = runPlanner;
    this.dispatchSignals = dispatchSignals;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public Campaign schedule(UUID campaignId, Instant scheduledAt) {
    var campaign = requireLaunchable(campaignId, "scheduled");
    Instant now = clock.instant();
    if (scheduledAt == null || !scheduledAt.isAfter(now)) {
      throw new InvalidStateException(
          "Invalid schedule", "Scheduled time must be in the future, got " + scheduledAt);
    }
    var oldStatus = campaign.getStatus();
    if (oldStatus != CampaignStatus.DRAFT) {
      throw new InvalidStateException(
          "Invalid campaign status",
          "Cannot schedule campaign in status " + oldStatus + ". Must be DRAFT.");
    }
    campaign.schedule(scheduledAt);
    var saved = saveTransition(campaign);

    log.info("Scheduled campaign {} for {}", campaignId, scheduledAt);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("campaign.scheduled")
            .entityType("campaign")
            .entityId(campaignId)
            .details(Map.of("scheduled_at", scheduledAt.toString()))
            .build());
    publishStatusChange(saved, oldStatus, now);
    return saved;
  }

  /**
   * Launches a DRAFT or SCHEDULED campaign now. The first run of a campaign is rejected when its
   * audience is empty.
   */
  @Transactional
  public Campaign launch(UUID campaignId) {
    var campaign = requireLaunchable(campaignId, "launched");
    if (campaign.getStatus() != CampaignStatus.DRAFT
        && campaign.getStatus() != CampaignStatus.SCHEDULED) {
      throw new InvalidStateException(
          "Invalid campaign status",
          "Cannot launch campaign in status "
              + campaign.getStatus()
              + ". Must be DRAFT or SCHEDULED.");
    }
    return startRun(campaign, campaign.getRunNumber() + 1, true);
  }

  /**
   * Starts the next run of a SCHEDULED campaign whose time has come. Returns false when the
   * campaign is no longer due, for example because it was cancelled or launched meanwhile.
   */
  @Transactional
  public boolean startScheduledRun(UUID campaignId) {
    var campaign = campaignRepository.findById(campaignId).orElse(null);
    if (campaign == null
        || campaign.getStatus() != CampaignStatus.SCHEDULED
        || campaign.getType() == CampaignType.TRIGGER
        || campaign.getScheduledAt() == null
        || campaign.getScheduledAt().isAfter(clock.instant())) {
      return false;
    }
    startRun(campaign, campaign.getRunNumber() + 1, false);
    return true;
  }

  @Transactional
  public Campaign pause(UUID campaignId) {
    var campaign = require(campaignId);
    var oldStatus = campaign.getStatus();
    campaign.pause();
    var saved = saveTransition(campaign);
    dispatchSignals.requestStop(campaignId);

    log.info(
        "Paused campaign {} at {} of {}",
        campaignId,
        saved.getProcessedCount(),
        saved.getTotalRecipients());
    auditTransition("campaign.paused", saved);
    publishStatusChange(saved, oldStatus, clock.instant());
    return saved;
  }

  @Transactional
  public Campaign resume(UUID campaignId) {
    var campaign = require(campaignId);
    var oldStatus = campaign.getStatus();
    campaign.resume();
    var saved = saveTransition(campaign);
    Instant now = clock.instant();

    log.info("Resumed campaign {} (run {})", campaignId, saved.getRunNumber());
    auditTransition("campaign.resumed", saved);
    publishStatusChange(saved, oldStatus, now);
    eventPublisher.publishEvent(
        new CampaignDispatchRequestedEvent(
            "campaign.dispatch_requested", campaignId, saved.getRunNumber(), now));
    return saved;
  }

  /**
   * Cancels a SCHEDULED, RUNNING or PAUSED campaign. Recipients not yet dispatched are abandoned;
   * counters keep what was already attempted.
   */
  @Transactional
  public Campaign cancel(UUID campaignId) {
    var campaign = require(campaignId);
    var oldStatus = campaign.getStatus();
    campaign.cancel();
    var saved = saveTransition(campaign);
    dispatchSignals.requestStop(campaignId);

    log.info(
        "Cancelled campaign {} with {} of {} recipients processed",
        campaignId,
        saved.getProcessedCount(),
        saved.getTotalRecipients());
    auditTransition("campaign.cancelled", saved);
    publishStatusChange(saved, oldStatus, clock.instant());
    return saved;
  }

  @Transactional(readOnly = true)
  public CampaignProgress getProgress(UUID campaignId) {
    return CampaignProgress.of(require(campaignId));
  }

  /**
   * Ends the current run if every recipient has a terminal outcome. Safe to call any number of
   * times from any thread: the status update is a compare-and-set, so exactly one caller performs
   * the transition and every other caller gets false. Trigger campaigns have no runs to end.
   */
  @Transactional
  public boolean completeRunIfFinished(UUID campaignId) {
    var campaign = campaignRepository.findById(campaignId).orElse(null);
    if (campaign == null
        || campaign.getType() == CampaignType.TRIGGER
        || campaign.getStatus() != CampaignStatus.RUNNING
        || campaign.getProcessedCount() < campaign.getTotalRecipients()) {
      return false;
    }

    Instant now = clock.instant();
    int runNumber = campaign.getRunNumber();
    Instant runStartedAt =
        campaign.getLastRunStartedAt() != null ? campaign.getLastRunStartedAt() : now;
    Optional<Instant> nextRun = runPlanner.nextRunAt(campaign, runStartedAt, now);
    var next = nextRun.isPresent() ? CampaignStatus.SCHEDULED : CampaignStatus.COMPLETED;

    int updated =
        campaignRepository.finishRun(
            campaignId,
            runNumber,
            CampaignStatus.RUNNING,
            next,
            nextRun.orElse(campaign.getScheduledAt()),
            nextRun.isPresent() ? null : now,
            now);
    if (updated == 0) {
      return false;
    }

    if (next == CampaignStatus.COMPLETED) {
      log.info(
          "Campaign {} completed after run {}: {} sent, {} failed, {} blocked of {}",
          campaignId,
          runNumber,
          campaign.getSentCount(),
          campaign.getFailedCount(),
          campaign.getBlockedCount(),
          campaign.getTotalRecipients());
    } else {
      log.info("Campaign {} finished run {}, next run at {}", campaignId, runNumber, nextRun.get());
    }

    var details = new LinkedHashMap<String, Object>();
    details.put("run_number", runNumber);
    details.put("total_recipients", campaign.getTotalRecipients());
    details.put("sent", campaign.getSentCount());
    details.put("failed", campaign.getFailedCount());
    details.put("blocked", campaign.getBlockedCount());
    nextRun.ifPresent(at -> details.put("next_run_at", at.toString()));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(
                next == CampaignStatus.COMPLETED ? "campaign.completed" : "campaign.run_finished")
            .entityType("campaign")
            .entityId(campaignId)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new CampaignStatusChangedEvent(
            "campaign.status_changed",
            campaignId,
            CampaignStatus.RUNNING.name(),
            next.name(),
            runNumber,
            now));
    return true;
  }

  private Campaign startRun(Campaign campaign, int runNumber, boolean manual) {
    UUID campaignId = campaign.getId();
    Instant now = clock.instant();
    var oldStatus = campaign.getStatus();

    List<ContactRef> audience = snapshotAudience(campaign, runNumber);
    if (audience.isEmpty() && manual && runNumber == 1) {
      throw new InvalidStateException(
          "Empty audience", "Campaign " + campaignId + " has no subscribed recipients");
    }

    Map<UUID, String> variants =
        campaign.isAbTest() && campaign.getType() != CampaignType.DRIP
            ? variantAssigner.assign(campaignId, runNumber, audience, campaign.getAbVariants())
            : Map.of();
    var rows = new ArrayList<CampaignRecipient>(audience.size());
    int sequence = 0;
    for (ContactRef contact : audience) {
      rows.add(
          new CampaignRecipient(
              campaignId,
              runNumber,
              ++sequence,
              contact.contactId(),
              contact.pageId(),
              variants.get(contact.contactId())));
    }
    recipientRepository.saveAll(rows);

    campaign.startRun(runNumber, now);
    saveTransition(campaign);
    campaignRepository.addRecipients(campaignId, rows.size());

    log.info(
        "Started run {} of campaign {} with {} recipients", runNumber, campaignId, rows.size());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(runNumber == 1 ? "campaign.launched" : "campaign.run_started")
            .entityType("campaign")
            .entityId(campaignId)
            .details(
                Map.of(
                    "run_number", runNumber,
                    "recipients", rows.size(),
                    "trigger", manual ? "manual" : "schedule"))
            .build());
    eventPublisher.publishEvent(
        new CampaignStatusChangedEvent(
            "campaign.status_changed",
            campaignId,
            oldStatus.name(),
            CampaignStatus.RUNNING.name(),
            runNumber,
            now));
    eventPublisher.publishEvent(
        new CampaignDispatchRequestedEvent(
            "campaign.dispatch_requested", campaignId, runNumber, now));

    return campaignRepository.findById(campaignId).orElseThrow();
  }

  /**
   * Recipients of a run. Drip steps after the first go to the launch snapshot, narrowed by the
   * step's condition on each recipient's engagement with the previous step.
   */
  private List<ContactRef> snapshotAudience(Campaign campaign, int runNumber) {
    var step = runPlanner.dripStep(campaign, runNumber);
    if (step == null || runNumber == 1) {
      return audienceResolver.resolve(campaign.getAudience());
    }
    var launchRows =
        recipientRepository.findByCampaignIdAndRunNumberOrderBySequenceAsc(campaign.getId(), 1);
    Map<UUID, CampaignRecipient> previous =
        recipientRepository
            .findByCampaignIdAndRunNumberOrderBySequenceAsc(campaign.getId(), runNumber - 1)
            .stream()
            .collect(Collectors.toMap(CampaignRecipient::getContactId, Function.identity()));
    List<UUID> eligible =
        launchRows.stream()
            .map(CampaignRecipient::getContactId)
            .filter(contactId -> meetsCondition(step.condition(), previous.get(contactId)))
            .toList();
    return audienceResolver.resolveContacts(campaign.getWorkspaceId(), eligible);
  }

  static boolean meetsCondition(DripCondition condition, CampaignRecipient previous) {
    if (condition == DripCondition.NONE) {
      return true;
    }
    if (previous == null || previous.getOutcome() != RecipientOutcome.SENT) {
      return false;
    }
    return switch (condition) {
      case REPLIED -> previous.hasEngagement(EngagementType.REPLIED);
      case NOT_REPLIED -> !previous.hasEngagement(EngagementType.REPLIED);
      case CLICKED -> previous.hasEngagement(EngagementType.CLICKED);
      case NOT_CLICKED -> !previous.hasEngagement(EngagementType.CLICKED);
      case NONE -> true;
    };
  }

  private Campaign saveTransition(Campaign campaign) {
    try {
      return campaignRepository.saveAndFlush(campaign);
    } catch (ObjectOptimisticLockingFailureException e) {
      throw new ResourceConflictException(
          "Campaign changed concurrently",
          "Campaign " + campaign.getId() + " was modified by another operation; retry");
    }
  }

  private void auditTransition(String eventType, Campaign campaign) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("campaign")
            .entityId(campaign.getId())
            .details(
                Map.of(
                    "run_number", campaign.getRunNumber(),
                    "total_recipients", campaign.getTotalRecipients(),
                    "processed", campaign.getProcessedCount()))
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

  /** Trigger campaigns are activated instead; see {@code TriggerCampaignService}. */
  private Campaign requireLaunchable(UUID campaignId, String action) {
    var campaign = require(campaignId);
    if (campaign.getType() == CampaignType.TRIGGER) {
      throw new InvalidStateException(
          "Invalid campaign type",
          "Trigger campaign " + campaignId + " is activated, not " + action);
    }
    return campaign;
  }

  private Campaign require(UUID campaignId) {
    return campaignRepository
        .findById(campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
  }
}
