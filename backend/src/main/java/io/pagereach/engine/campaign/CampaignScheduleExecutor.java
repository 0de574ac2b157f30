package io.pagereach.engine.campaign;

import io.pagereach.engine.dispatch.DispatchSignals;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Time-driven side of the state machine. Each poll starts the runs of SCHEDULED campaigns that
 * are due, and looks after RUNNING campaigns without an active pass: recipients whose deferral
 * expired get a new pass, and runs with nothing left pending are checked for completion. The
 * latter also picks up runs left behind by a restart. Active trigger campaigns never complete;
 * they only get a pass when some firing is due.
 */
@Component
public class CampaignScheduleExecutor {

  private static final Logger log = LoggerFactory.getLogger(CampaignScheduleExecutor.class);

  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final CampaignLifecycleService lifecycleService;
  private final CampaignDispatchCoordinator coordinator;
  private final DispatchSignals dispatchSignals;
  private final Clock clock;

  public CampaignScheduleExecutor(
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      CampaignLifecycleService lifecycleService,
      CampaignDispatchCoordinator coordinator,
      DispatchSignals dispatchSignals,
      Clock clock) {
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.lifecycleService = lifecycleService;
    this.coordinator = coordinator;
    this.dispatchSignals = dispatchSignals;
    this.clock = clock;
  }

  @Scheduled(
      initialDelayString = "${engine.scheduler.initial-delay-ms:10000}",
      fixedDelayString = "${engine.scheduler.poll-interval-ms:30000}")
  public void poll() {
    launchDueCampaigns();
    continueRunningCampaigns();
  }

  void launchDueCampaigns() {
    var due =
        campaignRepository.findByStatusAndScheduledAtLessThanEqual(
            CampaignStatus.SCHEDULED, clock.instant());
    int started = 0;
    for (var campaign : due) {
      if (campaign.getType() == CampaignType.TRIGGER) {
        continue;
      }
      try {
        if (lifecycleService.startScheduledRun(campaign.getId())) {
          started++;
        }
      } catch (Exception e) {
        log.error(
            "Failed to start scheduled run of campaign {}: {}",
            campaign.getId(),
            e.getMessage(),
            e);
      }
    }
    if (started > 0) {
      log.info("Scheduled launch completed: {} of {} due campaigns started", started, due.size());
    }
  }

  void continueRunningCampaigns() {
    Instant now = clock.instant();
    int passes = 0;
    for (var campaign : campaignRepository.findByStatus(CampaignStatus.RUNNING)) {
      var campaignId = campaign.getId();
      if (dispatchSignals.isActive(campaignId)) {
        continue;
      }
      try {
        if (campaign.getType() == CampaignType.TRIGGER) {
          if (recipientRepository.countDueInAnyRun(campaignId, now) > 0) {
            coordinator.startPass(campaignId, campaign.getRunNumber());
            passes++;
          }
          continue;
        }
        int runNumber = campaign.getRunNumber();
        if (recipientRepository.countByCampaignIdAndRunNumberAndOutcomeIsNull(
                campaignId, runNumber)
            == 0) {
          lifecycleService.completeRunIfFinished(campaignId);
        } else if (recipientRepository.countDue(campaignId, runNumber, now) > 0) {
          coordinator.startPass(campaignId, runNumber);
          passes++;
        }
      } catch (Exception e) {
        log.error("Failed to continue campaign {}: {}", campaignId, e.getMessage(), e);
      }
    }
    if (passes > 0) {
      log.debug("Started {} follow-up dispatch passes", passes);
    }
  }
}
