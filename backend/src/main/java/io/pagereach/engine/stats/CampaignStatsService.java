package io.pagereach.engine.stats;

import io.pagereach.engine.campaign.CampaignLifecycleService;
import io.pagereach.engine.campaign.CampaignRepository;
import io.pagereach.engine.dispatch.DeliveryListener;
import io.pagereach.engine.dispatch.DeliveryReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stats aggregator. A recipient's terminal outcome is claimed on its ledger row with a
 * compare-and-set, and only the caller that wins the claim increments the campaign counter, so
 * each (campaign, run, contact) is counted exactly once however often it is reported.
 *
 * <p>The claim and the increment commit together; the completion check runs afterwards in its own
 * transaction, so a failing check never loses a recorded outcome.
 */
@Service
public class CampaignStatsService implements DeliveryListener {

  private static final Logger log = LoggerFactory.getLogger(CampaignStatsService.class);

  /** Replies and unsubscribes are attributed to a send at most this old. */
  static final Duration ATTRIBUTION_WINDOW = Duration.ofDays(7);

  private final CampaignRecipientRepository recipientRepository;
  private final CampaignRepository campaignRepository;
  private final CampaignLifecycleService lifecycleService;
  private final TransactionTemplate txTemplate;
  private final Clock clock;

  public CampaignStatsService(
      CampaignRecipientRepository recipientRepository,
      CampaignRepository campaignRepository,
      CampaignLifecycleService lifecycleService,
      PlatformTransactionManager txManager,
      Clock clock) {
    this.recipientRepository = recipientRepository;
    this.campaignRepository = campaignRepository;
    this.lifecycleService = lifecycleService;
    this.txTemplate = new TransactionTemplate(txManager);
    this.clock = clock;
  }

  @Override
  public void onOutcome(DeliveryReport report) {
    record(report);
  }

  /** Records a dispatcher report. Returns false when the recipient already had an outcome. */
  public boolean record(DeliveryReport report) {
    Boolean counted = txTemplate.execute(status -> claimAndCount(report));
    if (Boolean.TRUE.equals(counted)) {
      checkCompletion(report.campaignId());
      return true;
    }
    return false;
  }

  /** Records an outcome against the contact's latest run of the campaign. */
  public boolean record(UUID campaignId, UUID contactId, RecipientOutcome outcome) {
    var row =
        recipientRepository.findFirstByCampaignIdAndContactIdOrderByRunNumberDesc(
            campaignId, contactId);
    if (row.isEmpty()) {
      log.warn("No recipient row for contact {} in campaign {}", contactId, campaignId);
      return false;
    }
    return record(campaignId, row.get().getRunNumber(), contactId, outcome);
  }

  public boolean record(UUID campaignId, int runNumber, UUID contactId, RecipientOutcome outcome) {
    return record(
        new DeliveryReport(
            campaignId, runNumber, contactId, outcome, null, null, null, null, null, null, 0));
  }

  /** Ends the campaign's current run if every recipient has an outcome. */
  public boolean checkCompletion(UUID campaignId) {
    try {
      return lifecycleService.completeRunIfFinished(campaignId);
    } catch (RuntimeException e) {
      log.warn("Completion check for campaign {} failed: {}", campaignId, e.getMessage());
      return false;
    }
  }

  private boolean claimAndCount(DeliveryReport report) {
    int claimed =
        recipientRepository.recordOutcome(
            report.campaignId(),
            report.runNumber(),
            report.contactId(),
            report.outcome(),
            report.method(),
            report.messageTag(),
            report.artifactId(),
            report.platformMessageId(),
            report.errorCode(),
            report.errorMessage(),
            report.attempts(),
            clock.instant());
    if (claimed == 0) {
      log.debug(
          "Outcome for contact {} in campaign {} run {} already recorded, ignoring {}",
          report.contactId(),
          report.campaignId(),
          report.runNumber(),
          report.outcome());
      return false;
    }

    UUID campaignId = report.campaignId();
    int incremented =
        switch (report.outcome()) {
          case SENT -> campaignRepository.incrementSent(campaignId);
          case BLOCKED -> campaignRepository.incrementBlocked(campaignId);
          case FAILED_PERMANENT, FAILED_EXHAUSTED -> campaignRepository.incrementFailed(campaignId);
        };
    if (incremented == 0) {
      log.warn("Campaign {} counters already cover all recipients, not counting", campaignId);
    }
    return true;
  }

  /** Counts an engagement on the contact's latest row of the campaign, at most once per type. */
  @Transactional
  public boolean recordEngagement(UUID campaignId, UUID contactId, EngagementType type) {
    return recipientRepository
        .findFirstByCampaignIdAndContactIdOrderByRunNumberDesc(campaignId, contactId)
        .map(row -> applyEngagement(row, type, clock.instant()))
        .orElse(false);
  }

  /** Marks delivery receipts by platform message id; returns the number newly counted. */
  @Transactional
  public int recordDeliveryReceipts(Collection<String> platformMessageIds) {
    if (platformMessageIds.isEmpty()) {
      return 0;
    }
    Instant now = clock.instant();
    int counted = 0;
    for (var row : recipientRepository.findByPlatformMessageIdIn(platformMessageIds)) {
      if (applyEngagement(row, EngagementType.DELIVERED, now)) {
        counted++;
      }
    }
    return counted;
  }

  /**
   * A read receipt covers every message sent to the contact up to the watermark. Read implies
   * delivered, so a missing delivery receipt is counted as well.
   */
  @Transactional
  public int recordRead(UUID contactId, Instant watermark) {
    Instant now = clock.instant();
    int counted = 0;
    var unread = recipientRepository.findUnreadUpTo(contactId, RecipientOutcome.SENT, watermark);
    for (var row : unread) {
      applyEngagement(row, EngagementType.DELIVERED, now);
      if (applyEngagement(row, EngagementType.OPENED, now)) {
        counted++;
      }
    }
    return counted;
  }

  @Transactional
  public boolean recordReply(UUID contactId, Instant repliedAt) {
    return attributeToLatestSend(contactId, repliedAt, EngagementType.REPLIED);
  }

  @Transactional
  public boolean recordUnsubscribe(UUID contactId, Instant unsubscribedAt) {
    return attributeToLatestSend(contactId, unsubscribedAt, EngagementType.UNSUBSCRIBED);
  }

  private boolean attributeToLatestSend(UUID contactId, Instant at, EngagementType type) {
    var latest =
        recipientRepository.findFirstByContactIdAndOutcomeOrderByCompletedAtDesc(
            contactId, RecipientOutcome.SENT);
    if (latest.isEmpty()) {
      return false;
    }
    var row = latest.get();
    if (row.getCompletedAt() == null
        || row.getCompletedAt().isAfter(at)
        || Duration.between(row.getCompletedAt(), at).compareTo(ATTRIBUTION_WINDOW) > 0) {
      log.debug("{} from contact {} outside attribution window, ignoring", type, contactId);
      return false;
    }
    return applyEngagement(row, type, clock.instant());
  }

  private boolean applyEngagement(CampaignRecipient row, EngagementType type, Instant now) {
    int marked =
        switch (type) {
          case DELIVERED ->
              recipientRepository.markDelivered(row.getId(), now, RecipientOutcome.SENT);
          case OPENED -> recipientRepository.markRead(row.getId(), now, RecipientOutcome.SENT);
          case CLICKED -> recipientRepository.markClicked(row.getId(), now, RecipientOutcome.SENT);
          case REPLIED -> recipientRepository.markReplied(row.getId(), now, RecipientOutcome.SENT);
          case UNSUBSCRIBED ->
              recipientRepository.markUnsubscribed(row.getId(), now, RecipientOutcome.SENT);
        };
    if (marked == 0) {
      return false;
    }
    UUID campaignId = row.getCampaignId();
    switch (type) {
      case DELIVERED -> campaignRepository.incrementDelivered(campaignId);
      case OPENED -> campaignRepository.incrementOpened(campaignId);
      case CLICKED -> campaignRepository.incrementClicked(campaignId);
      case REPLIED -> campaignRepository.incrementReplied(campaignId);
      case UNSUBSCRIBED -> campaignRepository.incrementUnsubscribed(campaignId);
    }
    return true;
  }
}
