package io.pagereach.engine.campaign;

import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.dispatch.CampaignDispatcher;
import io.pagereach.engine.dispatch.DeliveryListener;
import io.pagereach.engine.dispatch.DispatchSummary;
import io.pagereach.engine.event.CampaignDispatchRequestedEvent;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Connects the state machine to the dispatcher. A pass starts once the launch or resume that
 * requested it has committed, so the pass always sees the ledger rows and the RUNNING status.
 * When a pass drains its queue the run is checked for completion.
 */
@Component
public class CampaignDispatchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(CampaignDispatchCoordinator.class);

  private final CampaignDispatcher dispatcher;
  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final ContactRepository contactRepository;
  private final RunPlanner runPlanner;
  private final CampaignLifecycleService lifecycleService;
  private final DeliveryListener deliveryListener;
  private final Clock clock;

  public CampaignDispatchCoordinator(
      CampaignDispatcher dispatcher,
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      ContactRepository contactRepository,
      RunPlanner runPlanner,
      CampaignLifecycleService lifecycleService,
      DeliveryListener deliveryListener,
      Clock clock) {
    this.dispatcher = dispatcher;
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.contactRepository = contactRepository;
    this.runPlanner = runPlanner;
    this.lifecycleService = lifecycleService;
    this.deliveryListener = deliveryListener;
    this.clock = clock;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDispatchRequested(CampaignDispatchRequestedEvent event) {
    log.debug("Dispatch requested for campaign {} run {}", event.campaignId(), event.runNumber());
    startPass(event.campaignId(), event.runNumber());
  }

  /** Starts a background pass over the run's due recipients. */
  public CompletableFuture<DispatchSummary> startPass(UUID campaignId, int runNumber) {
    var queue =
        new LedgerRecipientQueue(
            campaignId,
            runNumber,
            campaignRepository,
            recipientRepository,
            contactRepository,
            runPlanner,
            clock);
    return dispatcher
        .dispatchAsync(campaignId, queue, deliveryListener)
        .whenComplete(
            (summary, ex) -> {
              if (ex != null) {
                log.error("Dispatch pass for campaign {} failed", campaignId, ex);
                return;
              }
              if (!summary.skipped() && !summary.stopped()) {
                checkCompletion(campaignId);
              }
            });
  }

  private void checkCompletion(UUID campaignId) {
    try {
      lifecycleService.completeRunIfFinished(campaignId);
    } catch (RuntimeException e) {
      // The scheduler re-checks RUNNING campaigns on its next poll.
      log.warn("Completion check for campaign {} failed: {}", campaignId, e.getMessage());
    }
  }
}
