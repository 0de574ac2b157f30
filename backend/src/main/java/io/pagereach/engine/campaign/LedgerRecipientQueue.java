package io.pagereach.engine.campaign;

import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.dispatch.DispatchTarget;
import io.pagereach.engine.dispatch.RecipientQueue;
import io.pagereach.engine.stats.CampaignRecipient;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.data.domain.PageRequest;

/**
 * Recipient queue of one dispatch pass over a run's ledger rows. Serves rows without an outcome
 * whose deferral has expired, in sequence order, and never serves the same row twice within a
 * pass. The queue runs dry as soon as the campaign leaves RUNNING.
 *
 * <p>Every firing of a TRIGGER campaign is a run of its own, so for those campaigns the queue
 * serves due rows of all runs; their sequence numbers are unique across the campaign.
 *
 * <p>Not thread-safe; a pass pulls batches from a single thread.
 */
class LedgerRecipientQueue implements RecipientQueue {

  private final UUID campaignId;
  private final int runNumber;
  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final ContactRepository contactRepository;
  private final RunPlanner runPlanner;
  private final Clock clock;

  private Campaign campaign;
  private int lastSequence;

  LedgerRecipientQueue(
      UUID campaignId,
      int runNumber,
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      ContactRepository contactRepository,
      RunPlanner runPlanner,
      Clock clock) {
    this.campaignId = campaignId;
    this.runNumber = runNumber;
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.contactRepository = contactRepository;
    this.runPlanner = runPlanner;
    this.clock = clock;
  }

  @Override
  public List<DispatchTarget> nextBatch(int maxSize) {
    var status = campaignRepository.findStatusById(campaignId).orElse(null);
    if (status != CampaignStatus.RUNNING) {
      return List.of();
    }
    if (campaign == null) {
      campaign = campaignRepository.findById(campaignId).orElse(null);
      if (campaign == null) {
        return List.of();
      }
    }

    var page = PageRequest.of(0, maxSize);
    List<CampaignRecipient> rows =
        campaign.getType() == CampaignType.TRIGGER
            ? recipientRepository.findDueInAnyRun(campaignId, lastSequence, clock.instant(), page)
            : recipientRepository.findDue(
                campaignId, runNumber, lastSequence, clock.instant(), page);
    if (rows.isEmpty()) {
      return List.of();
    }
    lastSequence = rows.get(rows.size() - 1).getSequence();

    Map<UUID, Contact> contacts =
        contactRepository
            .findByIdIn(rows.stream().map(CampaignRecipient::getContactId).toList())
            .stream()
            .collect(Collectors.toMap(Contact::getId, Function.identity()));
    var preference = campaign.getBypassPreference();

    return rows.stream()
        .map(
            row -> {
              var contact = contacts.get(row.getContactId());
              // A deleted contact resolves to BLOCKED rather than disappearing from the run.
              ContactRef ref =
                  contact != null
                      ? contact.toRef()
                      : new ContactRef(row.getContactId(), row.getPageId(), null, null, false);
              return new DispatchTarget(
                  campaignId,
                  campaign.getWorkspaceId(),
                  row.getRunNumber(),
                  row.getSequence(),
                  ref,
                  runPlanner.contentFor(campaign, row.getRunNumber(), row.getVariantName()),
                  preference,
                  row.getVariantName());
            })
        .toList();
  }

  @Override
  public void defer(DispatchTarget target, Instant notBefore) {
    recipientRepository.defer(
        target.campaignId(), target.runNumber(), target.contact().contactId(), notBefore);
  }
}
