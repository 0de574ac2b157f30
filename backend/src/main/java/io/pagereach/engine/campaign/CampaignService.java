package io.pagereach.engine.campaign;

import io.pagereach.engine.audience.AudienceType;
import io.pagereach.engine.audit.AuditEventBuilder;
import io.pagereach.engine.audit.AuditService;
import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.exception.ResourceNotFoundException;
import io.pagereach.engine.stats.CampaignRecipientRepository;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Campaign administration: create, edit while DRAFT, duplicate and delete. */
@Service
public class CampaignService {

  private static final Logger log = LoggerFactory.getLogger(CampaignService.class);

  private final CampaignRepository campaignRepository;
  private final CampaignRecipientRepository recipientRepository;
  private final AuditService auditService;

  public CampaignService(
      CampaignRepository campaignRepository,
      CampaignRecipientRepository recipientRepository,
      AuditService auditService) {
    this.campaignRepository = campaignRepository;
    this.recipientRepository = recipientRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Campaign createDraft(UUID workspaceId, CampaignDraft draft) {
    validate(draft);
    var campaign = campaignRepository.save(new Campaign(workspaceId, draft));
    log.info("Created {} campaign {} ({})", campaign.getType(), campaign.getId(), draft.name());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("campaign.created")
            .entityType("campaign")
            .entityId(campaign.getId())
            .details(
                Map.of(
                    "name", campaign.getName(),
                    "type", campaign.getType().name(),
                    "audience_type", campaign.getAudienceType().name()))
            .build());
    return campaign;
  }

  @Transactional
  public Campaign updateDraft(UUID campaignId, CampaignDraft draft) {
    var campaign = require(campaignId);
    validate(draft);
    campaign.applyDraft(draft);
    var saved = campaignRepository.save(campaign);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("campaign.updated")
            .entityType("campaign")
            .entityId(saved.getId())
            .details(Map.of("name", saved.getName()))
            .build());
    return saved;
  }

  /** Copies the definition into a new DRAFT named "&lt;name&gt; (Copy)" with zeroed counters. */
  @Transactional
  public Campaign duplicate(UUID campaignId) {
    var source = require(campaignId);
    var original = source.toDraft();
    var copy =
        new CampaignDraft(
            original.name() + " (Copy)",
            original.description(),
            original.type(),
            original.audience(),
            original.content(),
            original.bypassMethod(),
            original.messageTag(),
            original.sponsored(),
            original.recurringTopic(),
            original.timezone(),
            original.recurringPattern(),
            original.dripSequence(),
            original.abVariants(),
            original.abWinnerCriteria());
    var campaign = campaignRepository.save(new Campaign(source.getWorkspaceId(), copy));
    log.info("Duplicated campaign {} as {}", campaignId, campaign.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("campaign.duplicated")
            .entityType("campaign")
            .entityId(campaign.getId())
            .details(Map.of("source_campaign_id", campaignId.toString()))
            .build());
    return campaign;
  }

  @Transactional
  public void delete(UUID campaignId) {
    var campaign = require(campaignId);
    if (!campaign.canDelete()) {
      throw new InvalidStateException(
          "Campaign not deletable",
          "Cannot delete campaign in status "
              + campaign.getStatus()
              + ". Only DRAFT, COMPLETED or CANCELLED campaigns can be deleted.");
    }
    int ledgerRows = recipientRepository.deleteByCampaignId(campaignId);
    campaignRepository.delete(campaign);
    log.info("Deleted campaign {} and {} recipient rows", campaignId, ledgerRows);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("campaign.deleted")
            .entityType("campaign")
            .entityId(campaignId)
            .details(Map.of("name", campaign.getName(), "status", campaign.getStatus().name()))
            .build());
  }

  @Transactional(readOnly = true)
  public Campaign require(UUID campaignId) {
    return campaignRepository
        .findById(campaignId)
        .orElseThrow(() -> new ResourceNotFoundException("Campaign", campaignId));
  }

  @Transactional(readOnly = true)
  public List<Campaign> listByWorkspace(UUID workspaceId) {
    return campaignRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceId);
  }

  void validate(CampaignDraft draft) {
    if (draft.name() == null || draft.name().isBlank()) {
      invalid("Campaign name is required");
    }
    validateAudience(draft);

    var type = draft.type() != null ? draft.type() : CampaignType.ONE_TIME;
    if (type == CampaignType.DRIP) {
      if (draft.dripSequence().isEmpty()) {
        invalid("A drip campaign needs at least one step");
      }
      for (DripStep step : draft.dripSequence()) {
        if (step.content() == null || step.content().isEmpty()) {
          invalid("Every drip step needs message content");
        }
        if (step.delayMinutes() < 0) {
          invalid("Drip step delay cannot be negative");
        }
      }
    } else if (draft.abVariants().isEmpty()
        && (draft.content() == null || draft.content().isEmpty())) {
      invalid("Message content is required");
    }

    if (type == CampaignType.RECURRING) {
      validatePattern(draft.recurringPattern());
    }
    if (!draft.abVariants().isEmpty()) {
      validateVariants(draft.abVariants());
    }
    if (draft.timezone() != null) {
      try {
        ZoneId.of(draft.timezone());
      } catch (DateTimeException e) {
        invalid("Unknown timezone " + draft.timezone());
      }
    }
    if (draft.bypassMethod() == BypassMethod.BLOCKED) {
      invalid("BLOCKED is not a send method");
    }
  }

  private void validateAudience(CampaignDraft draft) {
    var audience = draft.audience();
    if (audience == null || audience.type() == null) {
      invalid("Audience type is required");
      return;
    }
    if (audience.type() == AudienceType.SEGMENT && audience.segmentId() == null) {
      invalid("Segment audience needs a segment id");
    }
    if (audience.type() == AudienceType.PAGES && audience.pageIds().isEmpty()) {
      invalid("Page audience needs at least one page id");
    }
    if ((audience.type() == AudienceType.MANUAL || audience.type() == AudienceType.CSV)
        && audience.contactIds().isEmpty()) {
      invalid(audience.type() + " audience needs at least one contact id");
    }
  }

  private void validatePattern(RecurringPattern pattern) {
    if (pattern == null || pattern.frequency() == null) {
      invalid("A recurring campaign needs a recurring pattern");
      return;
    }
    if (pattern.frequency() == RecurrenceFrequency.WEEKLY) {
      if (pattern.daysOfWeek().isEmpty()) {
        invalid("A weekly pattern needs at least one day of week");
      }
      if (pattern.daysOfWeek().stream().anyMatch(d -> d == null || d < 0 || d > 6)) {
        invalid("Days of week run from 0 (Sunday) to 6 (Saturday)");
      }
    }
    Integer day = pattern.dayOfMonth();
    boolean monthly = pattern.frequency() == RecurrenceFrequency.MONTHLY;
    if (monthly && (day == null || day < 1 || day > 31)) {
      invalid("A monthly pattern needs a day of month between 1 and 31");
    }
    if (pattern.time() != null) {
      try {
        LocalTime.parse(pattern.time());
      } catch (DateTimeParseException e) {
        invalid("Recurring time must be HH:mm, got " + pattern.time());
      }
    }
  }

  private void validateVariants(List<AbVariant> variants) {
    if (variants.size() < 2) {
      invalid("An A/B test needs at least two variants");
    }
    int total = 0;
    var names = new HashSet<String>();
    for (AbVariant variant : variants) {
      if (variant.name() == null || !names.add(variant.name())) {
        invalid("Variant names must be present and unique");
      }
      if (variant.percentage() <= 0) {
        invalid("Variant percentages must be positive");
      }
      if (variant.content() == null || variant.content().isEmpty()) {
        invalid("Variant " + variant.name() + " needs message content");
      }
      total += variant.percentage();
    }
    if (total != 100) {
      invalid("Variant percentages must sum to 100, got " + total);
    }
  }

  private static void invalid(String detail) {
    throw new InvalidStateException("Invalid campaign", detail);
  }
}
