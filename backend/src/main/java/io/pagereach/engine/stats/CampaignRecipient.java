package io.pagereach.engine.stats;

import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.MessageTag;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger row for one recipient of one campaign run. Rows are written when a run snapshots its
 * audience; the outcome and engagement columns are then only filled through the conditional
 * updates in {@link CampaignRecipientRepository}, which is what makes counting idempotent.
 */
@Entity
@Table(
    name = "campaign_recipients",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"campaign_id", "run_number", "contact_id"}))
public class CampaignRecipient {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "campaign_id", nullable = false)
  private UUID campaignId;

  @Column(name = "run_number", nullable = false)
  private int runNumber;

  @Column(name = "sequence", nullable = false)
  private int sequence;

  @Column(name = "contact_id", nullable = false)
  private UUID contactId;

  @Column(name = "page_id", nullable = false)
  private UUID pageId;

  @Column(name = "variant_name", length = 50)
  private String variantName;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", length = 30)
  private RecipientOutcome outcome;

  @Enumerated(EnumType.STRING)
  @Column(name = "bypass_method", length = 50)
  private BypassMethod bypassMethod;

  @Enumerated(EnumType.STRING)
  @Column(name = "message_tag", length = 50)
  private MessageTag messageTag;

  @Column(name = "artifact_id")
  private UUID artifactId;

  @Column(name = "platform_message_id", length = 128)
  private String platformMessageId;

  @Column(name = "error_code", length = 64)
  private String errorCode;

  @Column(name = "error_message", length = 500)
  private String errorMessage;

  @Column(name = "attempt_count", nullable = false)
  private int attemptCount;

  @Column(name = "deferral_count", nullable = false)
  private int deferralCount;

  @Column(name = "next_attempt_at")
  private Instant nextAttemptAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "delivered_at")
  private Instant deliveredAt;

  @Column(name = "read_at")
  private Instant readAt;

  @Column(name = "clicked_at")
  private Instant clickedAt;

  @Column(name = "replied_at")
  private Instant repliedAt;

  @Column(name = "unsubscribed_at")
  private Instant unsubscribedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CampaignRecipient() {}

  public CampaignRecipient(
      UUID campaignId,
      int runNumber,
      int sequence,
      UUID contactId,
      UUID pageId,
      String variantName) {
    this.campaignId = campaignId;
    this.runNumber = runNumber;
    this.sequence = sequence;
    this.contactId = contactId;
    this.pageId = pageId;
    this.variantName = variantName;
    this.createdAt = Instant.now();
  }

  public boolean hasEngagement(EngagementType type) {
    return switch (type) {
      case DELIVERED -> deliveredAt != null;
      case OPENED -> readAt != null;
      case CLICKED -> clickedAt != null;
      case REPLIED -> repliedAt != null;
      case UNSUBSCRIBED -> unsubscribedAt != null;
    };
  }

  public UUID getId() {
    return id;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public int getRunNumber() {
    return runNumber;
  }

  public int getSequence() {
    return sequence;
  }

  public UUID getContactId() {
    return contactId;
  }

  public UUID getPageId() {
    return pageId;
  }

  public String getVariantName() {
    return variantName;
  }

  public RecipientOutcome getOutcome() {
    return outcome;
  }

  public BypassMethod getBypassMethod() {
    return bypassMethod;
  }

  public MessageTag getMessageTag() {
    return messageTag;
  }

  public UUID getArtifactId() {
    return artifactId;
  }

  public String getPlatformMessageId() {
    return platformMessageId;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public int getDeferralCount() {
    return deferralCount;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
  }

  public Instant getReadAt() {
    return readAt;
  }

  public Instant getClickedAt() {
    return clickedAt;
  }

  public Instant getRepliedAt() {
    return repliedAt;
  }

  public Instant getUnsubscribedAt() {
    return unsubscribedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
