package io.pagereach.engine.campaign;

import io.pagereach.engine.audience.AudienceDescriptor;
import io.pagereach.engine.audience.AudienceType;
import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.BypassPreference;
import io.pagereach.engine.compliance.MessageTag;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.integration.messaging.MessageContent;
import io.pagereach.engine.trigger.TriggerConfig;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Campaign definition, lifecycle status and running counters.
 *
 * <p>Counters are never written through the entity: they are {@code updatable = false} and only
 * change through the atomic increment queries in {@link CampaignRepository}. Status changes go
 * through the transition methods here (optimistically locked) or the run-finish CAS in the
 * repository, which also bumps the version so a stale entity cannot overwrite it.
 */
@Entity
@Table(name = "campaigns")
@DynamicUpdate
public class Campaign {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "campaign_type", nullable = false, length = 20)
  private CampaignType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CampaignStatus status = CampaignStatus.DRAFT;

  @Enumerated(EnumType.STRING)
  @Column(name = "audience_type", nullable = false, length = 20)
  private AudienceType audienceType;

  @Column(name = "segment_id")
  private UUID segmentId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "audience_page_ids", columnDefinition = "jsonb")
  private List<UUID> audiencePageIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "audience_contact_ids", columnDefinition = "jsonb")
  private List<UUID> audienceContactIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "message_content", columnDefinition = "jsonb")
  private MessageContent messageContent;

  @Enumerated(EnumType.STRING)
  @Column(name = "bypass_method", length = 50)
  private BypassMethod bypassMethod;

  @Enumerated(EnumType.STRING)
  @Column(name = "message_tag", length = 50)
  private MessageTag messageTag;

  @Column(name = "is_sponsored", nullable = false)
  private boolean sponsored;

  @Column(name = "recurring_topic", length = 100)
  private String recurringTopic;

  @Column(name = "scheduled_at")
  private Instant scheduledAt;

  @Column(name = "timezone", nullable = false, length = 50)
  private String timezone = "UTC";

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "recurring_pattern", columnDefinition = "jsonb")
  private RecurringPattern recurringPattern;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "drip_sequence", columnDefinition = "jsonb")
  private List<DripStep> dripSequence = new ArrayList<>();

  @Column(name = "is_ab_test", nullable = false)
  private boolean abTest;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "ab_variants", columnDefinition = "jsonb")
  private List<AbVariant> abVariants = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "ab_winner_criteria", length = 20)
  private AbWinnerCriteria abWinnerCriteria;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "trigger_config", columnDefinition = "jsonb")
  private TriggerConfig triggerConfig;

  @Column(name = "run_number", nullable = false)
  private int runNumber;

  @Column(name = "total_recipients", nullable = false, updatable = false)
  private int totalRecipients;

  @Column(name = "sent_count", nullable = false, updatable = false)
  private int sentCount;

  @Column(name = "delivered_count", nullable = false, updatable = false)
  private int deliveredCount;

  @Column(name = "failed_count", nullable = false, updatable = false)
  private int failedCount;

  @Column(name = "blocked_count", nullable = false, updatable = false)
  private int blockedCount;

  @Column(name = "opened_count", nullable = false, updatable = false)
  private int openedCount;

  @Column(name = "clicked_count", nullable = false, updatable = false)
  private int clickedCount;

  @Column(name = "replied_count", nullable = false, updatable = false)
  private int repliedCount;

  @Column(name = "unsubscribed_count", nullable = false, updatable = false)
  private int unsubscribedCount;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "last_run_started_at")
  private Instant lastRunStartedAt;

  @Column(name = "last_run_finished_at")
  private Instant lastRunFinishedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Campaign() {}

  public Campaign(UUID workspaceId, CampaignDraft draft) {
    this.workspaceId = workspaceId;
    this.createdAt = Instant.now();
    applyDraft(draft);
  }

  /**
   * Replaces the editable definition.
   *
   * @throws InvalidStateException if the campaign is not a DRAFT
   */
  public void applyDraft(CampaignDraft draft) {
    if (status != CampaignStatus.DRAFT) {
      throw new InvalidStateException(
          "Campaign not editable",
          "Cannot edit campaign in status " + status + ". Only DRAFT campaigns can be edited.");
    }
    this.name = draft.name();
    this.description = draft.description();
    this.type = draft.type() != null ? draft.type() : CampaignType.ONE_TIME;
    this.audienceType = draft.audience().type();
    this.segmentId = draft.audience().segmentId();
    this.audiencePageIds = new ArrayList<>(draft.audience().pageIds());
    this.audienceContactIds = new ArrayList<>(draft.audience().contactIds());
    this.messageContent = draft.content();
    this.bypassMethod = draft.bypassMethod();
    this.messageTag =
        draft.bypassMethod() != null && draft.bypassMethod().isMessageTag()
            ? draft.bypassMethod().messageTag()
            : draft.messageTag();
    this.sponsored = draft.sponsored() || draft.bypassMethod() == BypassMethod.SPONSORED_MESSAGE;
    this.recurringTopic = draft.recurringTopic();
    this.timezone = draft.timezone() != null ? draft.timezone() : "UTC";
    this.recurringPattern = draft.recurringPattern();
    this.dripSequence = new ArrayList<>(draft.dripSequence());
    this.abVariants = new ArrayList<>(draft.abVariants());
    this.abTest = !draft.abVariants().isEmpty();
    this.abWinnerCriteria = draft.abWinnerCriteria();
    this.updatedAt = Instant.now();
  }

  public CampaignDraft toDraft() {
    return new CampaignDraft(
        name,
        description,
        type,
        getAudience(),
        messageContent,
        bypassMethod,
        messageTag,
        sponsored,
        recurringTopic,
        timezone,
        recurringPattern,
        getDripSequence(),
        getAbVariants(),
        abWinnerCriteria);
  }

  public void schedule(Instant at) {
    requireTransition(CampaignStatus.SCHEDULED, "schedule");
    this.status = CampaignStatus.SCHEDULED;
    this.scheduledAt = at;
    this.updatedAt = Instant.now();
  }

  /** Moves into RUNNING for the given run. Counters are added separately by the repository. */
  public void startRun(int runNumber, Instant now) {
    requireTransition(CampaignStatus.RUNNING, "launch");
    this.status = CampaignStatus.RUNNING;
    this.runNumber = runNumber;
    if (this.startedAt == null) {
      this.startedAt = now;
    }
    this.lastRunStartedAt = now;
    this.updatedAt = now;
  }

  /**
   * Replaces the trigger conditions of a TRIGGER campaign that is not currently active.
   *
   * @throws InvalidStateException for other campaign types or while the trigger is active
   */
  public void configureTrigger(TriggerConfig config) {
    requireTrigger("configure trigger of");
    if (status != CampaignStatus.DRAFT && status != CampaignStatus.PAUSED) {
      throw new InvalidStateException(
          "Campaign not editable",
          "Cannot change trigger of campaign in status " + status + ". Must be DRAFT or PAUSED.");
    }
    this.triggerConfig = config;
    this.updatedAt = Instant.now();
  }

  /** Starts listening for contact events. A trigger campaign stays RUNNING until deactivated. */
  public void activateTrigger(Instant now) {
    requireTrigger("activate");
    if (status == CampaignStatus.RUNNING) {
      throw new InvalidStateException(
          "Invalid campaign status", "Trigger campaign " + id + " is already active");
    }
    requireTransition(CampaignStatus.RUNNING, "activate");
    this.status = CampaignStatus.RUNNING;
    if (this.startedAt == null) {
      this.startedAt = now;
    }
    this.updatedAt = now;
  }

  private void requireTrigger(String action) {
    if (type != CampaignType.TRIGGER) {
      throw new InvalidStateException(
          "Invalid campaign type", "Cannot " + action + " " + type + " campaign " + id);
    }
  }

  public void pause() {
    requireTransition(CampaignStatus.PAUSED, "pause");
    this.status = CampaignStatus.PAUSED;
    this.updatedAt = Instant.now();
  }

  public void resume() {
    if (status != CampaignStatus.PAUSED) {
      throw new InvalidStateException(
          "Invalid campaign status",
          "Cannot resume campaign in status " + status + ". Must be PAUSED.");
    }
    this.status = CampaignStatus.RUNNING;
    this.updatedAt = Instant.now();
  }

  public void cancel() {
    requireTransition(CampaignStatus.CANCELLED, "cancel");
    this.status = CampaignStatus.CANCELLED;
    this.updatedAt = Instant.now();
  }

  public boolean canDelete() {
    return status == CampaignStatus.DRAFT || status.isTerminal();
  }

  private void requireTransition(CampaignStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid campaign status", "Cannot " + action + " campaign in status " + status);
    }
  }

  public AudienceDescriptor getAudience() {
    return new AudienceDescriptor(
        workspaceId, audienceType, segmentId, getAudiencePageIds(), getAudienceContactIds());
  }

  public BypassPreference getBypassPreference() {
    return new BypassPreference(bypassMethod, messageTag, sponsored, recurringTopic);
  }

  public ZoneId getZoneId() {
    return ZoneId.of(timezone != null ? timezone : "UTC");
  }

  /** Recipients with a terminal outcome: sent, failed or blocked. */
  public int getProcessedCount() {
    return sentCount + failedCount + blockedCount;
  }

  public UUID getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public CampaignType getType() {
    return type;
  }

  public CampaignStatus getStatus() {
    return status;
  }

  public AudienceType getAudienceType() {
    return audienceType;
  }

  public UUID getSegmentId() {
    return segmentId;
  }

  public List<UUID> getAudiencePageIds() {
    return audiencePageIds != null ? audiencePageIds : List.of();
  }

  public List<UUID> getAudienceContactIds() {
    return audienceContactIds != null ? audienceContactIds : List.of();
  }

  public MessageContent getMessageContent() {
    return messageContent;
  }

  public BypassMethod getBypassMethod() {
    return bypassMethod;
  }

  public MessageTag getMessageTag() {
    return messageTag;
  }

  public boolean isSponsored() {
    return sponsored;
  }

  public String getRecurringTopic() {
    return recurringTopic;
  }

  public Instant getScheduledAt() {
    return scheduledAt;
  }

  public String getTimezone() {
    return timezone;
  }

  public RecurringPattern getRecurringPattern() {
    return recurringPattern;
  }

  public List<DripStep> getDripSequence() {
    return dripSequence != null ? dripSequence : List.of();
  }

  public boolean isAbTest() {
    return abTest;
  }

  public List<AbVariant> getAbVariants() {
    return abVariants != null ? abVariants : List.of();
  }

  public AbWinnerCriteria getAbWinnerCriteria() {
    return abWinnerCriteria;
  }

  public TriggerConfig getTriggerConfig() {
    return triggerConfig;
  }

  public int getRunNumber() {
    return runNumber;
  }

  public int getTotalRecipients() {
    return totalRecipients;
  }

  public int getSentCount() {
    return sentCount;
  }

  public int getDeliveredCount() {
    return deliveredCount;
  }

  public int getFailedCount() {
    return failedCount;
  }

  public int getBlockedCount() {
    return blockedCount;
  }

  public int getOpenedCount() {
    return openedCount;
  }

  public int getClickedCount() {
    return clickedCount;
  }

  public int getRepliedCount() {
    return repliedCount;
  }

  public int getUnsubscribedCount() {
    return unsubscribedCount;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getLastRunStartedAt() {
    return lastRunStartedAt;
  }

  public Instant getLastRunFinishedAt() {
    return lastRunFinishedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
