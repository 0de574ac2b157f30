package io.pagereach.engine.stats;

import io.pagereach.engine.compliance.BypassMethod;
import io.pagereach.engine.compliance.MessageTag;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface CampaignRecipientRepository extends JpaRepository<CampaignRecipient, UUID> {

  /** Projection for per-variant aggregation. */
  interface VariantCounts {
    String getVariantName();

    long getRecipients();

    long getSent();

    long getFailed();

    long getDelivered();

    long getOpened();

    long getClicked();

    long getReplied();
  }

  /**
   * Next slice of undecided rows for a run that are due now, after the given sequence. Keyset
   * pagination keeps a pass from handing out the same row twice.
   */
  @Query(
      """
      SELECT r FROM CampaignRecipient r
      WHERE r.campaignId = :campaignId
        AND r.runNumber = :runNumber
        AND r.outcome IS NULL
        AND r.sequence > :afterSequence
        AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now)
      ORDER BY r.sequence ASC
      """)
  List<CampaignRecipient> findDue(
      @Param("campaignId") UUID campaignId,
      @Param("runNumber") int runNumber,
      @Param("afterSequence") int afterSequence,
      @Param("now") Instant now,
      Pageable pageable);

  /** {@link #findDue} over every run of the campaign; used for trigger firings. */
  @Query(
      """
      SELECT r FROM CampaignRecipient r
      WHERE r.campaignId = :campaignId
        AND r.outcome IS NULL
        AND r.sequence > :afterSequence
        AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now)
      ORDER BY r.sequence ASC
      """)
  List<CampaignRecipient> findDueInAnyRun(
      @Param("campaignId") UUID campaignId,
      @Param("afterSequence") int afterSequence,
      @Param("now") Instant now,
      Pageable pageable);

  long countByCampaignIdAndRunNumberAndOutcomeIsNull(UUID campaignId, int runNumber);

  long countByCampaignId(UUID campaignId);

  @Query(
      "SELECT COUNT(DISTINCT r.contactId) FROM CampaignRecipient r"
          + " WHERE r.campaignId = :campaignId")
  long countDistinctContacts(@Param("campaignId") UUID campaignId);

  @Query(
      """
      SELECT COUNT(r) FROM CampaignRecipient r
      WHERE r.campaignId = :campaignId
        AND r.runNumber = :runNumber
        AND r.outcome IS NULL
        AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now)
      """)
  long countDue(
      @Param("campaignId") UUID campaignId,
      @Param("runNumber") int runNumber,
      @Param("now") Instant now);

  @Query(
      """
      SELECT COUNT(r) FROM CampaignRecipient r
      WHERE r.campaignId = :campaignId
        AND r.outcome IS NULL
        AND (r.nextAttemptAt IS NULL OR r.nextAttemptAt <= :now)
      """)
  long countDueInAnyRun(@Param("campaignId") UUID campaignId, @Param("now") Instant now);

  List<CampaignRecipient> findByCampaignIdAndRunNumberOrderBySequenceAsc(
      UUID campaignId, int runNumber);

  Optional<CampaignRecipient> findFirstByCampaignIdAndContactIdOrderByRunNumberDesc(
      UUID campaignId, UUID contactId);

  Optional<CampaignRecipient> findFirstByContactIdAndOutcomeOrderByCompletedAtDesc(
      UUID contactId, RecipientOutcome outcome);

  List<CampaignRecipient> findByPlatformMessageIdIn(Collection<String> platformMessageIds);

  @Query(
      """
      SELECT r FROM CampaignRecipient r
      WHERE r.contactId = :contactId
        AND r.outcome = :outcome
        AND r.readAt IS NULL
        AND r.completedAt <= :watermark
      """)
  List<CampaignRecipient> findUnreadUpTo(
      @Param("contactId") UUID contactId,
      @Param("outcome") RecipientOutcome outcome,
      @Param("watermark") Instant watermark);

  @Query(
      """
      SELECT MAX(r.completedAt) FROM CampaignRecipient r
      WHERE r.contactId = :contactId AND r.messageTag = :tag AND r.outcome = :outcome
      """)
  Instant findLastSendAt(
      @Param("contactId") UUID contactId,
      @Param("tag") MessageTag tag,
      @Param("outcome") RecipientOutcome outcome);

  default Instant findLastTagSendAt(UUID contactId, MessageTag tag) {
    return findLastSendAt(contactId, tag, RecipientOutcome.SENT);
  }

  @Query(
      """
      SELECT r.variantName AS variantName,
             COUNT(r) AS recipients,
             SUM(CASE WHEN r.outcome = io.pagereach.engine.stats.RecipientOutcome.SENT
                 THEN 1 ELSE 0 END) AS sent,
             SUM(CASE WHEN r.outcome IN (
                 io.pagereach.engine.stats.RecipientOutcome.FAILED_PERMANENT,
                 io.pagereach.engine.stats.RecipientOutcome.FAILED_EXHAUSTED)
                 THEN 1 ELSE 0 END) AS failed,
             SUM(CASE WHEN r.deliveredAt IS NOT NULL THEN 1 ELSE 0 END) AS delivered,
             SUM(CASE WHEN r.readAt IS NOT NULL THEN 1 ELSE 0 END) AS opened,
             SUM(CASE WHEN r.clickedAt IS NOT NULL THEN 1 ELSE 0 END) AS clicked,
             SUM(CASE WHEN r.repliedAt IS NOT NULL THEN 1 ELSE 0 END) AS replied
      FROM CampaignRecipient r
      WHERE r.campaignId = :campaignId AND r.variantName IS NOT NULL
      GROUP BY r.variantName
      ORDER BY r.variantName
      """)
  List<VariantCounts> countByVariant(@Param("campaignId") UUID campaignId);

  /** Claims the terminal outcome of a row. Returns 0 when an outcome was already recorded. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE CampaignRecipient r
      SET r.outcome = :outcome, r.bypassMethod = :method, r.messageTag = :tag,
          r.artifactId = :artifactId, r.platformMessageId = :platformMessageId,
          r.errorCode = :errorCode, r.errorMessage = :errorMessage,
          r.attemptCount = :attempts, r.completedAt = :now, r.nextAttemptAt = NULL
      WHERE r.campaignId = :campaignId
        AND r.runNumber = :runNumber
        AND r.contactId = :contactId
        AND r.outcome IS NULL
      """)
  int recordOutcome(
      @Param("campaignId") UUID campaignId,
      @Param("runNumber") int runNumber,
      @Param("contactId") UUID contactId,
      @Param("outcome") RecipientOutcome outcome,
      @Param("method") BypassMethod method,
      @Param("tag") MessageTag tag,
      @Param("artifactId") UUID artifactId,
      @Param("platformMessageId") String platformMessageId,
      @Param("errorCode") String errorCode,
      @Param("errorMessage") String errorMessage,
      @Param("attempts") int attempts,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE CampaignRecipient r
      SET r.nextAttemptAt = :notBefore, r.deferralCount = r.deferralCount + 1
      WHERE r.campaignId = :campaignId
        AND r.runNumber = :runNumber
        AND r.contactId = :contactId
        AND r.outcome IS NULL
      """)
  int defer(
      @Param("campaignId") UUID campaignId,
      @Param("runNumber") int runNumber,
      @Param("contactId") UUID contactId,
      @Param("notBefore") Instant notBefore);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE CampaignRecipient r SET r.deliveredAt = :now"
          + " WHERE r.id = :id AND r.deliveredAt IS NULL AND r.outcome = :sent")
  int markDelivered(
      @Param("id") UUID id, @Param("now") Instant now, @Param("sent") RecipientOutcome sent);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE CampaignRecipient r SET r.readAt = :now"
          + " WHERE r.id = :id AND r.readAt IS NULL AND r.outcome = :sent")
  int markRead(
      @Param("id") UUID id, @Param("now") Instant now, @Param("sent") RecipientOutcome sent);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE CampaignRecipient r SET r.clickedAt = :now"
          + " WHERE r.id = :id AND r.clickedAt IS NULL AND r.outcome = :sent")
  int markClicked(
      @Param("id") UUID id, @Param("now") Instant now, @Param("sent") RecipientOutcome sent);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE CampaignRecipient r SET r.repliedAt = :now"
          + " WHERE r.id = :id AND r.repliedAt IS NULL AND r.outcome = :sent")
  int markReplied(
      @Param("id") UUID id, @Param("now") Instant now, @Param("sent") RecipientOutcome sent);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      "UPDATE CampaignRecipient r SET r.unsubscribedAt = :now"
          + " WHERE r.id = :id AND r.unsubscribedAt IS NULL AND r.outcome = :sent")
  int markUnsubscribed(
      @Param("id") UUID id, @Param("now") Instant now, @Param("sent") RecipientOutcome sent);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("DELETE FROM CampaignRecipient r WHERE r.campaignId = :campaignId")
  int deleteByCampaignId(@Param("campaignId") UUID campaignId);
}
