package io.pagereach.engine.campaign;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Campaign persistence. Counter increments are single UPDATE statements so concurrent outcome
 * reports never lose an update; the terminal counters are guarded so their sum never exceeds
 * {@code totalRecipients}.
 */
public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

  @Query("SELECT c.status FROM Campaign c WHERE c.id = :id")
  Optional<CampaignStatus> findStatusById(@Param("id") UUID id);

  List<Campaign> findByStatus(CampaignStatus status);

  List<Campaign> findByStatusAndScheduledAtLessThanEqual(CampaignStatus status, Instant cutoff);

  List<Campaign> findByWorkspaceIdOrderByCreatedAtDesc(UUID workspaceId);

  List<Campaign> findByWorkspaceIdAndTypeAndStatus(
      UUID workspaceId, CampaignType type, CampaignStatus status);

  List<Campaign> findByTypeAndStatus(CampaignType type, CampaignStatus status);

  /** Locks the campaign row; trigger firings allocate their run and sequence under this lock. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM Campaign c WHERE c.id = :id")
  Optional<Campaign> findByIdForUpdate(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.totalRecipients = c.totalRecipients + :count WHERE c.id = :id")
  int addRecipients(@Param("id") UUID id, @Param("count") int count);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE Campaign c SET c.sentCount = c.sentCount + 1
      WHERE c.id = :id
        AND c.sentCount + c.failedCount + c.blockedCount < c.totalRecipients
      """)
  int incrementSent(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE Campaign c SET c.failedCount = c.failedCount + 1
      WHERE c.id = :id
        AND c.sentCount + c.failedCount + c.blockedCount < c.totalRecipients
      """)
  int incrementFailed(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE Campaign c SET c.blockedCount = c.blockedCount + 1
      WHERE c.id = :id
        AND c.sentCount + c.failedCount + c.blockedCount < c.totalRecipients
      """)
  int incrementBlocked(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.deliveredCount = c.deliveredCount + 1 WHERE c.id = :id")
  int incrementDelivered(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.openedCount = c.openedCount + 1 WHERE c.id = :id")
  int incrementOpened(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.clickedCount = c.clickedCount + 1 WHERE c.id = :id")
  int incrementClicked(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.repliedCount = c.repliedCount + 1 WHERE c.id = :id")
  int incrementReplied(@Param("id") UUID id);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query("UPDATE Campaign c SET c.unsubscribedCount = c.unsubscribedCount + 1 WHERE c.id = :id")
  int incrementUnsubscribed(@Param("id") UUID id);

  /**
   * Ends the given run when every recipient has a terminal outcome. Moves RUNNING to {@code next}
   * (COMPLETED, or SCHEDULED when another run follows). Returns 1 for exactly one caller; every
   * concurrent or later caller gets 0.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE Campaign c
      SET c.status = :next, c.scheduledAt = :scheduledAt, c.completedAt = :completedAt,
          c.lastRunFinishedAt = :now, c.updatedAt = :now, c.version = c.version + 1
      WHERE c.id = :id
        AND c.status = :running
        AND c.runNumber = :runNumber
        AND c.sentCount + c.failedCount + c.blockedCount >= c.totalRecipients
      """)
  int finishRun(
      @Param("id") UUID id,
      @Param("runNumber") int runNumber,
      @Param("running") CampaignStatus running,
      @Param("next") CampaignStatus next,
      @Param("scheduledAt") Instant scheduledAt,
      @Param("completedAt") Instant completedAt,
      @Param("now") Instant now);
}
