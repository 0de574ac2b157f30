package io.pagereach.engine.compliance;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface RecurringSubscriptionRepository
    extends JpaRepository<RecurringSubscription, UUID> {

  /** Active subscriptions for the pair, optionally narrowed to one topic. */
  @Query(
      """
      SELECT s FROM RecurringSubscription s
      WHERE s.contactId = :contactId
        AND s.pageId = :pageId
        AND s.status = :status
        AND (CAST(:topic AS string) IS NULL OR s.topic = :topic)
        AND (s.reservationKey IS NULL OR s.reservationKey = :key OR s.reservedAt < :leaseCutoff)
      ORDER BY s.lastSentAt ASC NULLS FIRST
      """)
  List<RecurringSubscription> findReservable(
      @Param("contactId") UUID contactId,
      @Param("pageId") UUID pageId,
      @Param("status") SubscriptionStatus status,
      @Param("topic") String topic,
      @Param("key") String key,
      @Param("leaseCutoff") Instant leaseCutoff);

  List<RecurringSubscription> findByContactIdAndPageIdAndStatus(
      UUID contactId, UUID pageId, SubscriptionStatus status);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecurringSubscription s SET s.reservationKey = :key, s.reservedAt = :now
      WHERE s.id = :id
        AND s.status = :status
        AND (s.lastSentAt IS NULL OR s.lastSentAt <= :eligibleBefore)
        AND (s.reservationKey IS NULL OR s.reservationKey = :key OR s.reservedAt < :leaseCutoff)
      """)
  int reserve(
      @Param("id") UUID id,
      @Param("key") String key,
      @Param("status") SubscriptionStatus status,
      @Param("now") Instant now,
      @Param("eligibleBefore") Instant eligibleBefore,
      @Param("leaseCutoff") Instant leaseCutoff);

  /** Advances {@code lastSentAt} forward only and releases the reservation in the same write. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecurringSubscription s
      SET s.lastSentAt = :now, s.sendCount = s.sendCount + 1,
          s.reservationKey = NULL, s.reservedAt = NULL
      WHERE s.id = :id
        AND s.reservationKey = :key
        AND (s.lastSentAt IS NULL OR s.lastSentAt < :now)
      """)
  int advance(@Param("id") UUID id, @Param("key") String key, @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecurringSubscription s SET s.reservationKey = NULL, s.reservedAt = NULL
      WHERE s.id = :id AND s.reservationKey = :key
      """)
  int release(@Param("id") UUID id, @Param("key") String key);
}
