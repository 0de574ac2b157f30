package io.pagereach.engine.compliance;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface OtnTokenRepository extends JpaRepository<OtnToken, UUID> {

  Optional<OtnToken> findFirstByReservationKeyAndUsedFalse(String reservationKey);

  /**
   * Unused, opted-in, unexpired tokens for the pair whose reservation is free, expired, or already
   * held by the caller. Soonest-expiring first so short-lived tokens are spent before long ones.
   */
  @Query(
      """
      SELECT t FROM OtnToken t
      WHERE t.contactId = :contactId
        AND t.pageId = :pageId
        AND t.used = false
        AND t.token IS NOT NULL
        AND (t.expiresAt IS NULL OR t.expiresAt > :now)
        AND (t.reservationKey IS NULL OR t.reservationKey = :key OR t.reservedAt < :leaseCutoff)
      ORDER BY t.expiresAt ASC NULLS LAST, t.optedInAt ASC
      """)
  List<OtnToken> findReservable(
      @Param("contactId") UUID contactId,
      @Param("pageId") UUID pageId,
      @Param("key") String key,
      @Param("now") Instant now,
      @Param("leaseCutoff") Instant leaseCutoff);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE OtnToken t SET t.reservationKey = :key, t.reservedAt = :now
      WHERE t.id = :id
        AND t.used = false
        AND (t.reservationKey IS NULL OR t.reservationKey = :key OR t.reservedAt < :leaseCutoff)
      """)
  int reserve(
      @Param("id") UUID id,
      @Param("key") String key,
      @Param("now") Instant now,
      @Param("leaseCutoff") Instant leaseCutoff);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE OtnToken t SET t.used = true, t.usedAt = :now
      WHERE t.id = :id AND t.used = false AND t.reservationKey = :key
      """)
  int consume(@Param("id") UUID id, @Param("key") String key, @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE OtnToken t SET t.reservationKey = NULL, t.reservedAt = NULL
      WHERE t.id = :id AND t.used = false AND t.reservationKey = :key
      """)
  int release(@Param("id") UUID id, @Param("key") String key);
}
