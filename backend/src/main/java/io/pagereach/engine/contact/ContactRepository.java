package io.pagereach.engine.contact;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactRepository extends JpaRepository<Contact, UUID> {

  List<Contact> findByWorkspaceIdAndSubscribedTrueOrderByCreatedAtAscIdAsc(UUID workspaceId);

  List<Contact> findByWorkspaceIdAndPageIdInAndSubscribedTrueOrderByCreatedAtAscIdAsc(
      UUID workspaceId, Collection<UUID> pageIds);

  List<Contact> findByIdInAndSubscribedTrueOrderByCreatedAtAscIdAsc(Collection<UUID> ids);

  List<Contact> findByIdIn(Collection<UUID> ids);

  /** Subscribed members of a static segment, oldest first. */
  @Query(
      """
      SELECT c FROM Contact c JOIN SegmentMember m ON m.contactId = c.id
      WHERE m.segmentId = :segmentId
        AND c.workspaceId = :workspaceId
        AND c.subscribed = true
      ORDER BY c.createdAt ASC, c.id ASC
      """)
  List<Contact> findSubscribedSegmentMembers(
      @Param("segmentId") UUID segmentId, @Param("workspaceId") UUID workspaceId);

  /**
   * Subscribed contacts silent since at least {@code cutoff} that a trigger campaign has not fired
   * for since then and that are still under its per-contact limit ({@code maxTriggers} 0 = none).
   */
  @Query(
      """
      SELECT c FROM Contact c
      WHERE c.workspaceId = :workspaceId
        AND c.subscribed = true
        AND (c.lastMessageFromContactAt IS NULL OR c.lastMessageFromContactAt <= :cutoff)
        AND NOT EXISTS (
          SELECT 1 FROM CampaignRecipient r
          WHERE r.campaignId = :campaignId AND r.contactId = c.id AND r.createdAt >= :cutoff)
        AND (:maxTriggers = 0 OR (
          SELECT COUNT(r2) FROM CampaignRecipient r2
          WHERE r2.campaignId = :campaignId AND r2.contactId = c.id) < :maxTriggers)
      ORDER BY c.createdAt ASC, c.id ASC
      """)
  List<Contact> findInactiveTriggerCandidates(
      @Param("workspaceId") UUID workspaceId,
      @Param("campaignId") UUID campaignId,
      @Param("cutoff") Instant cutoff,
      @Param("maxTriggers") long maxTriggers,
      Pageable pageable);
}
