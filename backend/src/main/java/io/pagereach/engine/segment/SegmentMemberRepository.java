package io.pagereach.engine.segment;

import java.util.Collection;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SegmentMemberRepository extends JpaRepository<SegmentMember, UUID> {

  long countBySegmentId(UUID segmentId);

  boolean existsBySegmentIdAndContactId(UUID segmentId, UUID contactId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "DELETE FROM SegmentMember m WHERE m.segmentId = :segmentId AND m.contactId IN :contactIds")
  int deleteMembers(
      @Param("segmentId") UUID segmentId, @Param("contactIds") Collection<UUID> contactIds);
}
