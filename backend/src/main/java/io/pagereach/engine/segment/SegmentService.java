package io.pagereach.engine.segment;

import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.exception.ResourceNotFoundException;
import io.pagereach.engine.segment.filter.ContactFilterQueryService;
import io.pagereach.engine.segment.filter.FilterGroup;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SegmentService {

  private static final Logger log = LoggerFactory.getLogger(SegmentService.class);

  private final SegmentRepository segmentRepository;
  private final SegmentMemberRepository memberRepository;
  private final ContactFilterQueryService filterQueryService;
  private final Clock clock;

  public SegmentService(
      SegmentRepository segmentRepository,
      SegmentMemberRepository memberRepository,
      ContactFilterQueryService filterQueryService,
      Clock clock) {
    this.segmentRepository = segmentRepository;
    this.memberRepository = memberRepository;
    this.filterQueryService = filterQueryService;
    this.clock = clock;
  }

  public record SegmentCalculation(UUID segmentId, int contactCount, Instant calculatedAt) {}

  @Transactional
  public Segment create(
      UUID workspaceId, String name, String description, SegmentType type, FilterGroup filters) {
    if (type == SegmentType.DYNAMIC && filters == null) {
      throw new InvalidStateException(
          "Invalid segment", "A dynamic segment needs a filter tree");
    }
    var segment =
        segmentRepository.save(new Segment(workspaceId, name, description, type, filters));
    log.info("Created {} segment {} ({})", type, segment.getId(), name);
    return segment;
  }

  @Transactional
  public Segment updateFilters(UUID segmentId, FilterGroup filters) {
    var segment = require(segmentId);
    if (!segment.isDynamic()) {
      throw new InvalidStateException(
          "Invalid segment", "Static segment " + segmentId + " has no filter tree");
    }
    segment.updateFilters(filters);
    return segmentRepository.save(segment);
  }

  /** Adds contacts to a static segment; contacts already present are skipped. */
  @Transactional
  public int addMembers(UUID segmentId, Collection<UUID> contactIds) {
    var segment = requireStatic(segmentId);
    int added = 0;
    for (UUID contactId : new LinkedHashSet<>(contactIds)) {
      if (!memberRepository.existsBySegmentIdAndContactId(segmentId, contactId)) {
        memberRepository.save(new SegmentMember(segmentId, contactId));
        added++;
      }
    }
    segment.recordCalculation(
        (int) memberRepository.countBySegmentId(segmentId), clock.instant());
    segmentRepository.save(segment);
    return added;
  }

  @Transactional
  public int removeMembers(UUID segmentId, Collection<UUID> contactIds) {
    var segment = requireStatic(segmentId);
    int removed = contactIds.isEmpty() ? 0 : memberRepository.deleteMembers(segmentId, contactIds);
    segment.recordCalculation(
        (int) memberRepository.countBySegmentId(segmentId), clock.instant());
    segmentRepository.save(segment);
    return removed;
  }

  /**
   * Re-evaluates a dynamic segment and replaces its cached membership, count and timestamp. For a
   * static segment only the count is refreshed. Campaigns snapshot their audience at launch, so a
   * recalculation never changes a running campaign's recipients.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public SegmentCalculation recalculate(UUID segmentId) {
    var segment = require(segmentId);
    Instant now = clock.instant();

    int count;
    if (segment.isDynamic()) {
      count =
          filterQueryService.replaceSegmentMembers(
              segmentId, segment.getWorkspaceId(), segment.getFilters(), now);
    } else {
      count = (int) memberRepository.countBySegmentId(segmentId);
    }

    segment.recordCalculation(count, now);
    segmentRepository.save(segment);
    log.info("Recalculated segment {}: {} contacts", segmentId, count);
    return new SegmentCalculation(segmentId, count, now);
  }

  @Transactional(readOnly = true)
  public List<Segment> findDynamicSegments() {
    return segmentRepository.findByType(SegmentType.DYNAMIC);
  }

  @Transactional(readOnly = true)
  public Segment require(UUID segmentId) {
    return segmentRepository
        .findById(segmentId)
        .orElseThrow(() -> new ResourceNotFoundException("Segment", segmentId));
  }

  private Segment requireStatic(UUID segmentId) {
    var segment = require(segmentId);
    if (segment.isDynamic()) {
      throw new InvalidStateException(
          "Invalid segment",
          "Members of dynamic segment " + segmentId + " come from its filter tree");
    }
    return segment;
  }
}
