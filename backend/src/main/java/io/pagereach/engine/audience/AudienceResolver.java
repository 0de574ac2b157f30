package io.pagereach.engine.audience;

import io.pagereach.engine.contact.Contact;
import io.pagereach.engine.contact.ContactRef;
import io.pagereach.engine.contact.ContactRepository;
import io.pagereach.engine.exception.InvalidStateException;
import io.pagereach.engine.segment.SegmentService;
import io.pagereach.engine.segment.filter.ContactFilterQueryService;
import io.pagereach.engine.segment.filter.FilterGroup;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns an audience descriptor into the ordered recipient list of a campaign run. Unsubscribed
 * contacts are never part of an audience. Dynamic segments are evaluated live in SQL and static
 * segment membership is re-read, so the result reflects the moment of the call; campaigns call this
 * once per run and keep the snapshot.
 */
@Service
public class AudienceResolver {

  private static final Logger log = LoggerFactory.getLogger(AudienceResolver.class);

  /** Upper bound on ids per IN list. */
  static final int ID_CHUNK_SIZE = 1000;

  private static final Comparator<Contact> AUDIENCE_ORDER =
      Comparator.comparing(Contact::getCreatedAt)
          .thenComparing(Contact::getId, AudienceResolver::compareUuids);

  private final ContactRepository contactRepository;
  private final SegmentService segmentService;
  private final ContactFilterQueryService filterQueryService;

  public AudienceResolver(
      ContactRepository contactRepository,
      SegmentService segmentService,
      ContactFilterQueryService filterQueryService) {
    this.contactRepository = contactRepository;
    this.segmentService = segmentService;
    this.filterQueryService = filterQueryService;
  }

  @Transactional(readOnly = true)
  public List<ContactRef> resolve(AudienceDescriptor audience) {
    if (audience.type() == null) {
      throw new InvalidStateException("Invalid audience", "Audience type is required");
    }
    List<Contact> contacts =
        switch (audience.type()) {
          case ALL ->
              contactRepository.findByWorkspaceIdAndSubscribedTrueOrderByCreatedAtAscIdAsc(
                  audience.workspaceId());
          case SEGMENT -> resolveSegment(audience);
          case PAGES ->
              audience.pageIds().isEmpty()
                  ? List.of()
                  : contactRepository
                      .findByWorkspaceIdAndPageIdInAndSubscribedTrueOrderByCreatedAtAscIdAsc(
                          audience.workspaceId(), audience.pageIds());
          case MANUAL, CSV -> byIds(audience.workspaceId(), audience.contactIds());
        };
    log.debug("Resolved {} audience to {} contacts", audience.type(), contacts.size());
    return contacts.stream().map(Contact::toRef).toList();
  }

  /** Number of workspace contacts the filter tree matches, subscribed or not. */
  @Transactional(readOnly = true)
  public long previewAudience(UUID workspaceId, FilterGroup filters) {
    return filterQueryService.countMatching(workspaceId, filters);
  }

  /**
   * Subscribed contacts among the given ids, in audience order. Used to narrow an earlier snapshot,
   * e.g. for later drip steps.
   */
  @Transactional(readOnly = true)
  public List<ContactRef> resolveContacts(UUID workspaceId, List<UUID> contactIds) {
    return byIds(workspaceId, contactIds).stream().map(Contact::toRef).toList();
  }

  private List<Contact> resolveSegment(AudienceDescriptor audience) {
    if (audience.segmentId() == null) {
      throw new InvalidStateException("Invalid audience", "Segment audience needs a segment id");
    }
    var segment = segmentService.require(audience.segmentId());
    if (segment.isDynamic()) {
      return filterQueryService.findMatching(segment.getWorkspaceId(), segment.getFilters(), true);
    }
    return contactRepository.findSubscribedSegmentMembers(
        segment.getId(), segment.getWorkspaceId());
  }

  /** Queries the ids in chunks and merges the chunks back into audience order. */
  private List<Contact> byIds(UUID workspaceId, List<UUID> contactIds) {
    if (contactIds.isEmpty()) {
      return List.of();
    }
    List<UUID> distinct = new ArrayList<>(new LinkedHashSet<>(contactIds));
    List<Contact> contacts = new ArrayList<>();
    for (int from = 0; from < distinct.size(); from += ID_CHUNK_SIZE) {
      var chunk = distinct.subList(from, Math.min(from + ID_CHUNK_SIZE, distinct.size()));
      contactRepository.findByIdInAndSubscribedTrueOrderByCreatedAtAscIdAsc(chunk).stream()
          .filter(c -> workspaceId == null || workspaceId.equals(c.getWorkspaceId()))
          .forEach(contacts::add);
    }
    if (distinct.size() > ID_CHUNK_SIZE) {
      contacts.sort(AUDIENCE_ORDER);
    }
    return contacts;
  }

  /** Byte-wise order, as PostgreSQL sorts uuid columns. */
  private static int compareUuids(UUID left, UUID right) {
    int high = Long.compareUnsigned(left.getMostSignificantBits(), right.getMostSignificantBits());
    return high != 0
        ? high
        : Long.compareUnsigned(left.getLeastSignificantBits(), right.getLeastSignificantBits());
  }
}
