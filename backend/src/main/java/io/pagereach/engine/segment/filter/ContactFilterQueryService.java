package io.pagereach.engine.segment.filter;

import io.pagereach.engine.contact.Contact;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs filter trees against the {@code contacts} table with native SQL built by {@link
 * FilterSqlTranslator}. Every query is scoped to one workspace.
 */
@Service
public class ContactFilterQueryService {

  private final FilterSqlTranslator translator;
  private final Clock clock;

  @PersistenceContext private EntityManager entityManager;

  public ContactFilterQueryService(FilterSqlTranslator translator, Clock clock) {
    this.translator = translator;
    this.clock = clock;
  }

  /** Workspace contacts the tree matches, oldest first. */
  @Transactional(readOnly = true)
  @SuppressWarnings("unchecked")
  public List<Contact> findMatching(UUID workspaceId, FilterGroup filters, boolean subscribedOnly) {
    Map<String, Object> params = new HashMap<>();
    String where = translator.buildWhereClause(filters, params, clock.instant());
    params.put("workspaceId", workspaceId);

    String sql =
        "SELECT c.* FROM contacts c WHERE c.workspace_id = :workspaceId"
            + (subscribedOnly ? " AND c.is_subscribed = TRUE" : "")
            + " AND "
            + where
            + " ORDER BY c.created_at ASC, c.id ASC";
    var query = entityManager.createNativeQuery(sql, Contact.class);
    params.forEach(query::setParameter);
    return query.getResultList();
  }

  /** Number of workspace contacts the tree matches, subscribed or not. */
  @Transactional(readOnly = true)
  public long countMatching(UUID workspaceId, FilterGroup filters) {
    Map<String, Object> params = new HashMap<>();
    String where = translator.buildWhereClause(filters, params, clock.instant());
    params.put("workspaceId", workspaceId);

    var query =
        entityManager.createNativeQuery(
            "SELECT COUNT(*) FROM contacts c WHERE c.workspace_id = :workspaceId AND " + where);
    params.forEach(query::setParameter);
    return ((Number) query.getSingleResult()).longValue();
  }

  /**
   * Replaces a segment's cached membership with the contacts its tree matches, in two statements
   * inside the caller's transaction.
   *
   * @return number of members written
   */
  @Transactional
  public int replaceSegmentMembers(
      UUID segmentId, UUID workspaceId, FilterGroup filters, Instant now) {
    Map<String, Object> params = new HashMap<>();
    String where = translator.buildWhereClause(filters, params, now);
    params.put("segmentId", segmentId);
    params.put("workspaceId", workspaceId);
    params.put("addedAt", now.atOffset(ZoneOffset.UTC));

    entityManager.flush();
    entityManager
        .createNativeQuery("DELETE FROM segment_members WHERE segment_id = :segmentId")
        .setParameter("segmentId", segmentId)
        .executeUpdate();

    var insert =
        entityManager.createNativeQuery(
            "INSERT INTO segment_members (id, segment_id, contact_id, added_at)"
                + " SELECT gen_random_uuid(), :segmentId, c.id, :addedAt FROM contacts c"
                + " WHERE c.workspace_id = :workspaceId AND "
                + where);
    params.forEach(insert::setParameter);
    return insert.executeUpdate();
  }
}
