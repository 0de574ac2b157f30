package io.pagereach.engine.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "campaign", "otn_token")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorType SYSTEM, OPERATOR, or WEBHOOK
 * @param source origin of the action: API, DISPATCH, WEBHOOK, SCHEDULED
 * @param details key fields as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorType,
    String source,
    Map<String, Object> details) {}
