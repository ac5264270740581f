package io.jobsite.core.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in the actor and source from the current request.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "approval_request")
 * @param entityId ID of the affected entity (not a FK)
 * @param actorId member ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, SCHEDULED
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    Map<String, Object> details) {}
