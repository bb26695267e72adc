package io.b2mash.compliance.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which fills organization and actor from the request scope.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code saved_view.created}
 * @param entityType the kind of entity being audited
 * @param entityId ID of the affected entity (may be deleted later)
 * @param organizationId tenant the event belongs to
 * @param actorId acting member; null for system-initiated events
 * @param details key field values; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String organizationId,
    UUID actorId,
    Map<String, Object> details) {}
