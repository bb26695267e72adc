package io.b2mash.compliance.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AuditEventResponse(
    UUID id,
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    Map<String, Object> details,
    Instant occurredAt) {

  public static AuditEventResponse from(AuditEvent event) {
    return new AuditEventResponse(
        event.getId(),
        event.getEventType(),
        event.getEntityType(),
        event.getEntityId(),
        event.getActorId(),
        event.getDetails(),
        event.getOccurredAt());
  }
}
