package io.b2mash.compliance.audit;

import io.b2mash.compliance.multitenancy.RequestScopes;
import java.util.Map;
import java.util.UUID;

/**
 * Builder for {@link AuditEventRecord}. Organization and actor default to the values bound in
 * {@link RequestScopes}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("saved_view.created")
 *     .entityType("saved_view")
 *     .entityId(view.getId())
 *     .details(Map.of("name", view.getName()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String organizationId;
  private UUID actorId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder organizationId(String organizationId) {
    this.organizationId = organizationId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    String resolvedOrg = organizationId != null ? organizationId : RequestScopes.getOrgIdOrNull();
    UUID resolvedActor = actorId != null ? actorId : RequestScopes.getMemberIdOrNull();
    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedOrg, resolvedActor, details);
  }
}
