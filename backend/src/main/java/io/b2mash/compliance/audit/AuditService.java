package io.b2mash.compliance.audit;

import java.util.List;
import java.util.UUID;

/** Records audit events for writes to engine-owned resources (saved views). */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);

  /** Returns the current organization's events for one entity, newest first. */
  List<AuditEvent> findForEntity(UUID entityId);
}
